package com.kmg.batch.service;

import com.kmg.batch.model.FailureCategory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Buckets free-text provider diagnostics. First matching pattern wins.
 */
@Service
public class FailureClassifier {
    private static final Map<FailureCategory, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(FailureCategory.QUOTA, Pattern.compile(
                "quota|insufficient_quota|billing|enqueued token limit|token_limit_exceeded|resource_exhausted",
                Pattern.CASE_INSENSITIVE));
        PATTERNS.put(FailureCategory.RATE_LIMIT, Pattern.compile(
                "rate.?limit|too many requests|\\b429\\b", Pattern.CASE_INSENSITIVE));
        PATTERNS.put(FailureCategory.CREDENTIAL, Pattern.compile(
                "api.?key|unauthori[sz]ed|authentication|\\b401\\b", Pattern.CASE_INSENSITIVE));
        PATTERNS.put(FailureCategory.PERMISSION, Pattern.compile(
                "permission|forbidden|\\b403\\b", Pattern.CASE_INSENSITIVE));
        PATTERNS.put(FailureCategory.TIMEOUT, Pattern.compile(
                "time.?out|timed out|expired|deadline", Pattern.CASE_INSENSITIVE));
        PATTERNS.put(FailureCategory.NETWORK, Pattern.compile(
                "network|connection|unreachable|i/o error|unknownhost", Pattern.CASE_INSENSITIVE));
        PATTERNS.put(FailureCategory.INPUT_VALIDATION, Pattern.compile(
                "validation|invalid|malformed|no valid requests|too large|\\b400\\b", Pattern.CASE_INSENSITIVE));
    }

    public FailureCategory classify(String diagnostic) {
        if (diagnostic == null || diagnostic.isBlank()) {
            return FailureCategory.UNKNOWN;
        }
        for (Map.Entry<FailureCategory, Pattern> entry : PATTERNS.entrySet()) {
            if (entry.getValue().matcher(diagnostic).find()) {
                return entry.getKey();
            }
        }
        return FailureCategory.UNKNOWN;
    }
}
