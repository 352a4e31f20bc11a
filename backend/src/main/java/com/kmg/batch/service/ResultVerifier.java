package com.kmg.batch.service;

import com.kmg.batch.config.BatchProperties.VerificationMode;
import com.kmg.batch.model.ParsedLine;
import com.kmg.batch.model.VerificationResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that a downloaded result file belongs to the job that submitted it. A job is only
 * marked completed once its result file passes this check.
 */
@Component
public class ResultVerifier {
    private final ResultLineParser parser;

    public ResultVerifier(ResultLineParser parser) {
        this.parser = parser;
    }

    public VerificationResult verify(Path resultFile, Set<Integer> submitted, VerificationMode mode) {
        if (resultFile == null || !Files.isRegularFile(resultFile)) {
            return VerificationResult.rejected(0, submitted.size(), "result file not found: " + resultFile);
        }

        Set<Integer> found = new TreeSet<>();
        try {
            for (ParsedLine parsed : parser.parseFile(resultFile)) {
                if (parsed.kind() == ParsedLine.Kind.OUTCOME) {
                    found.add(parsed.index());
                }
            }
        } catch (IOException e) {
            return VerificationResult.rejected(0, submitted.size(), "result file unreadable: " + e.getMessage());
        }

        Set<Integer> matched = new TreeSet<>(found);
        matched.retainAll(submitted);

        if (mode == VerificationMode.ANY) {
            return matched.isEmpty()
                    ? VerificationResult.rejected(0, submitted.size(), "no submitted ids in result file")
                    : VerificationResult.ok(matched.size(), submitted.size());
        }

        if (!found.equals(submitted)) {
            Set<Integer> absent = new TreeSet<>(submitted);
            absent.removeAll(found);
            Set<Integer> foreign = new TreeSet<>(found);
            foreign.removeAll(submitted);
            return VerificationResult.rejected(matched.size(), submitted.size(),
                    "result ids differ from submitted ids (absent " + absent.size()
                            + ", unexpected " + foreign.size() + ")");
        }
        return VerificationResult.ok(matched.size(), submitted.size());
    }
}
