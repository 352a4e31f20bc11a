package com.kmg.batch.service;

import com.kmg.batch.model.FailureCategory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {
    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void classifiesKnownProviderMessages() {
        assertThat(classifier.classify("Enqueued token limit reached for gpt-4o-mini"))
                .isEqualTo(FailureCategory.QUOTA);
        assertThat(classifier.classify("You exceeded your current quota, please check your plan and billing"))
                .isEqualTo(FailureCategory.QUOTA);
        assertThat(classifier.classify("SUBMIT: Batch submission failed (429): Too Many Requests"))
                .isEqualTo(FailureCategory.RATE_LIMIT);
        assertThat(classifier.classify("Incorrect API key provided"))
                .isEqualTo(FailureCategory.CREDENTIAL);
        assertThat(classifier.classify("403 Forbidden"))
                .isEqualTo(FailureCategory.PERMISSION);
        assertThat(classifier.classify("Request timed out"))
                .isEqualTo(FailureCategory.TIMEOUT);
        assertThat(classifier.classify("UPLOAD: File upload failed: connection error: Connection refused"))
                .isEqualTo(FailureCategory.NETWORK);
        assertThat(classifier.classify("no valid requests"))
                .isEqualTo(FailureCategory.INPUT_VALIDATION);
    }

    @Test
    void unknownOrBlankTextIsUnknown() {
        assertThat(classifier.classify("something odd happened")).isEqualTo(FailureCategory.UNKNOWN);
        assertThat(classifier.classify("")).isEqualTo(FailureCategory.UNKNOWN);
        assertThat(classifier.classify(null)).isEqualTo(FailureCategory.UNKNOWN);
    }
}
