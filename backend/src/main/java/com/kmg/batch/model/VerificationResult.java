package com.kmg.batch.model;

public record VerificationResult(boolean verified, int matchedIds, int expectedIds, String reason) {
    public static VerificationResult ok(int matched, int expected) {
        return new VerificationResult(true, matched, expected, null);
    }

    public static VerificationResult rejected(int matched, int expected, String reason) {
        return new VerificationResult(false, matched, expected, reason);
    }
}
