package com.kmg.batch.model;

public record CostEstimate(
        int numRequests,
        String model,
        long inputTokens,
        long outputTokens,
        double regularCost,
        double batchCost,
        double savings,
        double discountRate
) {
}
