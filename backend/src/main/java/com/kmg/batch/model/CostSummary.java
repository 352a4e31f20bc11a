package com.kmg.batch.model;

public record CostSummary(
        int totalJobs,
        int completedJobs,
        long totalRequests,
        double totalCost,
        long totalInputTokens,
        long totalOutputTokens,
        double totalSavings
) {
    public double avgCostPerRequest() {
        return totalRequests > 0 ? totalCost / totalRequests : 0.0;
    }
}
