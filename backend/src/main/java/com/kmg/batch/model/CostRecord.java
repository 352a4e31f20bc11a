package com.kmg.batch.model;

import java.time.OffsetDateTime;

public record CostRecord(
        long id,
        String jobName,
        String batchId,
        String model,
        int numRequests,
        int completedRequests,
        long inputTokens,
        long outputTokens,
        double regularCost,
        double batchCost,
        double savings,
        OffsetDateTime recordedAt
) {
}
