package com.kmg.batch.model;

import java.util.List;

/**
 * One poll of a provider batch.
 */
public record BatchPoll(
        String batchId,
        BatchStatus status,
        RequestCounts counts,
        String outputFileId,
        String errorFileId,
        List<String> errors
) {
    public BatchPoll {
        counts = counts == null ? RequestCounts.EMPTY : counts;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasOutputFile() {
        return outputFileId != null && !outputFileId.isBlank();
    }

    public boolean hasErrorFile() {
        return errorFileId != null && !errorFileId.isBlank();
    }
}
