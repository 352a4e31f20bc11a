package com.kmg.batch.model;

public record MergeCounts(
        int completed,
        int missing,
        int duplicate,
        int contentOutcomes,
        int refusalOutcomes,
        int errorOutcomes,
        int undecodableLines,
        int unmatchedIds,
        int outOfRange
) {
}
