package com.kmg.batch.model;

/**
 * Length statistics over genuine content responses of a merge.
 */
public record MergeAnalysis(int contentRows, double averageLength, int minLength, int maxLength) {
    public static final MergeAnalysis EMPTY = new MergeAnalysis(0, 0.0, 0, 0);
}
