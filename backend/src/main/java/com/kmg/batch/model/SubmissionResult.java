package com.kmg.batch.model;

import java.nio.file.Path;

/**
 * Artifacts of a batch the provider reported as completed. {@code errorFile} may be null.
 */
public record SubmissionResult(String batchId, Path resultFile, Path errorFile, RequestCounts counts) {
}
