package com.kmg.batch.model;

import java.nio.file.Path;
import java.util.List;

public record MergeResult(
        ReconciledTable table,
        MergeCounts counts,
        List<Path> resultFiles
) {
    /**
     * 1-based row numbers of rows that have no outcome, ascending.
     */
    public List<Integer> missingRowNumbers() {
        return table.missingIndices().stream().map(i -> i + 1).toList();
    }
}
