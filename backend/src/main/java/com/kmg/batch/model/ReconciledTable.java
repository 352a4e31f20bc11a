package com.kmg.batch.model;

import java.util.List;

public record ReconciledTable(List<String> columns, List<ReconciledRow> rows) {
    public static final String STATUS_COLUMN = "outcome_status";
    public static final String RESPONSE_COLUMN = "response_text";
    public static final String SOURCE_COLUMN = "source_file";
    public static final List<String> OUTCOME_COLUMNS = List.of(STATUS_COLUMN, RESPONSE_COLUMN, SOURCE_COLUMN);

    public List<Integer> missingIndices() {
        return rows.stream()
                .filter(row -> row.status() == RowStatus.MISSING)
                .map(ReconciledRow::index)
                .toList();
    }
}
