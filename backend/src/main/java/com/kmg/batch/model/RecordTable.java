package com.kmg.batch.model;

import java.util.List;

/**
 * Ordered record set read from the input table. Row {@code i} has the stable index {@code i}.
 */
public record RecordTable(List<String> columns, List<List<String>> rows) {
    public RecordTable {
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int size() {
        return rows.size();
    }

    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    public String value(int rowIndex, String column) {
        int col = columnIndex(column);
        if (col < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<String> row = rows.get(rowIndex);
        return col < row.size() ? row.get(col) : "";
    }
}
