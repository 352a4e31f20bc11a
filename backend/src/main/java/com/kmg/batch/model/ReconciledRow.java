package com.kmg.batch.model;

import java.util.List;

public record ReconciledRow(
        int index,
        List<String> values,
        RowStatus status,
        String responseText,
        String sourceFile
) {
}
