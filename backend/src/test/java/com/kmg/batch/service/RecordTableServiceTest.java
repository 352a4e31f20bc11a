package com.kmg.batch.service;

import com.kmg.batch.model.RecordTable;
import com.kmg.batch.model.ReconciledRow;
import com.kmg.batch.model.ReconciledTable;
import com.kmg.batch.model.RowStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordTableServiceTest {
    @TempDir
    Path dir;

    private final RecordTableService service = new RecordTableService();

    @Test
    void readsHeaderAndRowsStrippingBomAndPaddingShortRows() throws IOException {
        Path csv = dir.resolve("records.csv");
        Files.writeString(csv, "\uFEFFImage Path,Content of P*,Note\n"
                + "a.jpg,\"Describe, briefly\",x\n"
                + "b.jpg,\"two\nlines\"\n", StandardCharsets.UTF_8);

        RecordTable table = service.read(csv);

        assertThat(table.columns()).containsExactly("Image Path", "Content of P*", "Note");
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.value(0, "Content of P*")).isEqualTo("Describe, briefly");
        assertThat(table.value(1, "Content of P*")).isEqualTo("two\nlines");
        assertThat(table.value(1, "Note")).isEmpty();
    }

    @Test
    void missingOrEmptyTableFails() throws IOException {
        Path empty = Files.writeString(dir.resolve("empty.csv"), "");

        assertThatThrownBy(() -> service.read(dir.resolve("absent.csv")))
                .isInstanceOf(RecordTableException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> service.read(empty))
                .isInstanceOf(RecordTableException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void writesReconciledTableWithOutcomeColumns() throws IOException {
        ReconciledTable table = new ReconciledTable(
                List.of("Image Path", ReconciledTable.STATUS_COLUMN, ReconciledTable.RESPONSE_COLUMN,
                        ReconciledTable.SOURCE_COLUMN),
                List.of(
                        new ReconciledRow(0, List.of("a.jpg"), RowStatus.COMPLETED, "text, with comma", "f.jsonl"),
                        new ReconciledRow(1, List.of("b.jpg"), RowStatus.MISSING, "", "")
                ));
        Path out = dir.resolve("out/merged.csv");

        service.write(table, out);
        RecordTable reread = service.read(out);

        assertThat(reread.columns()).containsExactly("Image Path", "outcome_status", "response_text", "source_file");
        assertThat(reread.rows().get(0)).containsExactly("a.jpg", "Completed", "text, with comma", "f.jsonl");
        assertThat(reread.value(1, "outcome_status")).isEqualTo("Missing");
    }

    @Test
    void missingRowsFileUsesOneBasedNumbers() throws IOException {
        Path file = dir.resolve("missing.txt");
        service.writeMissingRows(List.of(3, 7), file);
        Files.writeString(file, "\n7\nnot-a-number\n0\n", StandardCharsets.UTF_8,
                StandardOpenOption.APPEND);

        assertThat(Files.readAllLines(file)).startsWith("3", "7");
        assertThat(service.readMissingRows(file)).containsExactly(2, 6);
    }
}
