package com.kmg.batch.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.kmg.batch.model.ReconciledRow;
import com.kmg.batch.model.ReconciledTable;
import com.kmg.batch.model.RecordTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV reading and writing of record tables and missing-row side files.
 */
@Service
public class RecordTableService {
    private static final Logger log = LoggerFactory.getLogger(RecordTableService.class);

    private final CsvMapper csvMapper;

    public RecordTableService() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public RecordTable read(Path csv) {
        if (!Files.isRegularFile(csv)) {
            throw new RecordTableException("Record table not found: " + csv);
        }
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             MappingIterator<List<String>> it = csvMapper.readerForListOf(String.class)
                     .with(CsvSchema.emptySchema())
                     .readValues(reader)) {
            if (!it.hasNext()) {
                throw new RecordTableException("Record table is empty: " + csv);
            }
            List<String> columns = stripBom(it.next());
            List<List<String>> rows = new ArrayList<>();
            while (it.hasNext()) {
                rows.add(pad(it.next(), columns.size()));
            }
            log.info("Read {} records from {}", rows.size(), csv);
            return new RecordTable(columns, rows);
        } catch (RecordTableException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new RecordTableException("Failed to read record table " + csv + ": " + e.getMessage(), e);
        }
    }

    public void write(ReconciledTable table, Path csv) {
        try {
            if (csv.toAbsolutePath().getParent() != null) {
                Files.createDirectories(csv.toAbsolutePath().getParent());
            }
            try (BufferedWriter writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
                 SequenceWriter out = csvMapper.writerFor(String[].class)
                         .with(CsvSchema.emptySchema())
                         .writeValues(writer)) {
                out.write(table.columns().toArray(new String[0]));
                for (ReconciledRow row : table.rows()) {
                    List<String> values = new ArrayList<>(row.values());
                    values.add(row.status().label());
                    values.add(row.responseText() == null ? "" : row.responseText());
                    values.add(row.sourceFile() == null ? "" : row.sourceFile());
                    out.write(values.toArray(new String[0]));
                }
            }
        } catch (IOException e) {
            throw new RecordTableException("Failed to write " + csv + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes one 1-based row number per line.
     */
    public void writeMissingRows(List<Integer> rowNumbers, Path file) {
        List<String> lines = rowNumbers.stream().map(String::valueOf).toList();
        try {
            Files.write(file, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RecordTableException("Failed to write missing rows " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a missing-rows file and converts its 1-based row numbers to 0-based indices.
     * Lines that are not positive integers are skipped.
     */
    public List<Integer> readMissingRows(Path file) {
        try {
            List<Integer> indices = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (!trimmed.matches("\\d+")) {
                    continue;
                }
                int rowNumber = Integer.parseInt(trimmed);
                if (rowNumber >= 1) {
                    indices.add(rowNumber - 1);
                }
            }
            return indices.stream().distinct().sorted().toList();
        } catch (IOException e) {
            throw new RecordTableException("Failed to read missing rows " + file + ": " + e.getMessage(), e);
        }
    }

    private List<String> stripBom(List<String> header) {
        if (header.isEmpty() || header.get(0) == null || !header.get(0).startsWith("\uFEFF")) {
            return header;
        }
        List<String> copy = new ArrayList<>(header);
        copy.set(0, copy.get(0).substring(1));
        return copy;
    }

    private List<String> pad(List<String> row, int width) {
        List<String> padded = new ArrayList<>(row.size() < width ? width : row.size());
        for (String value : row) {
            padded.add(value == null ? "" : value);
        }
        while (padded.size() < width) {
            padded.add("");
        }
        return padded;
    }
}
