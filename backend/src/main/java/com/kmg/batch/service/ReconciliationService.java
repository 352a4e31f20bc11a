package com.kmg.batch.service;

import com.kmg.batch.model.MergeAnalysis;
import com.kmg.batch.model.MergeCounts;
import com.kmg.batch.model.MergeResult;
import com.kmg.batch.model.Outcome;
import com.kmg.batch.model.ParsedLine;
import com.kmg.batch.model.ReconciledRow;
import com.kmg.batch.model.ReconciledTable;
import com.kmg.batch.model.RecordTable;
import com.kmg.batch.model.RowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Merges result files onto the record table. The reconciled table is rebuilt from the records on
 * every merge, so merging the same inputs twice gives the same table.
 * <p>
 * When several lines carry an outcome for the same row, the one read last wins. Files are read in
 * the order given, lines in file order.
 */
@Service
public class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);
    private static final String RESULT_GLOB = "batch_results_*.jsonl";
    private static final String MISSING_SUFFIX = "_missing_rows.txt";

    private final ResultLineParser parser;
    private final RecordTableService recordTableService;

    public ReconciliationService(ResultLineParser parser, RecordTableService recordTableService) {
        this.parser = parser;
        this.recordTableService = recordTableService;
    }

    /**
     * Result files of a run directory, sorted by file name.
     */
    public List<Path> listResultFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new RecordTableException("Not a directory: " + dir);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, RESULT_GLOB)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new RecordTableException("Failed to list result files in " + dir + ": " + e.getMessage(), e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    public MergeResult merge(RecordTable table, List<Path> resultFiles) {
        return merge(table, resultFiles, 0, table.size());
    }

    /**
     * Reconciles {@code table} accepting outcomes only for rows {@code [start, end)}. Outcomes for
     * rows outside that range are counted and ignored. The reconciled table always holds every row
     * of {@code table}; rows outside the range stay missing.
     */
    public MergeResult merge(RecordTable table, List<Path> resultFiles, int start, int end) {
        if (start < 0 || end > table.size() || start > end) {
            throw new IllegalArgumentException(
                    "Invalid merge range [" + start + ", " + end + ") for " + table.size() + " rows");
        }

        Map<Integer, Outcome> outcomes = new HashMap<>();
        Map<Integer, String> sources = new HashMap<>();
        int duplicates = 0;
        int undecodable = 0;
        int unmatched = 0;
        int outOfRange = 0;

        for (Path file : resultFiles) {
            String source = file.getFileName().toString();
            int parsedInFile = 0;
            List<ParsedLine> lines;
            try {
                lines = parser.parseFile(file);
            } catch (IOException e) {
                throw new RecordTableException("Failed to read result file " + file + ": " + e.getMessage(), e);
            }
            for (int i = 0; i < lines.size(); i++) {
                ParsedLine parsed = lines.get(i);
                int lineNumber = i + 1;
                switch (parsed.kind()) {
                    case BLANK -> {
                    }
                    case UNDECODABLE -> {
                        undecodable++;
                        log.warn("{}:{} undecodable line skipped: {}", source, lineNumber, parsed.detail());
                    }
                    case UNMATCHED_ID -> {
                        unmatched++;
                        log.debug("{}:{} unmatched id '{}'", source, lineNumber, parsed.detail());
                    }
                    case OUTCOME -> {
                        int index = parsed.index();
                        if (index < start || index >= end) {
                            outOfRange++;
                            continue;
                        }
                        if (outcomes.put(index, parsed.outcome()) != null) {
                            duplicates++;
                        }
                        sources.put(index, source);
                        parsedInFile++;
                    }
                }
            }
            log.info("Parsed {} outcomes from {}", parsedInFile, source);
        }

        List<Integer> basePositions = basePositions(table.columns());
        List<String> columns = new ArrayList<>();
        basePositions.forEach(position -> columns.add(table.columns().get(position)));
        columns.addAll(ReconciledTable.OUTCOME_COLUMNS);

        List<ReconciledRow> rows = new ArrayList<>(table.size());
        int completed = 0;
        int content = 0;
        int refusals = 0;
        int errors = 0;
        for (int index = 0; index < table.size(); index++) {
            List<String> values = baseValues(table.rows().get(index), basePositions);
            Outcome outcome = outcomes.get(index);
            if (outcome == null) {
                rows.add(new ReconciledRow(index, values, RowStatus.MISSING, "", ""));
                continue;
            }
            completed++;
            switch (outcome.kind()) {
                case CONTENT -> content++;
                case REFUSAL -> refusals++;
                case ERROR -> errors++;
            }
            rows.add(new ReconciledRow(index, values, RowStatus.COMPLETED, outcome.responseText(), sources.get(index)));
        }

        MergeCounts counts = new MergeCounts(completed, rows.size() - completed, duplicates, content, refusals,
                errors, undecodable, unmatched, outOfRange);
        log.info("Merged {} files: {} completed, {} missing, {} duplicates, {} undecodable, {} out of range",
                resultFiles.size(), counts.completed(), counts.missing(), duplicates, undecodable, outOfRange);
        return new MergeResult(new ReconciledTable(columns, rows), counts, List.copyOf(resultFiles));
    }

    /**
     * Writes the reconciled table and, when rows are missing, the missing-rows file next to it. A
     * stale missing-rows file from an earlier merge is removed when nothing is missing.
     *
     * @return the missing-rows file, if one was written
     */
    public Optional<Path> writeOutputs(MergeResult result, Path outputCsv) {
        recordTableService.write(result.table(), outputCsv);
        Path missingFile = missingRowsFile(outputCsv);
        List<Integer> missing = result.missingRowNumbers();
        if (missing.isEmpty()) {
            try {
                Files.deleteIfExists(missingFile);
            } catch (IOException e) {
                throw new RecordTableException("Failed to remove stale " + missingFile + ": " + e.getMessage(), e);
            }
            return Optional.empty();
        }
        recordTableService.writeMissingRows(missing, missingFile);
        log.info("Wrote {} missing rows to {}", missing.size(), missingFile);
        return Optional.of(missingFile);
    }

    public Path missingRowsFile(Path outputCsv) {
        String name = outputCsv.getFileName().toString();
        String stem = name.toLowerCase(Locale.ROOT).endsWith(".csv") ? name.substring(0, name.length() - 4) : name;
        return outputCsv.resolveSibling(stem + MISSING_SUFFIX);
    }

    public MergeAnalysis analyze(MergeResult result) {
        IntSummaryStatistics stats = result.table().rows().stream()
                .filter(row -> row.status() == RowStatus.COMPLETED)
                .map(ReconciledRow::responseText)
                .filter(this::isGenuineContent)
                .mapToInt(String::length)
                .summaryStatistics();
        if (stats.getCount() == 0) {
            return MergeAnalysis.EMPTY;
        }
        return new MergeAnalysis((int) stats.getCount(), stats.getAverage(), stats.getMin(), stats.getMax());
    }

    private boolean isGenuineContent(String text) {
        return Stream.of(Outcome.REFUSAL_PREFIX, Outcome.ERROR_PREFIX).noneMatch(text::startsWith);
    }

    /**
     * Positions of the record columns, leaving out outcome columns of an earlier merge.
     */
    private List<Integer> basePositions(List<String> columns) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (!ReconciledTable.OUTCOME_COLUMNS.contains(columns.get(i))) {
                positions.add(i);
            }
        }
        return positions;
    }

    private List<String> baseValues(List<String> row, List<Integer> positions) {
        List<String> values = new ArrayList<>(positions.size());
        for (int position : positions) {
            values.add(position < row.size() && row.get(position) != null ? row.get(position) : "");
        }
        return values;
    }
}
