package com.kmg.batch.cli;

import com.kmg.batch.config.BatchProperties;
import com.kmg.batch.model.BatchJob;
import com.kmg.batch.model.CostEstimate;
import com.kmg.batch.model.CostRecord;
import com.kmg.batch.model.CostSummary;
import com.kmg.batch.model.Ledger;
import com.kmg.batch.model.LedgerSummary;
import com.kmg.batch.model.MergeAnalysis;
import com.kmg.batch.model.MergeCounts;
import com.kmg.batch.model.MergeResult;
import com.kmg.batch.model.RecordTable;
import com.kmg.batch.repo.LedgerPersistenceException;
import com.kmg.batch.repo.LedgerRepository;
import com.kmg.batch.service.ChunkPlanner;
import com.kmg.batch.service.CostService;
import com.kmg.batch.service.JobOrchestrator;
import com.kmg.batch.service.RecordTableException;
import com.kmg.batch.service.RecordTableService;
import com.kmg.batch.service.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatches the first non-option argument as a command. The exit code is 0 when all jobs are
 * completed, 1 when some are not (or the run aborted), 2 on usage errors.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class BatchCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(BatchCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INCOMPLETE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = """
            Usage:
              run <records.csv> [--batch-size=N] [--model=M] [--start=N] [--end=N] [--output-dir=DIR]
              retry [job-names...] [--records=records.csv] [--output-dir=DIR]
              retry-missing <records.csv> <missing-rows.txt> [--output-dir=DIR]
              merge <ledger-dir> <records.csv> <output.csv>
              status [--output-dir=DIR]
              costs [--output-dir=DIR]
            """;

    private final BatchProperties properties;
    private final LedgerRepository ledgerRepository;
    private final RecordTableService recordTableService;
    private final ChunkPlanner chunkPlanner;
    private final JobOrchestrator orchestrator;
    private final ReconciliationService reconciliationService;
    private final CostService costService;
    private final PrintStream out = System.out;

    private int exitCode = EXIT_OK;

    public BatchCommandRunner(
            BatchProperties properties,
            LedgerRepository ledgerRepository,
            RecordTableService recordTableService,
            ChunkPlanner chunkPlanner,
            JobOrchestrator orchestrator,
            ReconciliationService reconciliationService,
            CostService costService
    ) {
        this.properties = properties;
        this.ledgerRepository = ledgerRepository;
        this.recordTableService = recordTableService;
        this.chunkPlanner = chunkPlanner;
        this.orchestrator = orchestrator;
        this.reconciliationService = reconciliationService;
        this.costService = costService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            usage("No command given");
            return;
        }

        String command = positional.get(0);
        List<String> operands = positional.subList(1, positional.size());
        try {
            switch (command) {
                case "run" -> run(operands, args);
                case "retry" -> retry(operands, args);
                case "retry-missing" -> retryMissing(operands);
                case "merge" -> merge(operands);
                case "status" -> status();
                case "costs" -> costs();
                default -> usage("Unknown command: " + command);
            }
        } catch (IllegalArgumentException e) {
            usage(e.getMessage());
        } catch (RecordTableException e) {
            log.error("{} failed: {}", command, e.getMessage());
            exitCode = EXIT_INCOMPLETE;
        } catch (LedgerPersistenceException e) {
            log.error("Aborting {}: ledger could not be persisted: {}", command, e.getMessage(), e);
            exitCode = EXIT_INCOMPLETE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void run(List<String> operands, ApplicationArguments args) {
        requireOperands(operands, 1, "run <records.csv>");
        Path recordsFile = Path.of(operands.get(0));
        RecordTable table = recordTableService.read(recordsFile);

        int start = intOption(args, "start").orElse(0);
        int end = Math.min(intOption(args, "end").orElse(table.size()), table.size());
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("Invalid row range: start=" + start + ", end=" + end
                    + " for " + table.size() + " records");
        }

        BatchProperties.Orchestrator settings = properties.getOrchestrator();
        Ledger ledger = loadLedger();
        ledger.setRecordsFile(recordsFile.toAbsolutePath().toString());
        List<BatchJob> planned = chunkPlanner.planRange(ledger, start, end, settings.getBatchSize(),
                settings.getMaxAttempts());
        ledgerRepository.save(ledger);

        String model = properties.getEncoder().getModel();
        CostEstimate estimate = costService.estimate(end - start, model);
        log.info("Rows {}-{} with {}: {} new jobs, estimated batch cost ${} (saves ${})", start + 1, end, model,
                planned.size(), money(estimate.batchCost()), money(estimate.savings()));

        LedgerSummary summary = orchestrator.runAll(ledger, table);
        if (!summary.allCompleted() && settings.isAutoRetry()) {
            summary = orchestrator.retryFailed(ledger, table);
        }
        finish(summary);
    }

    private void retry(List<String> names, ApplicationArguments args) {
        Ledger ledger = loadLedger();
        RecordTable table = recordTableService.read(recordsFileFor(ledger, args));

        LedgerSummary summary;
        if (names.isEmpty()) {
            summary = orchestrator.retryFailed(ledger, table);
        } else {
            List<BatchJob> reset = orchestrator.resetAttempts(ledger, names);
            summary = orchestrator.runJobs(ledger, table, reset);
        }
        finish(summary);
    }

    private void retryMissing(List<String> operands) {
        requireOperands(operands, 2, "retry-missing <records.csv> <missing-rows.txt>");
        Path recordsFile = Path.of(operands.get(0));
        RecordTable table = recordTableService.read(recordsFile);
        List<Integer> indices = recordTableService.readMissingRows(Path.of(operands.get(1))).stream()
                .filter(index -> index < table.size())
                .toList();
        if (indices.isEmpty()) {
            out.println("No missing rows to retry.");
            return;
        }

        BatchProperties.Orchestrator settings = properties.getOrchestrator();
        Ledger ledger = loadLedger();
        if (ledger.getRecordsFile() == null) {
            ledger.setRecordsFile(recordsFile.toAbsolutePath().toString());
        }
        chunkPlanner.planIndices(ledger, indices, settings.getBatchSize(), properties.getPlanner().getMaxGap(),
                settings.getMaxAttempts());
        ledgerRepository.save(ledger);

        Set<Integer> requested = new HashSet<>(indices);
        List<BatchJob> jobs = ledger.getJobs().stream()
                .filter(job -> job.getName().startsWith(ChunkPlanner.MISSING_PREFIX + "_"))
                .filter(BatchJob::canAttempt)
                .filter(job -> requested.containsAll(job.coveredIndices()))
                .toList();
        log.info("Retrying {} missing rows in {} jobs", indices.size(), jobs.size());
        finish(orchestrator.runJobs(ledger, table, jobs));
    }

    private void merge(List<String> operands) {
        requireOperands(operands, 3, "merge <ledger-dir> <records.csv> <output.csv>");
        Path ledgerDir = Path.of(operands.get(0));
        RecordTable table = recordTableService.read(Path.of(operands.get(1)));
        Path output = Path.of(operands.get(2));

        List<Path> files = reconciliationService.listResultFiles(ledgerDir);
        MergeResult result = reconciliationService.merge(table, files);
        Optional<Path> missingFile = reconciliationService.writeOutputs(result, output);
        MergeAnalysis analysis = reconciliationService.analyze(result);

        MergeCounts counts = result.counts();
        out.printf(Locale.ROOT, "Merged %d result files into %s%n", files.size(), output);
        out.printf(Locale.ROOT, "  completed: %d (content %d, refusal %d, error %d)%n", counts.completed(),
                counts.contentOutcomes(), counts.refusalOutcomes(), counts.errorOutcomes());
        out.printf(Locale.ROOT, "  missing: %d, duplicates: %d, undecodable lines: %d, unmatched ids: %d%n",
                counts.missing(), counts.duplicate(), counts.undecodableLines(), counts.unmatchedIds());
        if (analysis.contentRows() > 0) {
            out.printf(Locale.ROOT, "  content length: avg %.1f, min %d, max %d%n", analysis.averageLength(),
                    analysis.minLength(), analysis.maxLength());
        }
        missingFile.ifPresent(file -> out.printf(Locale.ROOT, "  missing rows written to %s%n", file));
        exitCode = EXIT_OK;
    }

    private void status() {
        Ledger ledger = loadLedger();
        printSummary(LedgerSummary.of(ledger), ledger.getJobs());
    }

    private void costs() {
        CostSummary summary = costService.summary();
        for (CostRecord record : costService.records()) {
            out.printf(Locale.ROOT, "%-28s %-24s %6d req  $%s%n", record.jobName(), record.model(),
                    record.numRequests(), money(record.batchCost()));
        }
        out.printf(Locale.ROOT, "Jobs: %d (%d completed), requests: %d%n", summary.totalJobs(),
                summary.completedJobs(), summary.totalRequests());
        out.printf(Locale.ROOT, "Tokens: %d input, %d output%n", summary.totalInputTokens(),
                summary.totalOutputTokens());
        out.printf(Locale.ROOT, "Total cost: $%s (avg $%s per request), saved $%s with batch pricing%n",
                money(summary.totalCost()), money(summary.avgCostPerRequest()), money(summary.totalSavings()));
    }

    private void finish(LedgerSummary summary) {
        printSummary(summary, List.of());
        exitCode = summary.allCompleted() ? EXIT_OK : EXIT_INCOMPLETE;
    }

    private void printSummary(LedgerSummary summary, List<BatchJob> allJobs) {
        for (BatchJob job : allJobs) {
            out.printf(Locale.ROOT, "%-28s %-10s rows %-12s attempts %d/%d%n", job.getName(), job.getStatus(),
                    job.rowRangeLabel(), job.getAttempts(), job.getMaxAttempts());
        }
        out.printf(Locale.ROOT, "Jobs: %d total, %d completed, %d failed, %d timed out, %d pending, %d running (%.1f%%)%n",
                summary.total(), summary.completed(), summary.failed(), summary.timedOut(), summary.pending(),
                summary.running(), summary.completionRate());
        for (BatchJob job : summary.unfinished()) {
            if (!job.getStatus().isRetryableFailure()) {
                continue;
            }
            out.printf(Locale.ROOT, "  %s %s [%s] attempts %d/%d: %s%n", job.getName(), job.getStatus(),
                    job.getFailureCategory(), job.getAttempts(), job.getMaxAttempts(), job.getErrorMessage());
        }
    }

    private Ledger loadLedger() {
        return ledgerRepository.load(properties.outputDirPath().resolve(properties.getOutput().getLedgerFile()));
    }

    private Path recordsFileFor(Ledger ledger, ApplicationArguments args) {
        if (args.containsOption("records") && !args.getOptionValues("records").isEmpty()) {
            return Path.of(args.getOptionValues("records").get(0));
        }
        if (ledger.getRecordsFile() == null) {
            throw new IllegalArgumentException("Ledger has no records file; pass --records=<records.csv>");
        }
        return Path.of(ledger.getRecordsFile());
    }

    private Optional<Integer> intOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name) || args.getOptionValues(name).isEmpty()) {
            return Optional.empty();
        }
        String value = args.getOptionValues(name).get(0);
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got " + value);
        }
    }

    private void requireOperands(List<String> operands, int count, String form) {
        if (operands.size() < count) {
            throw new IllegalArgumentException("Expected: " + form);
        }
    }

    private void usage(String problem) {
        log.error(problem);
        out.print(USAGE);
        exitCode = EXIT_USAGE;
    }

    private String money(double amount) {
        return String.format(Locale.ROOT, "%.4f", amount);
    }
}
