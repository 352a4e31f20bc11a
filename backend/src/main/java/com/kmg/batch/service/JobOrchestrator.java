package com.kmg.batch.service;

import com.kmg.batch.config.BatchProperties;
import com.kmg.batch.model.BatchJob;
import com.kmg.batch.model.EncodedBatch;
import com.kmg.batch.model.FailureCategory;
import com.kmg.batch.model.JobStatus;
import com.kmg.batch.model.Ledger;
import com.kmg.batch.model.LedgerSummary;
import com.kmg.batch.model.RecordTable;
import com.kmg.batch.model.SubmissionResult;
import com.kmg.batch.model.VerificationResult;
import com.kmg.batch.repo.LedgerPersistenceException;
import com.kmg.batch.repo.LedgerRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs ledger jobs one at a time through encode, submit, verify. Every status change is written to
 * the ledger before the next step starts.
 */
@Service
public class JobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final LedgerRepository ledgerRepository;
    private final RequestEncoder requestEncoder;
    private final BatchSubmissionService submissionService;
    private final ResultVerifier resultVerifier;
    private final FailureClassifier failureClassifier;
    private final CostService costService;
    private final BatchProperties properties;
    private final TimeService timeService;
    private final Sleeper sleeper;

    private final ExecutorService gatewayExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "batch-gateway");
        thread.setDaemon(true);
        return thread;
    });

    public JobOrchestrator(
            LedgerRepository ledgerRepository,
            RequestEncoder requestEncoder,
            BatchSubmissionService submissionService,
            ResultVerifier resultVerifier,
            FailureClassifier failureClassifier,
            CostService costService,
            BatchProperties properties,
            TimeService timeService,
            Sleeper sleeper
    ) {
        this.ledgerRepository = ledgerRepository;
        this.requestEncoder = requestEncoder;
        this.submissionService = submissionService;
        this.resultVerifier = resultVerifier;
        this.failureClassifier = failureClassifier;
        this.costService = costService;
        this.properties = properties;
        this.timeService = timeService;
        this.sleeper = sleeper;
    }

    @PreDestroy
    public void shutdown() {
        gatewayExecutor.shutdownNow();
    }

    /**
     * Attempts one job. A completed or exhausted job is left untouched.
     *
     * @return the job's status after the attempt
     * @throws LedgerPersistenceException when the ledger cannot be written
     */
    public JobStatus runJob(Ledger ledger, BatchJob job, RecordTable table) {
        if (!job.canAttempt()) {
            log.info("[{}] not attempted: {}", job.getName(), job);
            return job.getStatus();
        }

        synchronized (ledger) {
            job.setAttempts(job.getAttempts() + 1);
            job.setStatus(JobStatus.RUNNING);
            job.setErrorMessage("");
            job.setFailureCategory(null);
            ledgerRepository.save(ledger);
        }
        log.info("[{}] attempt {}/{} for rows {}", job.getName(), job.getAttempts(), job.getMaxAttempts(),
                job.rowRangeLabel());

        Path runDir = runDirectory(ledger);
        EncodedBatch batch;
        try {
            batch = requestEncoder.encode(table, job.coveredIndices());
        } catch (RecordTableException e) {
            return fail(ledger, job, JobStatus.FAILED, "invalid input: " + e.getMessage());
        }
        if (!batch.skipped().isEmpty()) {
            writeSkipped(job, batch, runDir);
        }
        if (batch.isEmpty()) {
            return fail(ledger, job, JobStatus.FAILED, "no valid requests");
        }

        byte[] jsonl = requestEncoder.toJsonl(batch);
        Duration timeout = properties.getOrchestrator().getJobTimeout();
        int attempt = job.getAttempts();
        Future<SubmissionResult> future = gatewayExecutor.submit(() -> submissionService.submit(
                job.getName(), jsonl, runDir, batchId -> recordBatchId(ledger, job, attempt, batchId)));

        SubmissionResult result;
        try {
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return fail(ledger, job, JobStatus.TIMED_OUT, "timed out after " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof LedgerPersistenceException) {
                throw (LedgerPersistenceException) cause;
            }
            return fail(ledger, job, JobStatus.FAILED, describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return fail(ledger, job, JobStatus.FAILED, "interrupted");
        }

        VerificationResult verification = resultVerifier.verify(
                result.resultFile(), batch.submittedIndices(), properties.getOrchestrator().getVerification());
        if (!verification.verified()) {
            return fail(ledger, job, JobStatus.FAILED, "result verification failed: " + verification.reason());
        }

        synchronized (ledger) {
            job.setStatus(JobStatus.COMPLETED);
            job.setProviderBatchId(result.batchId());
            job.setResultFile(relativeToRun(runDir, result.resultFile()));
            job.setErrorFile(result.errorFile() == null ? null : relativeToRun(runDir, result.errorFile()));
            job.setCompletedAt(timeService.now());
            ledgerRepository.save(ledger);
        }
        log.info("[{}] completed: {}/{} ids verified, batch {}", job.getName(), verification.matchedIds(),
                verification.expectedIds(), result.batchId());

        costService.recordJob(job, properties.getEncoder().getModel(), batch.requests().size(), result.counts());
        return JobStatus.COMPLETED;
    }

    /**
     * Runs every attemptable job in ledger order, pausing between jobs.
     */
    public LedgerSummary runAll(Ledger ledger, RecordTable table) {
        List<BatchJob> eligible = ledger.getJobs().stream()
                .filter(BatchJob::canAttempt)
                .toList();
        log.info("Running {} of {} jobs", eligible.size(), ledger.getJobs().size());
        runSequence(ledger, table, eligible, false);
        return logSummary(ledger);
    }

    /**
     * Second pass over failed and timed-out jobs that still have attempts left.
     */
    public LedgerSummary retryFailed(Ledger ledger, RecordTable table) {
        List<BatchJob> retryable = ledger.getJobs().stream()
                .filter(job -> job.getStatus().isRetryableFailure() && !job.isExhausted())
                .toList();
        log.info("Retrying {} failed jobs", retryable.size());
        runSequence(ledger, table, retryable, true);
        return logSummary(ledger);
    }

    /**
     * Manual override: clears the attempt count of the named jobs so they can run again.
     *
     * @return the jobs that were reset
     * @throws IllegalArgumentException when a name is not in the ledger
     */
    public List<BatchJob> resetAttempts(Ledger ledger, Collection<String> names) {
        List<BatchJob> reset = new ArrayList<>();
        synchronized (ledger) {
            for (String name : names) {
                BatchJob job = ledger.findJob(name)
                        .orElseThrow(() -> new IllegalArgumentException("Job not found: " + name));
                if (job.getStatus() == JobStatus.COMPLETED) {
                    log.warn("[{}] already completed, not reset", name);
                    continue;
                }
                job.setAttempts(0);
                reset.add(job);
            }
            ledgerRepository.save(ledger);
        }
        log.info("Reset attempts of {} jobs", reset.size());
        return reset;
    }

    /**
     * Runs the given jobs in order, skipping any that can no longer be attempted.
     */
    public LedgerSummary runJobs(Ledger ledger, RecordTable table, List<BatchJob> jobs) {
        runSequence(ledger, table, jobs, false);
        return logSummary(ledger);
    }

    private void runSequence(Ledger ledger, RecordTable table, List<BatchJob> jobs, boolean retryPass) {
        BatchProperties.Orchestrator settings = properties.getOrchestrator();
        for (int i = 0; i < jobs.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Interrupted, {} jobs left unattempted", jobs.size() - i);
                return;
            }
            JobStatus status = runJob(ledger, jobs.get(i), table);
            if (i == jobs.size() - 1) {
                break;
            }
            Duration delay;
            if (retryPass) {
                delay = settings.getDelayBetweenRetries();
            } else if (status == JobStatus.COMPLETED) {
                delay = settings.getDelayAfterSuccess();
            } else {
                delay = settings.getDelayAfterFailure();
            }
            pause(delay);
        }
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            log.debug("Waiting {}s before next job", delay.toSeconds());
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private JobStatus fail(Ledger ledger, BatchJob job, JobStatus status, String reason) {
        FailureCategory category = status == JobStatus.TIMED_OUT
                ? FailureCategory.TIMEOUT
                : failureClassifier.classify(reason);
        synchronized (ledger) {
            job.setStatus(status);
            job.setErrorMessage(reason);
            job.setFailureCategory(category);
            ledgerRepository.save(ledger);
        }
        log.error("[{}] {} on attempt {}/{} ({}): {}", job.getName(), status, job.getAttempts(),
                job.getMaxAttempts(), category, reason);
        return status;
    }

    /**
     * Saves the provider batch id of a running attempt. A call from an attempt that has since timed
     * out is dropped, even when a later attempt is running.
     */
    void recordBatchId(Ledger ledger, BatchJob job, int attempt, String batchId) {
        synchronized (ledger) {
            if (job.getStatus() != JobStatus.RUNNING || job.getAttempts() != attempt) {
                log.debug("[{}] ignoring batch id {} from attempt {}", job.getName(), batchId, attempt);
                return;
            }
            job.setProviderBatchId(batchId);
            ledgerRepository.save(ledger);
        }
    }

    private String describe(Throwable cause) {
        if (cause instanceof GatewayException) {
            GatewayException gatewayException = (GatewayException) cause;
            return gatewayException.failure() + ": " + gatewayException.getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private void writeSkipped(BatchJob job, EncodedBatch batch, Path runDir) {
        Path file = runDir.resolve(job.getName() + "_skipped.txt");
        try {
            Files.createDirectories(runDir);
            requestEncoder.writeSkipped(batch.skipped(), file);
        } catch (IOException e) {
            log.warn("[{}] could not write {}: {}", job.getName(), file, e.getMessage());
        }
    }

    private LedgerSummary logSummary(Ledger ledger) {
        LedgerSummary summary = LedgerSummary.of(ledger);
        log.info("Jobs: {} total, {} completed, {} failed, {} timed out, {} pending, {} running ({}%)",
                summary.total(), summary.completed(), summary.failed(), summary.timedOut(), summary.pending(),
                summary.running(), String.format(Locale.ROOT, "%.1f", summary.completionRate()));
        return summary;
    }

    private Path runDirectory(Ledger ledger) {
        Path location = ledger.getLocation();
        if (location == null || location.toAbsolutePath().getParent() == null) {
            return properties.outputDirPath();
        }
        return location.toAbsolutePath().getParent();
    }

    private String relativeToRun(Path runDir, Path file) {
        Path absolute = file.toAbsolutePath();
        return absolute.startsWith(runDir) ? runDir.relativize(absolute).toString() : absolute.toString();
    }
}
