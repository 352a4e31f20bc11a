package com.kmg.batch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.batch.config.BatchProperties;
import com.kmg.batch.model.BatchJob;
import com.kmg.batch.model.FailureCategory;
import com.kmg.batch.model.JobStatus;
import com.kmg.batch.model.Ledger;
import com.kmg.batch.model.LedgerSummary;
import com.kmg.batch.model.RecordTable;
import com.kmg.batch.repo.LedgerRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class JobOrchestratorTest {
    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TimeService timeService =
            new TimeService(Clock.fixed(Instant.parse("2026-04-01T12:00:00Z"), ZoneOffset.UTC));
    private final BatchProperties properties = new BatchProperties();
    private final FakeBatchGateway gateway = new FakeBatchGateway();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final CostService costService = mock(CostService.class);
    private final ChunkPlanner planner = new ChunkPlanner(timeService);

    private RecordingLedgerRepository ledgerRepository;
    private JobOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties.getOutput().setDir(dir.toString());
        properties.getOrchestrator().setDelayAfterSuccess(Duration.ofSeconds(1));
        properties.getOrchestrator().setDelayAfterFailure(Duration.ofSeconds(2));
        properties.getOrchestrator().setDelayBetweenRetries(Duration.ofSeconds(3));
        properties.getOrchestrator().setJobTimeout(Duration.ofSeconds(10));

        ledgerRepository = new RecordingLedgerRepository(mapper, timeService);
        ResultLineParser parser = new ResultLineParser(mapper);
        orchestrator = new JobOrchestrator(
                ledgerRepository,
                new RequestEncoder(properties, mapper),
                new BatchSubmissionService(gateway, properties, sleeper),
                new ResultVerifier(parser),
                new FailureClassifier(),
                costService,
                properties,
                timeService,
                sleeper
        );
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    @Test
    void completesJobAndPersistsEveryTransition() {
        RecordTable table = table(4, 0);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 4, 20, 3).get(0);

        JobStatus status = orchestrator.runJob(ledger, job, table);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(ledgerRepository.savedStatuses)
                .containsExactly(JobStatus.RUNNING, JobStatus.RUNNING, JobStatus.COMPLETED);
        BatchJob persisted = ledgerRepository.load(ledger.getLocation()).findJob("batch_001").orElseThrow();
        assertThat(persisted.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(persisted.getAttempts()).isEqualTo(1);
        assertThat(persisted.getProviderBatchId()).isEqualTo("batch_1");
        assertThat(persisted.getResultFile()).isEqualTo("batch_results_batch_001_batch_1.jsonl");
        assertThat(persisted.getCompletedAt()).isNotNull();
        verify(costService).recordJob(eq(job), eq("gpt-4o-mini"), eq(4), any());
    }

    @Test
    void jobWithoutValidRequestsFailsWithoutSubmitting() {
        RecordTable table = table(3, 3);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 3, 20, 3).get(0);

        JobStatus status = orchestrator.runJob(ledger, job, table);

        assertThat(status).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("no valid requests");
        assertThat(job.getFailureCategory()).isEqualTo(FailureCategory.INPUT_VALIDATION);
        assertThat(gateway.uploads).isEmpty();
        assertThat(dir.resolve("batch_001_skipped.txt")).exists();
        verify(costService, never()).recordJob(any(), any(), anyInt(), any());
    }

    @Test
    void successWithoutMatchingResultsIsAFailure() {
        gateway.responder = requests -> "{\"custom_id\":\"row_999\",\"response\":{}}\n".getBytes(StandardCharsets.UTF_8);
        RecordTable table = table(2, 0);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 2, 20, 3).get(0);

        JobStatus status = orchestrator.runJob(ledger, job, table);

        assertThat(status).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).startsWith("result verification failed");
    }

    @Test
    void partialResultsAreAcceptedInAnyMode() {
        properties.getOrchestrator().setVerification(BatchProperties.VerificationMode.ANY);
        gateway.responder = requests -> FakeBatchGateway.answerAll(
                FakeBatchGateway.lines(requests).get(0).getBytes(StandardCharsets.UTF_8));
        RecordTable table = table(3, 0);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 3, 20, 3).get(0);

        assertThat(orchestrator.runJob(ledger, job, table)).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void gatewayFailureIsClassifiedForDiagnostics() {
        gateway.submitFailure = new GatewayException(GatewayFailure.SUBMIT, "Batch submission failed (429): rate limit");
        RecordTable table = table(2, 0);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 2, 20, 3).get(0);

        JobStatus status = orchestrator.runJob(ledger, job, table);

        assertThat(status).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).contains("SUBMIT").contains("429");
        assertThat(job.getFailureCategory()).isEqualTo(FailureCategory.RATE_LIMIT);
    }

    @Test
    void batchThatTimesOutThreeTimesIsExcludedFromRetry() {
        properties.getOrchestrator().setJobTimeout(Duration.ofMillis(500));
        gateway.pollGate = new CountDownLatch(1);
        RecordTable table = table(20, 0);
        Ledger ledger = ledger();
        planner.planRange(ledger, 0, 20, 20, 3);
        BatchJob job = ledger.findJob("batch_001").orElseThrow();

        orchestrator.runAll(ledger, table);
        orchestrator.retryFailed(ledger, table);
        orchestrator.retryFailed(ledger, table);
        int uploadsAfterThreeAttempts = gateway.uploads.size();
        LedgerSummary summary = orchestrator.retryFailed(ledger, table);

        assertThat(job.getStatus()).isEqualTo(JobStatus.TIMED_OUT);
        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.getFailureCategory()).isEqualTo(FailureCategory.TIMEOUT);
        assertThat(gateway.uploads).hasSize(uploadsAfterThreeAttempts);
        assertThat(summary.timedOut()).isEqualTo(1);
        assertThat(summary.allCompleted()).isFalse();
        assertThat(ledgerRepository.load(ledger.getLocation()).findJob("batch_001").orElseThrow().getAttempts())
                .isEqualTo(3);
    }

    @Test
    void retryBoundHoldsForRepeatedFailures() {
        gateway.submitFailure = new GatewayException(GatewayFailure.SUBMIT, "insufficient_quota");
        RecordTable table = table(2, 0);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 2, 20, 3).get(0);

        for (int i = 0; i < 5; i++) {
            orchestrator.runJob(ledger, job, table);
        }

        assertThat(job.getAttempts()).isEqualTo(3);
        assertThat(job.isExhausted()).isTrue();
        assertThat(gateway.uploads).hasSize(3);
        assertThat(job.getFailureCategory()).isEqualTo(FailureCategory.QUOTA);
    }

    @Test
    void pausesLongerAfterFailureAndNotAfterLastJob() {
        RecordTable table = table(6, 0, 2, 3);
        Ledger ledger = ledger();
        planner.planRange(ledger, 0, 6, 2, 3);

        LedgerSummary summary = orchestrator.runAll(ledger, table);

        assertThat(summary.completed()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void retryPassUsesRetryDelayAndSkipsCompletedJobs() {
        RecordTable table = table(6, 2, 3, 4, 5);
        Ledger ledger = ledger();
        planner.planRange(ledger, 0, 6, 2, 3);
        orchestrator.runAll(ledger, table);
        sleeper.sleeps.clear();
        int uploadsAfterFirstPass = gateway.uploads.size();

        orchestrator.retryFailed(ledger, table);

        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(3));
        assertThat(gateway.uploads).hasSize(uploadsAfterFirstPass);
        assertThat(ledger.findJob("batch_001").orElseThrow().getAttempts()).isEqualTo(1);
        assertThat(ledger.findJob("batch_002").orElseThrow().getAttempts()).isEqualTo(2);
        assertThat(ledger.findJob("batch_003").orElseThrow().getAttempts()).isEqualTo(2);
    }

    @Test
    void jobLeftRunningByACrashIsAttemptedAgain() {
        RecordTable table = table(2, 0);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 2, 20, 3).get(0);
        job.setStatus(JobStatus.RUNNING);
        job.setAttempts(1);

        orchestrator.runAll(ledger, table);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getAttempts()).isEqualTo(2);
    }

    @Test
    void manualResetAllowsExhaustedJobToRunAgain() {
        RecordTable table = table(2, 0);
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 2, 20, 3).get(0);
        job.setStatus(JobStatus.FAILED);
        job.setAttempts(3);

        List<BatchJob> reset = orchestrator.resetAttempts(ledger, List.of("batch_001"));
        orchestrator.runJobs(ledger, table, reset);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThatThrownBy(() -> orchestrator.resetAttempts(ledger, List.of("batch_404")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void batchIdFromEarlierAttemptIsIgnored() {
        Ledger ledger = ledger();
        BatchJob job = planner.planRange(ledger, 0, 2, 20, 3).get(0);
        job.setStatus(JobStatus.RUNNING);
        job.setAttempts(2);
        job.setProviderBatchId("batch_current");

        orchestrator.recordBatchId(ledger, job, 1, "batch_stale");

        assertThat(job.getProviderBatchId()).isEqualTo("batch_current");
        assertThat(ledgerRepository.savedStatuses).isEmpty();

        orchestrator.recordBatchId(ledger, job, 2, "batch_next");

        assertThat(job.getProviderBatchId()).isEqualTo("batch_next");
    }

    private Ledger ledger() {
        return new Ledger(dir.resolve("batch_status.json"));
    }

    /**
     * Table of {@code size} rows; rows listed in {@code missingImages} point at files that do not exist.
     */
    private RecordTable table(int size, int... missingImages) {
        List<List<String>> rows = new ArrayList<>();
        try {
            Path images = Files.createDirectories(dir.resolve("images"));
            for (int i = 0; i < size; i++) {
                Path image = images.resolve("img" + i + ".jpg");
                if (!contains(missingImages, i)) {
                    Files.write(image, new byte[]{(byte) i, 1, 2});
                }
                rows.add(List.of(image.toString(), "Describe image " + i));
            }
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return new RecordTable(List.of("Image Path", "Content of P*"), rows);
    }

    private boolean contains(int[] values, int value) {
        for (int candidate : values) {
            if (candidate == value) {
                return true;
            }
        }
        return false;
    }

    private static class RecordingLedgerRepository extends LedgerRepository {
        final List<JobStatus> savedStatuses = new ArrayList<>();

        RecordingLedgerRepository(ObjectMapper objectMapper, TimeService timeService) {
            super(objectMapper, timeService);
        }

        @Override
        public synchronized void save(Ledger ledger) {
            savedStatuses.add(ledger.getJobs().get(0).getStatus());
            super.save(ledger);
        }
    }
}
