package com.kmg.batch.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.batch.model.BatchJob;
import com.kmg.batch.model.FailureCategory;
import com.kmg.batch.model.JobStatus;
import com.kmg.batch.model.Ledger;
import com.kmg.batch.service.TimeService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerRepositoryTest {
    private static final Instant NOW = Instant.parse("2026-03-01T08:30:00Z");

    @TempDir
    Path dir;

    private final LedgerRepository repository = new LedgerRepository(new ObjectMapper(),
            new TimeService(Clock.fixed(NOW, ZoneOffset.UTC)));

    @Test
    void savesAndReloadsJobs() {
        Path file = dir.resolve("batch_status.json");
        Ledger ledger = new Ledger(file);
        BatchJob job = new BatchJob("batch_001", 0, 20, 3, OffsetDateTime.parse("2026-03-01T08:00:00Z"));
        job.setStatus(JobStatus.TIMED_OUT);
        job.setAttempts(2);
        job.setErrorMessage("timed out after 600s");
        job.setFailureCategory(FailureCategory.TIMEOUT);
        ledger.addIfAbsent(job);
        ledger.addIfAbsent(BatchJob.forIndices("retry_missing_batch_001", List.of(4, 9), 3,
                OffsetDateTime.parse("2026-03-01T08:00:00Z")));

        repository.save(ledger);
        Ledger loaded = repository.load(file);

        assertThat(loaded.getLastUpdated()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(loaded.getLocation()).isEqualTo(file);
        assertThat(loaded.getJobs()).hasSize(2);
        BatchJob reloaded = loaded.findJob("batch_001").orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.TIMED_OUT);
        assertThat(reloaded.getAttempts()).isEqualTo(2);
        assertThat(reloaded.getFailureCategory()).isEqualTo(FailureCategory.TIMEOUT);
        assertThat(loaded.findJob("retry_missing_batch_001").orElseThrow().coveredIndices()).containsExactly(4, 9);
        assertThat(dir.resolve("batch_status.json.tmp")).doesNotExist();
    }

    @Test
    void writesSnakeCaseWithTotalJobs() throws IOException {
        Path file = dir.resolve("batch_status.json");
        Ledger ledger = new Ledger(file);
        ledger.addIfAbsent(new BatchJob("batch_001", 0, 5, 3, OffsetDateTime.parse("2026-03-01T08:00:00Z")));

        repository.save(ledger);
        String json = Files.readString(file);

        assertThat(json).contains("\"last_updated\"", "\"total_jobs\" : 1", "\"start_index\" : 0",
                "\"end_index\" : 5", "\"status\" : \"PENDING\"");
        assertThat(json).doesNotContain("\"location\"", "\"indices\"");
    }

    @Test
    void ignoresUnknownFieldsAndKeepsRunningJobs() throws IOException {
        Path file = dir.resolve("batch_status.json");
        Files.writeString(file, """
                {
                  "last_updated" : "2026-02-01T00:00:00Z",
                  "total_jobs" : 1,
                  "future_field" : {"x" : 1},
                  "jobs" : [ {
                    "name" : "batch_004",
                    "start_index" : 60,
                    "end_index" : 80,
                    "status" : "RUNNING",
                    "attempts" : 1,
                    "max_attempts" : 3,
                    "priority" : "high"
                  } ]
                }
                """);

        Ledger ledger = repository.load(file);

        BatchJob job = ledger.getJobs().get(0);
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.canAttempt()).isTrue();
        assertThat(job.coveredIndices()).hasSize(20);
    }

    @Test
    void missingFileGivesEmptyLedgerAndCorruptFileFails() throws IOException {
        Ledger empty = repository.load(dir.resolve("absent.json"));
        Path corrupt = Files.writeString(dir.resolve("corrupt.json"), "{ not json");

        assertThat(empty.getJobs()).isEmpty();
        assertThatThrownBy(() -> repository.load(corrupt))
                .isInstanceOf(LedgerPersistenceException.class);
    }

    @Test
    void unwritableTargetFails() throws IOException {
        Path blocker = Files.writeString(dir.resolve("blocker"), "file, not a directory");
        Ledger ledger = new Ledger(blocker.resolve("batch_status.json"));

        assertThatThrownBy(() -> repository.save(ledger))
                .isInstanceOf(LedgerPersistenceException.class);
    }
}
