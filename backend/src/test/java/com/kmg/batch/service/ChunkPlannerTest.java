package com.kmg.batch.service;

import com.kmg.batch.model.BatchJob;
import com.kmg.batch.model.Ledger;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPlannerTest {
    private final ChunkPlanner planner = new ChunkPlanner(
            new TimeService(Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC)));

    @Test
    void plansContiguousChunksNamedByGridPosition() {
        Ledger ledger = new Ledger(Path.of("batch_status.json"));

        List<BatchJob> jobs = planner.planRange(ledger, 0, 45, 20, 3);

        assertThat(jobs).extracting(BatchJob::getName).containsExactly("batch_001", "batch_002", "batch_003");
        assertThat(jobs.get(2).getStartIndex()).isEqualTo(40);
        assertThat(jobs.get(2).getEndIndex()).isEqualTo(45);
        assertThat(jobs).allSatisfy(job -> assertThat(job.getMaxAttempts()).isEqualTo(3));
    }

    @Test
    void replanningSameRangeAddsNothing() {
        Ledger ledger = new Ledger(Path.of("batch_status.json"));
        planner.planRange(ledger, 0, 60, 20, 3);

        List<BatchJob> second = planner.planRange(ledger, 0, 60, 20, 3);

        assertThat(second).isEmpty();
        assertThat(ledger.getJobs()).extracting(BatchJob::getName).doesNotHaveDuplicates().hasSize(3);
    }

    @Test
    void subrangeStartingMidChunkKeepsGridNames() {
        Ledger ledger = new Ledger(Path.of("batch_status.json"));

        List<BatchJob> jobs = planner.planRange(ledger, 30, 50, 20, 3);

        assertThat(jobs).extracting(BatchJob::getName).containsExactly("batch_002", "batch_003");
        assertThat(jobs.get(0).getStartIndex()).isEqualTo(30);
        assertThat(jobs.get(0).getEndIndex()).isEqualTo(40);
    }

    @Test
    void widerRequestOverPartlyPlannedChunkPlansTheRestSeparately() {
        Ledger ledger = new Ledger(Path.of("batch_status.json"));
        planner.planRange(ledger, 5, 20, 20, 3);

        List<BatchJob> added = planner.planRange(ledger, 0, 20, 20, 3);

        assertThat(added).extracting(BatchJob::getName).containsExactly("batch_001_r0-5");
        assertThat(added.get(0).coveredIndices()).containsExactly(0, 1, 2, 3, 4);
        List<Integer> covered = ledger.getJobs().stream()
                .flatMap(job -> job.coveredIndices().stream())
                .sorted()
                .toList();
        assertThat(covered).isEqualTo(IntStream.range(0, 20).boxed().toList());
        assertThat(planner.planRange(ledger, 0, 20, 20, 3)).isEmpty();
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        Ledger ledger = new Ledger(Path.of("batch_status.json"));

        assertThatThrownBy(() -> planner.planRange(ledger, 0, 10, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void groupsIndicesBySizeAndGap() {
        List<List<Integer>> groups = planner.groupIndices(List.of(12, 1, 2, 3, 4, 20, 21, 3), 3, 5);

        assertThat(groups).containsExactly(List.of(1, 2, 3), List.of(4), List.of(12), List.of(20, 21));
    }

    @Test
    void missingRowJobsContinueNumberingAndSkipKnownGroups() {
        Ledger ledger = new Ledger(Path.of("batch_status.json"));

        List<BatchJob> first = planner.planIndices(ledger, List.of(4, 5, 30), 20, 5, 3);
        List<BatchJob> again = planner.planIndices(ledger, List.of(4, 5, 30), 20, 5, 3);
        List<BatchJob> more = planner.planIndices(ledger, List.of(50), 20, 5, 3);

        assertThat(first).extracting(BatchJob::getName)
                .containsExactly("retry_missing_batch_001", "retry_missing_batch_002");
        assertThat(first.get(0).coveredIndices()).containsExactly(4, 5);
        assertThat(first.get(0).getEndIndex()).isEqualTo(6);
        assertThat(again).isEmpty();
        assertThat(more).extracting(BatchJob::getName).containsExactly("retry_missing_batch_003");
    }
}
