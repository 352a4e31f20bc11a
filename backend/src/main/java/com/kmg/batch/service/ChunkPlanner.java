package com.kmg.batch.service;

import com.kmg.batch.model.BatchJob;
import com.kmg.batch.model.Ledger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Partitions record indices into jobs and appends them to a ledger. Planning is idempotent:
 * a job whose name is already in the ledger is never re-created.
 */
@Service
public class ChunkPlanner {
    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);

    public static final String RANGE_PREFIX = "batch";
    public static final String MISSING_PREFIX = "retry_missing_batch";

    private final TimeService timeService;

    public ChunkPlanner(TimeService timeService) {
        this.timeService = timeService;
    }

    /**
     * Plans {@code [start, end)} on a grid of {@code batchSize}-aligned chunks. Chunk {@code k}
     * (covering {@code [k*batchSize, (k+1)*batchSize)} clipped to the range) is named
     * {@code batch_<k+1>}, so the same range always maps to the same names. When a chunk's job was
     * planned earlier for fewer rows, the requested rows it lacks get their own job named
     * {@code batch_<k+1>_r<from>-<to>} (0-based, end exclusive).
     *
     * @return jobs newly added to the ledger
     */
    public List<BatchJob> planRange(Ledger ledger, int start, int end, int batchSize, int maxAttempts) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }

        OffsetDateTime now = timeService.now();
        List<BatchJob> added = new ArrayList<>();
        int current = start;
        while (current < end) {
            int chunk = current / batchSize;
            int chunkEnd = Math.min((chunk + 1) * batchSize, end);
            String name = jobName(RANGE_PREFIX, chunk + 1);

            Optional<BatchJob> existing = ledger.findJob(name);
            if (existing.isEmpty()) {
                BatchJob job = new BatchJob(name, current, chunkEnd, maxAttempts, now);
                ledger.addIfAbsent(job);
                added.add(job);
            } else {
                added.addAll(planUncovered(ledger, name, current, chunkEnd, maxAttempts, now));
            }
            current = chunkEnd;
        }

        log.info("Planned rows {}-{} into {} new jobs ({} jobs in ledger)", start + 1, end, added.size(),
                ledger.getJobs().size());
        return added;
    }

    private List<BatchJob> planUncovered(Ledger ledger, String chunkName, int from, int to, int maxAttempts,
                                         OffsetDateTime now) {
        Set<Integer> covered = new HashSet<>();
        for (BatchJob job : ledger.getJobs()) {
            if (job.getName().equals(chunkName) || job.getName().startsWith(chunkName + "_r")) {
                covered.addAll(job.coveredIndices());
            }
        }

        List<BatchJob> added = new ArrayList<>();
        int index = from;
        while (index < to) {
            if (covered.contains(index)) {
                index++;
                continue;
            }
            int runEnd = index;
            while (runEnd < to && !covered.contains(runEnd)) {
                runEnd++;
            }
            BatchJob job = new BatchJob(chunkName + "_r" + index + "-" + runEnd, index, runEnd, maxAttempts, now);
            ledger.addIfAbsent(job);
            added.add(job);
            log.info("Job {} lacks rows {}-{}; planned {}", chunkName, index + 1, runEnd, job.getName());
            index = runEnd;
        }
        return added;
    }

    /**
     * Plans an arbitrary index set, typically the missing rows of a previous merge. Sorted indices
     * are grouped until a group holds {@code batchSize} indices or the gap to the previous index
     * exceeds {@code maxGap}. A group identical to an already planned missing-row job is skipped.
     *
     * @return jobs newly added to the ledger
     */
    public List<BatchJob> planIndices(Ledger ledger, List<Integer> indices, int batchSize, int maxGap, int maxAttempts) {
        List<List<Integer>> groups = groupIndices(indices, batchSize, maxGap);
        OffsetDateTime now = timeService.now();
        int next = highestNumber(ledger, MISSING_PREFIX) + 1;

        List<BatchJob> added = new ArrayList<>();
        for (List<Integer> group : groups) {
            boolean alreadyPlanned = ledger.getJobs().stream()
                    .filter(job -> job.getName().startsWith(MISSING_PREFIX + "_"))
                    .anyMatch(job -> Objects.equals(job.coveredIndices(), group));
            if (alreadyPlanned) {
                continue;
            }
            BatchJob job = BatchJob.forIndices(jobName(MISSING_PREFIX, next++), group, maxAttempts, now);
            ledger.addIfAbsent(job);
            added.add(job);
        }

        log.info("Planned {} missing rows into {} new jobs", indices.size(), added.size());
        return added;
    }

    public List<List<Integer>> groupIndices(List<Integer> indices, int batchSize, int maxGap) {
        List<Integer> sorted = indices.stream().distinct().sorted().toList();
        List<List<Integer>> groups = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        for (int index : sorted) {
            if (index < 0) {
                throw new IllegalArgumentException("Negative record index: " + index);
            }
            if (!current.isEmpty()
                    && (current.size() >= batchSize || index - current.get(current.size() - 1) > maxGap)) {
                groups.add(List.copyOf(current));
                current.clear();
            }
            current.add(index);
        }
        if (!current.isEmpty()) {
            groups.add(List.copyOf(current));
        }
        return groups;
    }

    private int highestNumber(Ledger ledger, String prefix) {
        Pattern pattern = Pattern.compile(Pattern.quote(prefix) + "_(\\d+)");
        int highest = 0;
        for (BatchJob job : ledger.getJobs()) {
            Matcher matcher = pattern.matcher(job.getName());
            if (matcher.matches()) {
                highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
            }
        }
        return highest;
    }

    private String jobName(String prefix, int number) {
        return String.format("%s_%03d", prefix, number);
    }
}
