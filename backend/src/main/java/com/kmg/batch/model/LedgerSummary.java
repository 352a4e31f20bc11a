package com.kmg.batch.model;

import java.util.List;

public record LedgerSummary(
        int total,
        int completed,
        int failed,
        int timedOut,
        int pending,
        int running,
        List<BatchJob> unfinished
) {
    public static LedgerSummary of(Ledger ledger) {
        int completed = 0;
        int failed = 0;
        int timedOut = 0;
        int pending = 0;
        int running = 0;
        for (BatchJob job : ledger.getJobs()) {
            switch (job.getStatus()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case TIMED_OUT -> timedOut++;
                case PENDING -> pending++;
                case RUNNING -> running++;
            }
        }
        List<BatchJob> unfinished = ledger.getJobs().stream()
                .filter(job -> job.getStatus() != JobStatus.COMPLETED)
                .toList();
        return new LedgerSummary(ledger.getJobs().size(), completed, failed, timedOut, pending, running, unfinished);
    }

    public boolean allCompleted() {
        return unfinished.isEmpty();
    }

    public double completionRate() {
        return total == 0 ? 0.0 : completed * 100.0 / total;
    }
}
