package com.kmg.batch.model;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isRetryableFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
