package com.kmg.batch.model;

/**
 * Diagnostic bucket for a failed job. Never drives control flow.
 */
public enum FailureCategory {
    QUOTA,
    RATE_LIMIT,
    CREDENTIAL,
    PERMISSION,
    TIMEOUT,
    NETWORK,
    INPUT_VALIDATION,
    UNKNOWN
}
