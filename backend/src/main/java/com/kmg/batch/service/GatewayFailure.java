package com.kmg.batch.service;

public enum GatewayFailure {
    UPLOAD,
    SUBMIT,
    POLL,
    BATCH_FAILED,
    BATCH_EXPIRED,
    BATCH_CANCELLED,
    DOWNLOAD,
    INTERRUPTED
}
