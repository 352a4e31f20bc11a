package com.kmg.batch.service;

/**
 * Typed failure reported by the batch gateway. The message keeps the provider's own text so it
 * can be classified for diagnostics.
 */
public class GatewayException extends RuntimeException {
    private final GatewayFailure failure;

    public GatewayException(GatewayFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public GatewayException(GatewayFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public GatewayFailure failure() {
        return failure;
    }
}
