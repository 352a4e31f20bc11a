package com.kmg.batch.service;

public class RecordTableException extends RuntimeException {
    public RecordTableException(String message) {
        super(message);
    }

    public RecordTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
