package com.kmg.batch.repo;

/**
 * The ledger could not be read or written. Fatal for the run: continuing with an unpersisted
 * ledger would lose the only record of what was submitted.
 */
public class LedgerPersistenceException extends RuntimeException {
    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
