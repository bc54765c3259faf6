package com.lnradar.ingestion.store;

/**
 * Thrown when a durable store cannot be loaded at startup.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
