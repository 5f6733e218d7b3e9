package com.catalogenricher.enrichment.table;

/**
 * Thrown when a table cannot be read or written.
 */
public class TableStoreException extends RuntimeException {

    public TableStoreException(String message) {
        super(message);
    }

    public TableStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
