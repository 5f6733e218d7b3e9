package com.catalogenricher.enrichment.fetch;

/**
 * Thrown (or used to complete a future exceptionally) when a metadata lookup fails. Retryable failures are
 * throttling, transient server errors, timeouts and I/O errors.
 */
public class MetadataSourceException extends RuntimeException {

    private final boolean retryable;

    public MetadataSourceException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public MetadataSourceException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
