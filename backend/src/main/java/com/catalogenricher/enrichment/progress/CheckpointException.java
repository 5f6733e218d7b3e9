package com.catalogenricher.enrichment.progress;

/**
 * Thrown when a checkpoint cannot be read, written or removed.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
