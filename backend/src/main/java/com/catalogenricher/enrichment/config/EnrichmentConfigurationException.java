package com.catalogenricher.enrichment.config;

/**
 * Unrecoverable configuration error. Raised before any row is processed.
 */
public class EnrichmentConfigurationException extends RuntimeException {

    public EnrichmentConfigurationException(String message) {
        super(message);
    }
}
