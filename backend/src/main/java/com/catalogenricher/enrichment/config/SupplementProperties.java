package com.catalogenricher.enrichment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identifier supplementation via an external resolver (barcode → identifier).
 */
@ConfigurationProperties(prefix = "enricher.supplement")
@Getter
@Setter
public class SupplementProperties {

    private boolean enabled = true;

    /**
     * Resolver runs only when at least this many rows are eligible, so the session start cost is not paid
     * for a handful of rows. Default 5.
     */
    private int minThreshold = 5;
}
