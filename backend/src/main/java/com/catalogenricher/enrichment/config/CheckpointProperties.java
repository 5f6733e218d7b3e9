package com.catalogenricher.enrichment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Partial-progress checkpoint location and throttle.
 */
@ConfigurationProperties(prefix = "enricher.checkpoint")
@Getter
@Setter
public class CheckpointProperties {

    /** Directory holding {@code <input-stem>_partial.json}. */
    private String directory = "runtime/outputs";

    /** Minimum time between unforced checkpoint writes. Default 5000 ms. */
    private long minIntervalMs = 5_000L;
}
