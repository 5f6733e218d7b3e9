package com.catalogenricher.enrichment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "enricher.output")
@Getter
@Setter
public class OutputProperties {

    /** Directory for the final table and report when no explicit output path is given. */
    private String directory = "runtime/outputs";

    /** Write a markdown report next to the final table. */
    private boolean generateReport = true;
}
