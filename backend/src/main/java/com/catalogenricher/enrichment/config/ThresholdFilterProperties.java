package com.catalogenricher.enrichment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Category-aware dynamic threshold filter.
 */
@ConfigurationProperties(prefix = "enricher.filter")
@Getter
@Setter
public class ThresholdFilterProperties {

    public static final String DEFAULT_CATEGORY = "default";

    private boolean enabled = true;

    /** Groups smaller than this use the category floor as threshold. Default 30. */
    private int minSampleSize = 30;

    private double reviewLowerPercentile = 40.0;
    private double reviewUpperPercentile = 80.0;

    /** Rating percentile used to tighten large groups. Default 75. */
    private double ratingPercentileLarge = 75.0;

    /**
     * Per-category rating floor keyed by call number letter, with a "default" fallback.
     */
    private Map<String, Double> categoryMinScores = new LinkedHashMap<>(defaultMinScores());

    /** Value written to the candidate column for flagged rows. */
    private String candidateMarker = "candidate";

    private ColumnFilters columnFilters = new ColumnFilters();

    public double floorFor(String category) {
        Map<String, Double> scores = categoryMinScores == null ? Map.of() : categoryMinScores;
        Double floor = scores.get(category);
        if (floor == null) {
            floor = scores.get(DEFAULT_CATEGORY);
        }
        return floor == null ? 7.5 : floor;
    }

    static Map<String, Double> defaultMinScores() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("I", 8.0);
        m.put("K", 7.8);
        m.put("T", 7.5);
        m.put("E", 7.4);
        m.put("B", 8.2);
        m.put(DEFAULT_CATEGORY, 7.5);
        return m;
    }

    /**
     * Auxiliary per-column checks every candidate must pass.
     */
    @Getter
    @Setter
    public static class ColumnFilters {
        private boolean enabled = false;
        private List<Rule> rules = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Rule {
        private String column;
        /** not_empty or regex. */
        private String filterType = "not_empty";
        /** Regex anchored at the start of the cell; used when filterType is regex. */
        private String pattern;
        /** Rules are off until switched on one by one. */
        private boolean enabled = false;
    }
}
