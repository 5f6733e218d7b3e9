package com.catalogenricher.enrichment.filter;

public enum SampleType {
    /** Below min-sample-size: threshold is the category floor. */
    SMALL,
    /** Threshold tightened to max(floor, rating percentile). */
    LARGE
}
