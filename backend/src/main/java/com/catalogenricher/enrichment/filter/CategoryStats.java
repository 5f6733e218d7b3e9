package com.catalogenricher.enrichment.filter;

/**
 * Per-category filter statistics. Review band bounds are null when the group has no review counts; in that case
 * candidateCount is null and both ratios are NaN. ratingPercentile is null for small samples.
 */
public record CategoryStats(String category, int sampleCount, SampleType sampleType, Double reviewLower,
                            Double reviewUpper, double floor, Double ratingPercentile, Double threshold,
                            Integer candidateCount, double ratioInGroup, double ratioOverall) {
}
