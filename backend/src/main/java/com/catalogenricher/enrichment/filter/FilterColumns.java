package com.catalogenricher.enrichment.filter;

/**
 * Columns the threshold filter reads.
 */
public record FilterColumns(String ratingColumn, String reviewCountColumn, String callNumberColumn) {
}
