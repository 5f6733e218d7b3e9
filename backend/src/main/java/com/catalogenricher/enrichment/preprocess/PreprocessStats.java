package com.catalogenricher.enrichment.preprocess;

/**
 * Counts from one preprocessing pass. {@code missingWithBarcode} rows have no identifier yet but can still be
 * supplemented or served from cache by barcode.
 */
public record PreprocessStats(int total, int normalized, int alreadyNormalized, int invalid, int noIdentifier,
                              int missingWithBarcode) {
}
