package com.catalogenricher.enrichment.classifier;

/**
 * Counts from one classification pass. Terminal rows are skipped and keep their earlier category.
 */
public record ClassificationStats(int examined, int skippedTerminal, int existingValid, int existingValidIncomplete,
                                  int existingStale, int newRows, int cacheErrors, boolean cacheEnabled) {
}
