package com.catalogenricher.enrichment.filter;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Output of one filter pass: per-category statistics (letters ascending, "unknown" last), candidate row ids and
 * the settings that produced them.
 */
public record DynamicFilterResult(List<CategoryStats> stats, SortedSet<Integer> candidateRowIds, int totalSamples,
                                  Settings settings) {

    public record Settings(int minSampleSize, double reviewLowerPercentile, double reviewUpperPercentile,
                           double ratingPercentileLarge, int activeColumnRules) {
    }

    public DynamicFilterResult {
        stats = List.copyOf(stats);
        candidateRowIds = Collections.unmodifiableSortedSet(new TreeSet<>(candidateRowIds));
    }

    public static DynamicFilterResult empty(Settings settings) {
        return new DynamicFilterResult(List.of(), new TreeSet<>(), 0, settings);
    }

    public int candidateCount() {
        return candidateRowIds.size();
    }
}
