package com.catalogenricher.enrichment.filter;

import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.config.ThresholdFilterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Category-aware dynamic threshold filter. Rows with a numeric rating are grouped by call number letter; per group
 * a row is a candidate when its review count lies in the group's [P_low, P_high] band, its rating reaches the
 * group threshold and it passes every active column rule. Small groups use the category floor as threshold, large
 * groups max(floor, rating percentile).
 * <p>
 * {@link #analyze} reads the table only and is deterministic for a given table and configuration.
 */
@Component
@Slf4j
public class ThresholdFilter {

    private final ThresholdFilterProperties properties;
    private final List<ColumnRule> columnRules;

    public ThresholdFilter(ThresholdFilterProperties properties) {
        this.properties = properties;
        this.columnRules = buildRules(properties);
    }

    static List<ColumnRule> buildRules(ThresholdFilterProperties properties) {
        ThresholdFilterProperties.ColumnFilters filters = properties.getColumnFilters();
        if (filters == null || !filters.isEnabled() || filters.getRules() == null) {
            return List.of();
        }
        List<ColumnRule> rules = new ArrayList<>();
        for (ThresholdFilterProperties.Rule rule : filters.getRules()) {
            if (!rule.isEnabled() || rule.getColumn() == null || rule.getColumn().isBlank()) {
                continue;
            }
            rules.add(ColumnRuleKind.fromKey(rule.getFilterType()).create(rule.getColumn().strip(), rule.getPattern()));
        }
        return List.copyOf(rules);
    }

    public DynamicFilterResult analyze(WorkingTable table, FilterColumns columns) {
        Map<String, List<Sample>> groups = new TreeMap<>(CallNumberCategories.ORDER);
        int totalSamples = 0;
        for (CatalogRecord record : table.records()) {
            Double rating = parseNumber(record.getValue(columns.ratingColumn()));
            if (rating == null) {
                continue;
            }
            Double reviews = parseNumber(record.getValue(columns.reviewCountColumn()));
            String category = CallNumberCategories.categoryOf(record.getValue(columns.callNumberColumn()));
            groups.computeIfAbsent(category, k -> new ArrayList<>()).add(new Sample(record, rating, reviews));
            totalSamples++;
        }

        List<CategoryStats> stats = new ArrayList<>(groups.size());
        SortedSet<Integer> candidates = new TreeSet<>();
        for (Map.Entry<String, List<Sample>> group : groups.entrySet()) {
            stats.add(analyzeGroup(group.getKey(), group.getValue(), totalSamples, candidates));
        }
        DynamicFilterResult result = new DynamicFilterResult(stats, candidates, totalSamples, settings());
        log.info("Threshold filter: {} samples in {} categories, {} candidates",
                totalSamples, stats.size(), result.candidateCount());
        return result;
    }

    private CategoryStats analyzeGroup(String category, List<Sample> samples, int totalSamples,
                                       SortedSet<Integer> candidates) {
        List<Double> reviews = new ArrayList<>();
        List<Double> ratings = new ArrayList<>(samples.size());
        for (Sample s : samples) {
            ratings.add(s.rating());
            if (s.reviews() != null) {
                reviews.add(s.reviews());
            }
        }
        Double lower = boxed(Percentiles.linear(reviews, properties.getReviewLowerPercentile()));
        Double upper = boxed(Percentiles.linear(reviews, properties.getReviewUpperPercentile()));
        double floor = properties.floorFor(category);
        int n = samples.size();

        SampleType type;
        Double ratingPercentile = null;
        double threshold;
        if (n < properties.getMinSampleSize()) {
            type = SampleType.SMALL;
            threshold = floor;
        } else {
            type = SampleType.LARGE;
            ratingPercentile = boxed(Percentiles.linear(ratings, properties.getRatingPercentileLarge()));
            threshold = ratingPercentile == null ? floor : Math.max(floor, ratingPercentile);
        }

        if (lower == null || upper == null) {
            return new CategoryStats(category, n, type, lower, upper, floor, ratingPercentile, threshold,
                    null, Double.NaN, Double.NaN);
        }
        int count = 0;
        for (Sample s : samples) {
            if (s.reviews() != null && s.reviews() >= lower && s.reviews() <= upper && s.rating() >= threshold
                    && passesRules(s.record())) {
                candidates.add(s.record().getRowId());
                count++;
            }
        }
        double ratioInGroup = n == 0 ? Double.NaN : (double) count / n;
        double ratioOverall = totalSamples == 0 ? Double.NaN : (double) count / totalSamples;
        return new CategoryStats(category, n, type, lower, upper, floor, ratingPercentile, threshold,
                count, ratioInGroup, ratioOverall);
    }

    private boolean passesRules(CatalogRecord record) {
        for (ColumnRule rule : columnRules) {
            if (!rule.test(record)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Writes the configured marker into {@code candidateColumn} for candidates and clears it for every other row.
     */
    public void applyCandidateMarkers(WorkingTable table, DynamicFilterResult result, String candidateColumn) {
        table.ensureColumn(candidateColumn);
        for (CatalogRecord record : table.records()) {
            record.setValue(candidateColumn,
                    result.candidateRowIds().contains(record.getRowId()) ? properties.getCandidateMarker() : "");
        }
    }

    public DynamicFilterResult.Settings settings() {
        return new DynamicFilterResult.Settings(properties.getMinSampleSize(), properties.getReviewLowerPercentile(),
                properties.getReviewUpperPercentile(), properties.getRatingPercentileLarge(), columnRules.size());
    }

    public List<ColumnRule> getColumnRules() {
        return columnRules;
    }

    static Double parseNumber(String cell) {
        if (cell == null) {
            return null;
        }
        String s = cell.strip();
        if (s.isEmpty()) {
            return null;
        }
        try {
            double v = Double.parseDouble(s);
            return Double.isNaN(v) || Double.isInfinite(v) ? null : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private record Sample(CatalogRecord record, double rating, Double reviews) {
    }
}
