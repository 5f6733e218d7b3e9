package com.catalogenricher.enrichment.config;

import com.catalogenricher.enrichment.filter.ColumnRuleKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the configuration a run depends on and reports every problem at once.
 */
@Component
@RequiredArgsConstructor
public class EnrichmentSettingsValidator {

    private final TableColumnProperties columns;
    private final FetchProperties fetch;
    private final ThresholdFilterProperties filter;
    private final CacheProperties cache;

    /**
     * @throws EnrichmentConfigurationException listing all problems found
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        validateColumns(problems);
        validateFetch(problems);
        validateFilter(problems);
        if (cache.getStaleDays() < 0) {
            problems.add("enricher.cache.stale-days must not be negative");
        }
        if (cache.getWriteBatchSize() <= 0) {
            problems.add("enricher.cache.write-batch-size must be positive");
        }
        if (!problems.isEmpty()) {
            throw new EnrichmentConfigurationException("Invalid enrichment configuration: " + String.join("; ", problems));
        }
    }

    private void validateColumns(List<String> problems) {
        requireColumn(problems, "barcode", columns.getBarcode());
        requireColumn(problems, "identifier", columns.getIdentifier());
        requireColumn(problems, "status", columns.getStatus());
        requireColumn(problems, "source", columns.getSource());
        requireColumn(problems, "candidate", columns.getCandidate());
        if (columns.getStatus() != null && columns.getStatus().equals(columns.getSource())) {
            problems.add("enricher.columns.status and enricher.columns.source must differ");
        }
        if (columns.getFieldsMapping() == null || columns.getFieldsMapping().isEmpty()) {
            problems.add("enricher.columns.fields-mapping must not be empty");
        }
    }

    private void validateFetch(List<String> problems) {
        if (fetch.getMaxConcurrent() <= 0) {
            problems.add("enricher.fetch.max-concurrent must be positive");
        }
        if (!(fetch.getQps() > 0)) {
            problems.add("enricher.fetch.qps must be positive");
        }
        if (fetch.getTimeoutMs() <= 0) {
            problems.add("enricher.fetch.timeout-ms must be positive");
        }
        if (fetch.getSaveInterval() <= 0) {
            problems.add("enricher.fetch.save-interval must be positive");
        }
        if (fetch.getBaseUrl() == null || fetch.getBaseUrl().isBlank()) {
            problems.add("enricher.fetch.base-url is required");
        }
        FetchProperties.Retry retry = fetch.getRetry();
        if (retry.getMaxTimes() <= 0) {
            problems.add("enricher.fetch.retry.max-times must be positive");
        }
        if (retry.getBackoffMs() == null || retry.getBackoffMs().isEmpty()) {
            problems.add("enricher.fetch.retry.backoff-ms must list at least one delay");
        } else if (retry.getBackoffMs().stream().anyMatch(d -> d == null || d < 0)) {
            problems.add("enricher.fetch.retry.backoff-ms entries must be non-negative");
        }
        FetchProperties.RandomDelay delay = fetch.getRandomDelay();
        if (delay.getMinMs() < 0 || delay.getMaxMs() < delay.getMinMs()) {
            problems.add("enricher.fetch.random-delay requires 0 <= min-ms <= max-ms");
        }
        FetchProperties.BatchCooldown cooldown = fetch.getBatchCooldown();
        if (cooldown.isEnabled() && cooldown.getInterval() <= 0) {
            problems.add("enricher.fetch.batch-cooldown.interval must be positive");
        }
        if (cooldown.getMinMs() < 0 || cooldown.getMaxMs() < cooldown.getMinMs()) {
            problems.add("enricher.fetch.batch-cooldown requires 0 <= min-ms <= max-ms");
        }
    }

    private void validateFilter(List<String> problems) {
        if (!filter.isEnabled()) {
            return;
        }
        if (columns.columnFor("rating") == null) {
            problems.add("enricher.columns.fields-mapping.rating is required when the filter is enabled");
        }
        if (columns.columnFor("rating_count") == null) {
            problems.add("enricher.columns.fields-mapping.rating_count is required when the filter is enabled");
        }
        requirePercentile(problems, "review-lower-percentile", filter.getReviewLowerPercentile());
        requirePercentile(problems, "review-upper-percentile", filter.getReviewUpperPercentile());
        requirePercentile(problems, "rating-percentile-large", filter.getRatingPercentileLarge());
        if (filter.getReviewLowerPercentile() > filter.getReviewUpperPercentile()) {
            problems.add("enricher.filter.review-lower-percentile must not exceed review-upper-percentile");
        }
        if (filter.getMinSampleSize() < 0) {
            problems.add("enricher.filter.min-sample-size must not be negative");
        }
        ThresholdFilterProperties.ColumnFilters columnFilters = filter.getColumnFilters();
        if (columnFilters != null && columnFilters.isEnabled() && columnFilters.getRules() != null) {
            for (ThresholdFilterProperties.Rule rule : columnFilters.getRules()) {
                if (!rule.isEnabled()) {
                    continue;
                }
                if (rule.getColumn() == null || rule.getColumn().isBlank()) {
                    problems.add("enricher.filter.column-filters rule without column");
                    continue;
                }
                try {
                    ColumnRuleKind.fromKey(rule.getFilterType()).create(rule.getColumn(), rule.getPattern());
                } catch (EnrichmentConfigurationException e) {
                    problems.add(e.getMessage());
                }
            }
        }
    }

    private static void requireColumn(List<String> problems, String name, String value) {
        if (value == null || value.isBlank()) {
            problems.add("enricher.columns." + name + " is required");
        }
    }

    private static void requirePercentile(List<String> problems, String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            problems.add("enricher.filter." + name + " must be within [0, 100]");
        }
    }
}
