package com.catalogenricher.enrichment.report;

import com.catalogenricher.domain.CacheCategory;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.enrichment.classifier.ClassificationStats;
import com.catalogenricher.enrichment.fetch.FetchStats;
import com.catalogenricher.enrichment.filter.DynamicFilterResult;
import com.catalogenricher.enrichment.preprocess.PreprocessStats;
import com.catalogenricher.enrichment.preprocess.SupplementStats;
import com.catalogenricher.enrichment.store.CacheWriteResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything the run report shows. Step results are null when the step did not run.
 */
public record RunReport(String input, String output, Instant generatedAt, boolean resumed, int totalRows,
                        Map<RecordStatus, Integer> statusCounts, Map<CacheCategory, Integer> categoryCounts,
                        PreprocessStats preprocess, SupplementStats supplement, ClassificationStats classification,
                        FetchStats fetch, CacheWriteResult cacheWrite, DynamicFilterResult filter,
                        List<FailedRow> failedRows) {

    /**
     * A row that ended without data, with the reason recorded for it.
     */
    public record FailedRow(int rowId, String barcode, String identifier, RecordStatus status, String reason) {
    }
}
