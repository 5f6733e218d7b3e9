package com.catalogenricher.enrichment.classifier;

import com.catalogenricher.domain.CacheCategory;
import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.cache.BookCache;
import com.catalogenricher.enrichment.cache.CacheEntry;
import com.catalogenricher.enrichment.cache.CacheFieldMapper;
import com.catalogenricher.enrichment.config.CacheProperties;
import com.catalogenricher.enrichment.progress.ProgressTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sorts non-terminal rows into cache categories and backfills cached fields.
 * <ul>
 *   <li>hit, stale → existing_stale, stays PENDING</li>
 *   <li>hit, incomplete → existing_valid_incomplete, stays PENDING</li>
 *   <li>hit, complete and fresh → existing_valid, FROM_DB</li>
 *   <li>miss, no barcode, or cache read error → new, stays PENDING</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheClassifier {

    private final BookCache bookCache;
    private final CacheFieldMapper fieldMapper;
    private final RefreshPolicy refreshPolicy;
    private final CompletenessPolicy completenessPolicy;
    private final CacheProperties cacheProperties;

    public ClassificationStats classify(WorkingTable table, ClassificationManifest manifest, ProgressTracker tracker) {
        return classify(table, manifest, tracker, false);
    }

    /**
     * @param forceRefresh treat every cache hit as stale for this run
     */
    public ClassificationStats classify(WorkingTable table, ClassificationManifest manifest, ProgressTracker tracker,
                                        boolean forceRefresh) {
        boolean cacheEnabled = cacheProperties.isEnabled();
        RefreshPolicy policy = forceRefresh ? RefreshPolicy.forced() : refreshPolicy;
        Map<CacheCategory, Integer> counts = new EnumMap<>(CacheCategory.class);
        Map<String, Optional<CacheEntry>> lookups = new HashMap<>();
        int examined = 0;
        int skipped = 0;
        AtomicInteger cacheErrors = new AtomicInteger();
        for (CatalogRecord record : table.records()) {
            if (tracker.shouldSkip(record)) {
                skipped++;
                continue;
            }
            examined++;
            CacheCategory category = cacheEnabled
                    ? classifyOne(record, tracker, policy, lookups, cacheErrors)
                    : CacheCategory.NEW;
            manifest.assign(record.getRowId(), category);
            counts.merge(category, 1, Integer::sum);
        }
        ClassificationStats stats = new ClassificationStats(examined, skipped,
                counts.getOrDefault(CacheCategory.EXISTING_VALID, 0),
                counts.getOrDefault(CacheCategory.EXISTING_VALID_INCOMPLETE, 0),
                counts.getOrDefault(CacheCategory.EXISTING_STALE, 0),
                counts.getOrDefault(CacheCategory.NEW, 0),
                cacheErrors.get(), cacheEnabled);
        log.info("Classify: {} examined, {} terminal skipped; valid={}, incomplete={}, stale={}, new={}, cache errors={}{}",
                examined, skipped, stats.existingValid(), stats.existingValidIncomplete(), stats.existingStale(),
                stats.newRows(), stats.cacheErrors(), cacheEnabled ? "" : " (cache disabled)");
        return stats;
    }

    private CacheCategory classifyOne(CatalogRecord record, ProgressTracker tracker, RefreshPolicy policy,
                                      Map<String, Optional<CacheEntry>> lookups, AtomicInteger cacheErrors) {
        if (!record.hasBarcode()) {
            return CacheCategory.NEW;
        }
        Optional<CacheEntry> hit;
        try {
            hit = lookups.get(record.getBarcode());
            if (hit == null) {
                hit = bookCache.getByKey(record.getBarcode());
                lookups.put(record.getBarcode(), hit);
            }
        } catch (RuntimeException e) {
            cacheErrors.incrementAndGet();
            log.warn("Cache read failed for barcode {}, treating as new: {}", record.getBarcode(), e.getMessage());
            return CacheCategory.NEW;
        }
        if (hit.isEmpty()) {
            return CacheCategory.NEW;
        }
        CacheEntry entry = hit.get();
        Map<String, String> columns = fieldMapper.toColumns(entry.fields());
        tracker.updateRow(record, r -> {
            columns.forEach(r::setValue);
            r.addSourceTag(CatalogRecord.SOURCE_CACHE);
        });
        if (policy.isStale(entry)) {
            return CacheCategory.EXISTING_STALE;
        }
        if (!completenessPolicy.isComplete(entry)) {
            return CacheCategory.EXISTING_VALID_INCOMPLETE;
        }
        tracker.markFromDb(record);
        return CacheCategory.EXISTING_VALID;
    }
}
