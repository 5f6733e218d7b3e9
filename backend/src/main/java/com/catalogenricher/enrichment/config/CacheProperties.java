package com.catalogenricher.enrichment.config;

import com.catalogenricher.domain.CacheUpdateMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Book cache read (classification) and write-back settings.
 */
@ConfigurationProperties(prefix = "enricher.cache")
@Getter
@Setter
public class CacheProperties {

    /**
     * When false, the cache is neither read nor written and every row is classified as new.
     */
    private boolean enabled = true;

    /** Cached entries older than this many days (by updatedAt) are stale. Default 30. */
    private int staleDays = 30;

    /** Treat every cache hit as stale. */
    private boolean forceUpdate = false;

    /** Logical fields a cache entry must have to count as complete. */
    private List<String> requiredFields = new ArrayList<>(List.of("title", "summary", "cover_image"));

    /** A cache entry missing any of these logical fields is stale. Default: url. */
    private List<String> staleWhenMissing = new ArrayList<>(List.of("url"));

    private CacheUpdateMode updateMode = CacheUpdateMode.MERGE;

    /** Upserts per bulk request. */
    private int writeBatchSize = 100;
}
