package com.catalogenricher.enrichment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * External metadata source client and fetch scheduling: concurrency, pacing, cooldowns, retries.
 */
@ConfigurationProperties(prefix = "enricher.fetch")
@Getter
@Setter
public class FetchProperties {

    /** Lookup endpoint; the identifier is appended as a path segment. */
    private String baseUrl = "https://m.douban.com/rexxar/api/v2/book/isbn";

    /** Worker pool size and in-flight request cap. Default 2. */
    private int maxConcurrent = 2;

    /** Target request rate across all workers. Default 0.5 (one request every 2 seconds). */
    private double qps = 0.5;

    /** Per-request timeout. Default 15000 ms. */
    private long timeoutMs = 15_000L;

    /** Forced checkpoint every N successful fetches. Default 15. */
    private int saveInterval = 15;

    /** Max entries in the per-run identifier lookup cache. */
    private long lookupCacheSize = 10_000L;

    /** Rotated per request. Empty uses a built-in list. */
    private List<String> userAgents = new ArrayList<>();

    private RandomDelay randomDelay = new RandomDelay();
    private BatchCooldown batchCooldown = new BatchCooldown();
    private Retry retry = new Retry();

    /**
     * Jitter before every request.
     */
    @Getter
    @Setter
    public static class RandomDelay {
        private boolean enabled = true;
        private long minMs = 1_500L;
        private long maxMs = 3_500L;
    }

    /**
     * Pool-wide pause every {@code interval} requests.
     */
    @Getter
    @Setter
    public static class BatchCooldown {
        private boolean enabled = true;
        private int interval = 20;
        private long minMs = 30_000L;
        private long maxMs = 60_000L;
    }

    @Getter
    @Setter
    public static class Retry {
        /** Total attempts per row, first request included. Default 3. */
        private int maxTimes = 3;
        /** Wait after the n-th failed attempt; the last entry repeats. */
        private List<Long> backoffMs = new ArrayList<>(List.of(2_000L, 5_000L, 10_000L));
    }
}
