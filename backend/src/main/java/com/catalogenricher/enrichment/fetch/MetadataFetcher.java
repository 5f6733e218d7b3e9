package com.catalogenricher.enrichment.fetch;

import com.catalogenricher.common.RateLimiter;
import com.catalogenricher.common.RetryPolicy;
import com.catalogenricher.config.AsyncConfig;
import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.WorkingTable;
import com.catalogenricher.enrichment.cache.CacheFieldMapper;
import com.catalogenricher.enrichment.config.FetchProperties;
import com.catalogenricher.enrichment.progress.ProgressTracker;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetches metadata for every eligible row: non-terminal, fetch-eligible category, normalized identifier present.
 * <p>
 * Requests are gated by the worker pool and a semaphore (max-concurrent), the shared pacing limiter (qps) and a
 * pool-wide cooldown every batch-cooldown.interval requests. Per attempt: stop check, jitter, cooldown wait,
 * stop check, permit, request with timeout. After a retryable failure the worker waits the backoff schedule entry
 * for that attempt before starting the next one. All waits end early when a stop is requested.
 */
@Component
@Slf4j
public class MetadataFetcher {

    private static final long TIMEOUT_GRACE_MS = 1_000L;

    private final FetchProperties fetchProperties;
    private final MetadataSource metadataSource;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final Cache<String, MetadataLookup> lookupCache;
    private final CacheFieldMapper fieldMapper;
    private final Sleeper sleeper;

    @Autowired
    public MetadataFetcher(FetchProperties fetchProperties, MetadataSource metadataSource, RateLimiter rateLimiter,
                           RetryPolicy retryPolicy, @Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor executor,
                           Cache<String, MetadataLookup> lookupCache, CacheFieldMapper fieldMapper) {
        this(fetchProperties, metadataSource, rateLimiter, retryPolicy, executor, lookupCache, fieldMapper,
                (millis, stop) -> stop.awaitStop(millis));
    }

    MetadataFetcher(FetchProperties fetchProperties, MetadataSource metadataSource, RateLimiter rateLimiter,
                    RetryPolicy retryPolicy, Executor executor, Cache<String, MetadataLookup> lookupCache,
                    CacheFieldMapper fieldMapper, Sleeper sleeper) {
        this.fetchProperties = fetchProperties;
        this.metadataSource = metadataSource;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.lookupCache = lookupCache;
        this.fieldMapper = fieldMapper;
        this.sleeper = sleeper;
    }

    public FetchStats fetch(WorkingTable table, ClassificationManifest manifest, ProgressTracker tracker,
                            StopSignal stopSignal) {
        List<CatalogRecord> work = new ArrayList<>();
        for (CatalogRecord record : table.records()) {
            if (!tracker.shouldSkip(record) && manifest.isFetchEligible(record.getRowId())
                    && record.hasNormalizedIdentifier()) {
                work.add(record);
            }
        }
        if (work.isEmpty()) {
            log.info("Fetch: nothing to do");
            return FetchStats.empty();
        }
        log.info("Fetch: {} rows eligible (max-concurrent={}, qps={})",
                work.size(), fetchProperties.getMaxConcurrent(), fetchProperties.getQps());

        FetchRun run = new FetchRun(table, manifest, tracker, stopSignal,
                new Semaphore(Math.max(1, fetchProperties.getMaxConcurrent())));
        List<CompletableFuture<Void>> futures = new ArrayList<>(work.size());
        for (CatalogRecord record : work) {
            try {
                futures.add(CompletableFuture.runAsync(() -> processRow(run, record), executor));
            } catch (RejectedExecutionException e) {
                log.warn("Fetch executor rejected row {}: {}", record.getRowId(), e.getMessage());
                run.cancelled.incrementAndGet();
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        boolean stopped = stopSignal.isStopRequested();
        tracker.checkpoint(table, manifest, true, stopped ? "fetch stopped" : "fetch complete");
        FetchStats stats = new FetchStats(work.size(), run.attempted.get(), run.succeeded.get(), run.notFound.get(),
                run.cancelled.get(), run.lookupCacheHits.get(), run.requests.get(), run.cooldowns.get(), stopped);
        log.info("Fetch {}: {} attempted, {} found, {} not found, {} left pending, {} lookup cache hits, {} requests, {} cooldowns",
                stopped ? "stopped" : "finished", stats.attempted(), stats.succeeded(), stats.notFound(),
                stats.cancelled(), stats.lookupCacheHits(), stats.requests(), stats.cooldowns());
        return stats;
    }

    private void processRow(FetchRun run, CatalogRecord record) {
        boolean acquired = false;
        try {
            run.permits.acquire();
            acquired = true;
            if (run.stopSignal.isStopRequested()) {
                run.cancelled.incrementAndGet();
                return;
            }
            if (run.tracker.shouldSkip(record)) {
                return;
            }
            String identifier = record.getNormalizedIdentifier();
            MetadataLookup lookup = lookupCache.getIfPresent(identifier);
            if (lookup != null) {
                run.lookupCacheHits.incrementAndGet();
            } else {
                lookup = lookupWithRetry(run, identifier);
                if (lookup == null) {
                    run.cancelled.incrementAndGet();
                    return;
                }
                if (lookup.isDefinitive()) {
                    lookupCache.put(identifier, lookup);
                }
            }
            run.attempted.incrementAndGet();
            apply(run, record, lookup);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancelled.incrementAndGet();
        } catch (RuntimeException e) {
            log.warn("Fetch failed unexpectedly for row {}: {}", record.getRowId(), e.getMessage(), e);
            run.attempted.incrementAndGet();
            if (run.tracker.markNotFound(record, "unexpected error: " + e.getMessage())) {
                run.notFound.incrementAndGet();
            }
        } finally {
            if (acquired) {
                run.permits.release();
            }
        }
    }

    /**
     * @return the lookup outcome, or null when stopped before a definitive answer
     */
    private MetadataLookup lookupWithRetry(FetchRun run, String identifier) throws InterruptedException {
        Duration timeout = Duration.ofMillis(Math.max(1, fetchProperties.getTimeoutMs()));
        int attempt = 0;
        String lastError = null;
        while (true) {
            if (run.stopSignal.isStopRequested()) {
                return null;
            }
            attempt++;
            sleeper.sleep(retryPolicy.jitterMs(), run.stopSignal);
            awaitCooldown(run);
            if (run.stopSignal.isStopRequested()) {
                return null;
            }
            rateLimiter.acquire();
            registerRequest(run);
            try {
                return metadataSource.fetchByIdentifier(identifier, timeout)
                        .get(timeout.toMillis() + TIMEOUT_GRACE_MS, TimeUnit.MILLISECONDS);
            } catch (ExecutionException | MetadataSourceException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                if (cause instanceof MetadataSourceException mse && !mse.isRetryable()) {
                    log.debug("Lookup {} failed permanently: {}", identifier, mse.getMessage());
                    return MetadataLookup.failed(mse.getMessage());
                }
                lastError = cause.getMessage();
            } catch (TimeoutException e) {
                lastError = "timeout after " + timeout.toMillis() + " ms";
            }
            if (!retryPolicy.canRetry(attempt)) {
                log.warn("Lookup {} gave up after {} attempts: {}", identifier, attempt, lastError);
                return MetadataLookup.failed("retries exhausted after " + attempt + " attempts: " + lastError);
            }
            long backoff = retryPolicy.backoffMs(attempt);
            log.debug("Lookup {} attempt {} failed ({}), retrying in {} ms", identifier, attempt, lastError, backoff);
            sleeper.sleep(backoff, run.stopSignal);
        }
    }

    private void apply(FetchRun run, CatalogRecord record, MetadataLookup lookup) {
        if (lookup.isFound()) {
            Map<String, String> columns = fieldMapper.toColumns(lookup.payload().fields());
            if (run.tracker.markDoneWith(record, r -> columns.forEach(r::setValue), CatalogRecord.SOURCE_API)) {
                int done = run.succeeded.incrementAndGet();
                if (done % Math.max(1, fetchProperties.getSaveInterval()) == 0) {
                    run.tracker.checkpoint(run.table, run.manifest, true, "fetch progress " + done);
                }
            }
            return;
        }
        if (run.tracker.markNotFound(record, lookup.reason())) {
            run.notFound.incrementAndGet();
        }
    }

    private void registerRequest(FetchRun run) {
        int n = run.requests.incrementAndGet();
        FetchProperties.BatchCooldown cooldown = fetchProperties.getBatchCooldown();
        if (!cooldown.isEnabled() || cooldown.getInterval() <= 0 || n % cooldown.getInterval() != 0) {
            return;
        }
        long min = Math.max(0, cooldown.getMinMs());
        long max = Math.max(min, cooldown.getMaxMs());
        long pauseMs = min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(pauseMs);
        run.cooldownUntilNanos.accumulateAndGet(until, Math::max);
        run.cooldowns.incrementAndGet();
        log.info("Fetch cooldown after {} requests: pausing all workers for {} ms", n, pauseMs);
    }

    private void awaitCooldown(FetchRun run) throws InterruptedException {
        long remainingNanos = run.cooldownUntilNanos.get() - System.nanoTime();
        if (remainingNanos > 0) {
            sleeper.sleep(TimeUnit.NANOSECONDS.toMillis(remainingNanos) + 1, run.stopSignal);
        }
    }

    /** Pause between requests that ends early on stop; replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis, StopSignal stop) throws InterruptedException;
    }

    private static final class FetchRun {
        final WorkingTable table;
        final ClassificationManifest manifest;
        final ProgressTracker tracker;
        final StopSignal stopSignal;
        final Semaphore permits;
        final AtomicInteger attempted = new AtomicInteger();
        final AtomicInteger succeeded = new AtomicInteger();
        final AtomicInteger notFound = new AtomicInteger();
        final AtomicInteger cancelled = new AtomicInteger();
        final AtomicInteger lookupCacheHits = new AtomicInteger();
        final AtomicInteger requests = new AtomicInteger();
        final AtomicInteger cooldowns = new AtomicInteger();
        final AtomicLong cooldownUntilNanos = new AtomicLong(System.nanoTime());

        FetchRun(WorkingTable table, ClassificationManifest manifest, ProgressTracker tracker, StopSignal stopSignal,
                 Semaphore permits) {
            this.table = table;
            this.manifest = manifest;
            this.tracker = tracker;
            this.stopSignal = stopSignal;
            this.permits = permits;
        }
    }
}
