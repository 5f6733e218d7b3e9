package com.catalogenricher.enrichment.config;

import com.catalogenricher.common.RateLimiter;
import com.catalogenricher.common.RetryPolicy;
import com.catalogenricher.enrichment.classifier.CompletenessPolicy;
import com.catalogenricher.enrichment.classifier.RefreshPolicy;
import com.catalogenricher.enrichment.classifier.RequiredFieldsCompletenessPolicy;
import com.catalogenricher.enrichment.fetch.MetadataLookup;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Enrichment module configuration: properties and shared beans (pacing limiter, retry policy, lookup cache,
 * cache classification policies).
 */
@Configuration
@EnableConfigurationProperties({
        TableColumnProperties.class,
        FetchProperties.class,
        CacheProperties.class,
        CheckpointProperties.class,
        ThresholdFilterProperties.class,
        SupplementProperties.class,
        OutputProperties.class
})
public class EnrichmentConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter metadataRateLimiter(FetchProperties fetchProperties) {
        return new RateLimiter(fetchProperties.getQps());
    }

    @Bean
    public RetryPolicy metadataRetryPolicy(FetchProperties fetchProperties) {
        FetchProperties.RandomDelay delay = fetchProperties.getRandomDelay();
        long jitterMin = delay.isEnabled() ? delay.getMinMs() : 0L;
        long jitterMax = delay.isEnabled() ? delay.getMaxMs() : 0L;
        return new RetryPolicy(fetchProperties.getRetry().getBackoffMs(), fetchProperties.getRetry().getMaxTimes(),
                jitterMin, jitterMax);
    }

    /** Identifier → definitive lookup outcome, so duplicated identifiers cost one request. */
    @Bean
    public Cache<String, MetadataLookup> metadataLookupCache(FetchProperties fetchProperties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(Math.max(1, fetchProperties.getLookupCacheSize()))
                .build();
    }

    @Bean
    public RefreshPolicy refreshPolicy(CacheProperties cacheProperties, Clock clock) {
        if (cacheProperties.isForceUpdate()) {
            return RefreshPolicy.forced();
        }
        RefreshPolicy policy = RefreshPolicy.olderThan(Duration.ofDays(cacheProperties.getStaleDays()), clock);
        if (cacheProperties.getStaleWhenMissing() != null && !cacheProperties.getStaleWhenMissing().isEmpty()) {
            policy = policy.or(RefreshPolicy.missingAnyOf(cacheProperties.getStaleWhenMissing()));
        }
        return policy;
    }

    @Bean
    public CompletenessPolicy completenessPolicy(CacheProperties cacheProperties) {
        return new RequiredFieldsCompletenessPolicy(cacheProperties.getRequiredFields());
    }
}
