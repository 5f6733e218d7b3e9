package com.catalogenricher.common;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fixed backoff schedule plus a uniform pre-request jitter window.
 * The schedule is indexed by the failed attempt (1-based); the last entry repeats once the schedule runs out.
 */
public final class RetryPolicy {

    private final List<Long> backoffScheduleMs;
    private final int maxAttempts;
    private final long jitterMinMs;
    private final long jitterMaxMs;

    public RetryPolicy(List<Long> backoffScheduleMs, int maxAttempts, long jitterMinMs, long jitterMaxMs) {
        if (backoffScheduleMs == null || backoffScheduleMs.isEmpty()) {
            throw new IllegalArgumentException("backoff schedule must not be empty");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (jitterMinMs < 0 || jitterMaxMs < jitterMinMs) {
            throw new IllegalArgumentException("jitter window must satisfy 0 <= min <= max");
        }
        this.backoffScheduleMs = List.copyOf(backoffScheduleMs);
        this.maxAttempts = maxAttempts;
        this.jitterMinMs = jitterMinMs;
        this.jitterMaxMs = jitterMaxMs;
    }

    /**
     * Delay in milliseconds after the given failed attempt (1-based).
     */
    public long backoffMs(int failedAttempt) {
        int index = Math.min(Math.max(failedAttempt, 1) - 1, backoffScheduleMs.size() - 1);
        return Math.max(0, backoffScheduleMs.get(index));
    }

    /**
     * Random delay in [min, max] to wait immediately before a request.
     */
    public long jitterMs() {
        if (jitterMaxMs == jitterMinMs) {
            return jitterMinMs;
        }
        return ThreadLocalRandom.current().nextLong(jitterMinMs, jitterMaxMs + 1);
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} attempts.
     */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public List<Long> getBackoffScheduleMs() {
        return backoffScheduleMs;
    }

    /**
     * Default: 3 attempts, backoff 2s / 5s / 10s, jitter 1.5s to 3.5s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(List.of(2000L, 5000L, 10000L), 3, 1500L, 3500L);
    }
}
