package com.catalogenricher.common;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Token pacing limiter shared by all fetch workers. At 0.5 qps a permit is handed out every two seconds,
 * regardless of how many workers are waiting.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(0);

    /**
     * @param permitsPerSecond e.g. 0.5 for one request every two seconds
     */
    public RateLimiter(double permitsPerSecond) {
        if (!(permitsPerSecond > 0) || Double.isInfinite(permitsPerSecond)) {
            throw new IllegalArgumentException("permitsPerSecond must be positive");
        }
        this.minIntervalNanos = Math.max(1L, (long) (1_000_000_000L / permitsPerSecond));
    }

    /**
     * Blocks until a permit is available, then returns.
     *
     * @throws InterruptedException when interrupted while waiting; no permit is taken
     */
    public void acquire() throws InterruptedException {
        long now;
        long next;
        do {
            now = System.nanoTime();
            next = nextFreeAtNanos.get();
            if (now >= next) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
            } else {
                long sleepNanos = next - now;
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            }
        } while (true);
    }

    /**
     * Non-blocking: returns true if a permit was taken, false if would block.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return now >= next && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }

    public long getMinIntervalNanos() {
        return minIntervalNanos;
    }
}
