package com.catalogenricher.enrichment.fetch;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop flag, checked between requests, never mid-flight. Waits between requests go through
 * {@link #awaitStop(long)} so a stop ends them early.
 */
public class StopSignal {

    private final CountDownLatch stopRequested = new CountDownLatch(1);

    public void requestStop() {
        stopRequested.countDown();
    }

    public boolean isStopRequested() {
        return stopRequested.getCount() == 0;
    }

    /**
     * Waits up to {@code millis} or until a stop is requested, whichever comes first.
     *
     * @return true when a stop has been requested
     */
    public boolean awaitStop(long millis) throws InterruptedException {
        if (millis <= 0) {
            return isStopRequested();
        }
        return stopRequested.await(millis, TimeUnit.MILLISECONDS);
    }
}
