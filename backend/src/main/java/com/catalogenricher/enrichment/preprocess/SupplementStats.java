package com.catalogenricher.enrichment.preprocess;

/**
 * Outcome of an identifier supplement pass. {@code skipReason} is null when the resolver ran.
 */
public record SupplementStats(int eligible, int attempted, int resolved, int failed, String skipReason) {

    public static SupplementStats skipped(int eligible, String reason) {
        return new SupplementStats(eligible, 0, 0, 0, reason);
    }

    public boolean ran() {
        return skipReason == null;
    }
}
