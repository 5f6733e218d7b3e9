package com.catalogenricher.enrichment.fetch;

/**
 * Outcome of looking up one identifier. FOUND and NOT_FOUND are definitive and may be reused for the same
 * identifier; FAILED (errors, retries exhausted) is not.
 */
public record MetadataLookup(Outcome outcome, MetadataPayload payload, String reason) {

    public enum Outcome {
        FOUND,
        NOT_FOUND,
        FAILED
    }

    public static MetadataLookup found(MetadataPayload payload) {
        return new MetadataLookup(Outcome.FOUND, payload, null);
    }

    public static MetadataLookup notFound(String reason) {
        return new MetadataLookup(Outcome.NOT_FOUND, null, reason);
    }

    public static MetadataLookup failed(String reason) {
        return new MetadataLookup(Outcome.FAILED, null, reason);
    }

    public boolean isFound() {
        return outcome == Outcome.FOUND;
    }

    public boolean isDefinitive() {
        return outcome != Outcome.FAILED;
    }
}
