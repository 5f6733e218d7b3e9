package com.catalogenricher.enrichment.cache;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A cache hit: logical field map and the time it was last refreshed (null when unknown).
 */
public record CacheEntry(String barcode, Map<String, String> fields, Instant updatedAt) {

    public CacheEntry {
        Map<String, String> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public boolean hasField(String key) {
        String v = fields.get(key);
        return v != null && !v.isBlank();
    }
}
