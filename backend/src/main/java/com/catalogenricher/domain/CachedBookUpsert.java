package com.catalogenricher.domain;

import java.util.Map;

/**
 * One write request for the book cache.
 */
public record CachedBookUpsert(String barcode, String identifier, Map<String, String> fields) {

    public CachedBookUpsert {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
