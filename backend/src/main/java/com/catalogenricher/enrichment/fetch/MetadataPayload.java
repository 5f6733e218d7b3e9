package com.catalogenricher.enrichment.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata returned for one identifier, keyed by logical field name.
 */
public record MetadataPayload(String identifier, Map<String, String> fields) {

    public MetadataPayload {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
