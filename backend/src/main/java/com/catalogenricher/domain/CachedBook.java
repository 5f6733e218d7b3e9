package com.catalogenricher.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cached metadata for one physical item, keyed by barcode. Field keys are logical names (title, summary, ...),
 * not table column names.
 */
@Document(collection = "books")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CachedBook {

    @Id
    @EqualsAndHashCode.Include
    private String barcode;
    @Indexed
    private String identifier;
    private Map<String, String> fields = new LinkedHashMap<>();
    private Instant createdAt;
    /** Drives staleness; refreshed on every upsert. */
    private Instant updatedAt;
    private long dataVersion;
}
