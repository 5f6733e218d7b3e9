package com.catalogenricher.enrichment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column names of the working table. Nothing in the pipeline hard-codes a column; everything is looked up here.
 */
@ConfigurationProperties(prefix = "enricher.columns")
@Getter
@Setter
public class TableColumnProperties {

    /** Primary key column of a physical item. Required. */
    private String barcode = "barcode";

    /** Raw ISBN-like identifier column. Required. */
    private String identifier = "isbn";

    /** Reserved status column, overwritten on output. */
    private String status = "processing_status";

    /** Reserved source tags column ("api", "cache"), overwritten on output. */
    private String source = "data_source";

    /** Candidate marker column appended by the threshold filter. */
    private String candidate = "candidate";

    /** Call number column; its first Latin letter is the filter category. */
    private String callNumber = "call_number";

    /**
     * Logical metadata field → table column. Keys are the cache field names (title, rating, rating_count, url, ...).
     */
    private Map<String, String> fieldsMapping = new LinkedHashMap<>(defaultMapping());

    public String columnFor(String logicalField) {
        return fieldsMapping == null ? null : fieldsMapping.get(logicalField);
    }

    static Map<String, String> defaultMapping() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("title", "title");
        m.put("subtitle", "subtitle");
        m.put("original_title", "original_title");
        m.put("author", "author");
        m.put("translator", "translator");
        m.put("publisher", "publisher");
        m.put("producer", "producer");
        m.put("series", "series");
        m.put("price", "price");
        m.put("isbn", "isbn_source");
        m.put("pages", "pages");
        m.put("binding", "binding");
        m.put("pub_year", "pub_year");
        m.put("rating", "rating");
        m.put("rating_count", "rating_count");
        m.put("summary", "summary");
        m.put("author_intro", "author_intro");
        m.put("catalog", "catalog");
        m.put("cover_image", "cover_image");
        m.put("url", "url");
        return m;
    }
}
