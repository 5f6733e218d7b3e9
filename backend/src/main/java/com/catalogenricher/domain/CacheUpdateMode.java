package com.catalogenricher.domain;

/**
 * How an upsert treats fields already stored for the same barcode.
 */
public enum CacheUpdateMode {
    /** Only non-blank incoming fields are written; everything else is kept. */
    MERGE,
    /** The stored field map is replaced by the non-blank incoming fields. */
    OVERWRITE
}
