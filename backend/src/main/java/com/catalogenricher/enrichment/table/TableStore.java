package com.catalogenricher.enrichment.table;

import com.catalogenricher.domain.TabularData;

import java.nio.file.Path;

/**
 * Reads and writes whole tables. Implementations throw {@link TableStoreException} on I/O or format errors.
 */
public interface TableStore {

    TabularData load(Path path);

    void save(Path path, TabularData data);
}
