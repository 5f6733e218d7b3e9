package com.catalogenricher.enrichment.progress;

import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.domain.ClassificationManifest;
import com.catalogenricher.domain.RecordStatus;
import com.catalogenricher.domain.TableLayout;
import com.catalogenricher.domain.WorkingTable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a working table plus its classification manifest.
 */
public record CheckpointSnapshot(int version, Instant savedAt, String reason, List<String> columns,
                                 List<RowSnapshot> rows, Map<String, List<Integer>> categories) {

    public static final int CURRENT_VERSION = 1;

    public record RowSnapshot(int rowId, String barcode, Map<String, String> values, String normalizedIdentifier,
                              RecordStatus status, List<String> sourceTags, String failureReason) {
    }

    /**
     * Copies table state. Callers must hold the table exclusively while capturing.
     */
    public static CheckpointSnapshot capture(WorkingTable table, ClassificationManifest manifest,
                                             Instant savedAt, String reason) {
        List<RowSnapshot> rows = new ArrayList<>(table.size());
        for (CatalogRecord r : table.records()) {
            rows.add(new RowSnapshot(r.getRowId(), r.getBarcode(), new LinkedHashMap<>(r.getValues()),
                    r.getNormalizedIdentifier(), r.getStatus(), List.copyOf(r.getSourceTags()), r.getFailureReason()));
        }
        return new CheckpointSnapshot(CURRENT_VERSION, savedAt, reason, table.columns(), rows,
                manifest == null ? Map.of() : manifest.toKeyedMap());
    }

    public WorkingTable toTable(TableLayout layout) {
        List<CatalogRecord> records = new ArrayList<>(rows.size());
        for (RowSnapshot row : rows) {
            records.add(CatalogRecord.restore(row.rowId(), row.barcode(), row.values() == null ? Map.of() : row.values(),
                    row.normalizedIdentifier(), row.status(), row.sourceTags(), row.failureReason()));
        }
        records.sort((a, b) -> Integer.compare(a.getRowId(), b.getRowId()));
        return WorkingTable.restore(layout, columns, records);
    }

    public ClassificationManifest toManifest() {
        return ClassificationManifest.fromKeyedMap(categories);
    }
}
