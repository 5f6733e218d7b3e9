package com.catalogenricher.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owned row arena indexed by row id, plus a barcode index. Row ids are list positions and never change
 * for the lifetime of a run (including across checkpoint/resume).
 */
public class WorkingTable {

    private final TableLayout layout;
    private final Set<String> columns;
    private final List<CatalogRecord> records;
    private final Map<String, List<Integer>> barcodeIndex = new HashMap<>();

    private WorkingTable(TableLayout layout, List<String> columns, List<CatalogRecord> records) {
        this.layout = layout;
        this.columns = new LinkedHashSet<>(columns);
        this.columns.add(layout.statusColumn());
        this.columns.add(layout.sourceColumn());
        this.records = new ArrayList<>(records);
        for (CatalogRecord r : this.records) {
            if (r.hasBarcode()) {
                barcodeIndex.computeIfAbsent(r.getBarcode(), k -> new ArrayList<>()).add(r.getRowId());
            }
        }
    }

    /**
     * Builds a fresh table from loaded input: every row starts PENDING regardless of any status cell present.
     * The barcode cell is rewritten in its normalized form.
     */
    public static WorkingTable fromTabular(TabularData data, TableLayout layout) {
        List<CatalogRecord> records = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            Map<String, String> values = data.rowAsMap(i);
            String barcode = CatalogRecord.normalizeBarcode(values.get(layout.barcodeColumn()));
            if (values.containsKey(layout.barcodeColumn())) {
                values.put(layout.barcodeColumn(), barcode);
            }
            values.remove(layout.statusColumn());
            values.remove(layout.sourceColumn());
            records.add(new CatalogRecord(i, barcode, values));
        }
        return new WorkingTable(layout, data.columns(), records);
    }

    /**
     * Rebuilds a table from already-materialized records, e.g. a checkpoint. Records must be ordered by row id.
     */
    public static WorkingTable restore(TableLayout layout, List<String> columns, List<CatalogRecord> records) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).getRowId() != i) {
                throw new IllegalArgumentException("Row ids must be contiguous from 0, found " + records.get(i).getRowId() + " at " + i);
            }
        }
        return new WorkingTable(layout, columns, records);
    }

    public TableLayout getLayout() {
        return layout;
    }

    public int size() {
        return records.size();
    }

    public CatalogRecord get(int rowId) {
        return records.get(rowId);
    }

    public List<CatalogRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public List<CatalogRecord> findByBarcode(String barcode) {
        List<Integer> ids = barcodeIndex.get(CatalogRecord.normalizeBarcode(barcode));
        if (ids == null) {
            return List.of();
        }
        List<CatalogRecord> out = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            out.add(records.get(id));
        }
        return out;
    }

    public synchronized void ensureColumn(String column) {
        if (column != null && !column.isBlank()) {
            columns.add(column);
        }
    }

    public synchronized boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public synchronized List<String> columns() {
        return List.copyOf(columns);
    }

    /**
     * Output view: reserved status and source cells are rendered from row state.
     */
    public TabularData toTabular() {
        List<String> header = columns();
        List<List<String>> rows = new ArrayList<>(records.size());
        for (CatalogRecord r : records) {
            List<String> row = new ArrayList<>(header.size());
            for (String column : header) {
                if (column.equals(layout.statusColumn())) {
                    row.add(r.getStatus().name());
                } else if (column.equals(layout.sourceColumn())) {
                    row.add(r.getSourceTagsCell());
                } else {
                    row.add(r.getValue(column));
                }
            }
            rows.add(row);
        }
        return new TabularData(header, rows);
    }

    /**
     * Deep copy; callers must exclude concurrent row writers while copying.
     */
    public WorkingTable copy() {
        List<CatalogRecord> copied = new ArrayList<>(records.size());
        for (CatalogRecord r : records) {
            copied.add(r.copy());
        }
        return new WorkingTable(layout, columns(), copied);
    }
}
