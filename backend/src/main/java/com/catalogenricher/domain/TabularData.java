package com.catalogenricher.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain header + rows view of a table, as exchanged with table stores. Rows shorter than the header are
 * padded with empty cells when read.
 */
public record TabularData(List<String> columns, List<List<String>> rows) {

    public TabularData {
        columns = List.copyOf(columns);
        List<List<String>> copied = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copied.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public int size() {
        return rows.size();
    }

    /**
     * Row as a column → value map in header order. Missing cells become "".
     */
    public Map<String, String> rowAsMap(int index) {
        List<String> row = rows.get(index);
        Map<String, String> values = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            String cell = c < row.size() ? row.get(c) : null;
            values.put(columns.get(c), cell == null ? "" : cell);
        }
        return values;
    }
}
