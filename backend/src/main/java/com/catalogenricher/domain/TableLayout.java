package com.catalogenricher.domain;

import java.util.Objects;

/**
 * Column names the pipeline reads and writes. Status and source columns are reserved: loaded values are
 * replaced by the row's own state on output.
 */
public record TableLayout(String barcodeColumn, String identifierColumn, String statusColumn, String sourceColumn) {

    public TableLayout {
        Objects.requireNonNull(barcodeColumn, "barcodeColumn");
        Objects.requireNonNull(identifierColumn, "identifierColumn");
        Objects.requireNonNull(statusColumn, "statusColumn");
        Objects.requireNonNull(sourceColumn, "sourceColumn");
    }

    public boolean isReserved(String column) {
        return statusColumn.equals(column) || sourceColumn.equals(column);
    }
}
