package com.catalogenricher.enrichment.filter;

import com.catalogenricher.domain.CatalogRecord;

/**
 * Passes when the cell is not blank.
 */
public record NotEmptyRule(String column) implements ColumnRule {

    @Override
    public boolean test(CatalogRecord record) {
        return !record.getValue(column).isBlank();
    }
}
