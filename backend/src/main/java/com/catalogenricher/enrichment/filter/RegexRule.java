package com.catalogenricher.enrichment.filter;

import com.catalogenricher.domain.CatalogRecord;

import java.util.regex.Pattern;

/**
 * Passes when the cell matches the pattern at its start (the rest of the cell may be anything).
 */
public record RegexRule(String column, Pattern pattern) implements ColumnRule {

    @Override
    public boolean test(CatalogRecord record) {
        return pattern.matcher(record.getValue(column)).lookingAt();
    }
}
