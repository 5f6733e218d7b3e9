package com.catalogenricher.enrichment.filter;

import com.catalogenricher.domain.CatalogRecord;

/**
 * Auxiliary per-column check a candidate must pass. Built once from configuration via {@link ColumnRuleKind}.
 */
public interface ColumnRule {

    String column();

    boolean test(CatalogRecord record);
}
