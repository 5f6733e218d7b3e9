package com.catalogenricher.enrichment.cache;

import com.catalogenricher.domain.CatalogRecord;
import com.catalogenricher.enrichment.config.TableColumnProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Translates between logical metadata fields (cache and payload keys) and working table columns.
 */
@Component
@RequiredArgsConstructor
public class CacheFieldMapper {

    private final TableColumnProperties columnProperties;

    /**
     * Column → value for every mapped, non-blank logical field. Unmapped fields are dropped.
     */
    public Map<String, String> toColumns(Map<String, String> logicalFields) {
        Map<String, String> out = new LinkedHashMap<>();
        mapping().forEach((field, column) -> {
            String value = logicalFields.get(field);
            if (column != null && !column.isBlank() && value != null && !value.isBlank()) {
                out.put(column, value.strip());
            }
        });
        return out;
    }

    /**
     * Logical field → value for every mapped column of the row that is non-blank.
     */
    public Map<String, String> toCacheFields(CatalogRecord record) {
        Map<String, String> out = new LinkedHashMap<>();
        mapping().forEach((field, column) -> {
            if (column == null || column.isBlank()) {
                return;
            }
            String value = record.getValue(column);
            if (!value.isBlank()) {
                out.put(field, value.strip());
            }
        });
        return out;
    }

    public Set<String> mappedColumns() {
        Set<String> columns = new LinkedHashSet<>();
        mapping().values().stream().filter(c -> c != null && !c.isBlank()).forEach(columns::add);
        return columns;
    }

    private Map<String, String> mapping() {
        Map<String, String> m = columnProperties.getFieldsMapping();
        return m == null ? Map.of() : m;
    }
}
