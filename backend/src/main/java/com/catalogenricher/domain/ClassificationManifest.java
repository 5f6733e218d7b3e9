package com.catalogenricher.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Partition of row ids into cache categories. A row belongs to at most one category; reassigning moves it.
 * Persisted with the checkpoint so a resumed run knows which finished rows came from a fetch.
 */
public class ClassificationManifest {

    private final Map<CacheCategory, SortedSet<Integer>> rowsByCategory = new EnumMap<>(CacheCategory.class);
    private final Map<Integer, CacheCategory> categoryByRow = new HashMap<>();

    public ClassificationManifest() {
        for (CacheCategory c : CacheCategory.values()) {
            rowsByCategory.put(c, new TreeSet<>());
        }
    }

    public void assign(int rowId, CacheCategory category) {
        CacheCategory previous = categoryByRow.put(rowId, category);
        if (previous != null) {
            rowsByCategory.get(previous).remove(rowId);
        }
        rowsByCategory.get(category).add(rowId);
    }

    public Optional<CacheCategory> categoryOf(int rowId) {
        return Optional.ofNullable(categoryByRow.get(rowId));
    }

    public boolean isFetchEligible(int rowId) {
        CacheCategory c = categoryByRow.get(rowId);
        return c != null && c.isFetchEligible();
    }

    public SortedSet<Integer> rowsIn(CacheCategory category) {
        return Collections.unmodifiableSortedSet(rowsByCategory.get(category));
    }

    public int size() {
        return categoryByRow.size();
    }

    public Map<CacheCategory, Integer> counts() {
        Map<CacheCategory, Integer> counts = new EnumMap<>(CacheCategory.class);
        rowsByCategory.forEach((c, rows) -> counts.put(c, rows.size()));
        return counts;
    }

    public ClassificationManifest copy() {
        ClassificationManifest copy = new ClassificationManifest();
        categoryByRow.forEach(copy::assign);
        return copy;
    }

    /**
     * Category key → sorted row ids, for persistence.
     */
    public Map<String, List<Integer>> toKeyedMap() {
        Map<String, List<Integer>> out = new LinkedHashMap<>();
        rowsByCategory.forEach((c, rows) -> out.put(c.getKey(), List.copyOf(rows)));
        return out;
    }

    public static ClassificationManifest fromKeyedMap(Map<String, List<Integer>> keyed) {
        ClassificationManifest manifest = new ClassificationManifest();
        if (keyed == null) {
            return manifest;
        }
        keyed.forEach((key, rows) -> CacheCategory.fromKey(key).ifPresent(category -> {
            if (rows != null) {
                rows.forEach(row -> manifest.assign(row, category));
            }
        }));
        return manifest;
    }
}
