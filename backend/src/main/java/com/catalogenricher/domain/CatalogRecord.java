package com.catalogenricher.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One row of the working table. Mutated only by the thread that owns the row during a pipeline step;
 * whole-table snapshots go through {@link #copy()}.
 */
public class CatalogRecord {

    public static final String SOURCE_CACHE = "cache";
    public static final String SOURCE_API = "api";

    private final int rowId;
    private final String barcode;
    private final Map<String, String> values;
    private final SortedSet<String> sourceTags = new TreeSet<>();
    private String normalizedIdentifier;
    private RecordStatus status = RecordStatus.PENDING;
    private String failureReason;

    public CatalogRecord(int rowId, String barcode, Map<String, String> values) {
        this.rowId = rowId;
        this.barcode = barcode == null ? "" : barcode;
        this.values = new LinkedHashMap<>(values);
    }

    /**
     * Rebuilds a record from persisted state, bypassing the transition checks.
     */
    public static CatalogRecord restore(int rowId, String barcode, Map<String, String> values,
                                        String normalizedIdentifier, RecordStatus status,
                                        Collection<String> sourceTags, String failureReason) {
        CatalogRecord record = new CatalogRecord(rowId, barcode, values);
        record.normalizedIdentifier = blankToNull(normalizedIdentifier);
        record.status = status == null ? RecordStatus.PENDING : status;
        if (sourceTags != null) {
            sourceTags.stream().filter(t -> t != null && !t.isBlank()).map(String::strip).forEach(record.sourceTags::add);
        }
        record.failureReason = failureReason;
        return record;
    }

    public int getRowId() {
        return rowId;
    }

    public String getBarcode() {
        return barcode;
    }

    public boolean hasBarcode() {
        return !barcode.isEmpty();
    }

    /**
     * Cell value, or "" when the column is absent.
     */
    public String getValue(String column) {
        String v = values.get(column);
        return v == null ? "" : v;
    }

    public void setValue(String column, String value) {
        values.put(column, value == null ? "" : value);
    }

    public Map<String, String> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public String getNormalizedIdentifier() {
        return normalizedIdentifier;
    }

    public boolean hasNormalizedIdentifier() {
        return normalizedIdentifier != null;
    }

    /**
     * Sets the normalized identifier once. Later calls are ignored and return false.
     */
    public boolean assignNormalizedIdentifier(String identifier) {
        if (normalizedIdentifier != null || identifier == null || identifier.isBlank()) {
            return false;
        }
        normalizedIdentifier = identifier;
        return true;
    }

    public RecordStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves the status forward. Returns false, leaving the row untouched, when the transition is not allowed.
     */
    public boolean advanceTo(RecordStatus target) {
        if (!status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        return true;
    }

    /**
     * The only way back to PENDING. Clears the failure reason; data and tags stay.
     */
    public void reset() {
        status = RecordStatus.PENDING;
        failureReason = null;
    }

    public Set<String> getSourceTags() {
        return Collections.unmodifiableSortedSet(sourceTags);
    }

    public void addSourceTag(String tag) {
        if (tag != null && !tag.isBlank()) {
            sourceTags.add(tag.strip());
        }
    }

    public String getSourceTagsCell() {
        return String.join(",", sourceTags);
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public CatalogRecord copy() {
        return restore(rowId, barcode, values, normalizedIdentifier, status, sourceTags, failureReason);
    }

    /**
     * Barcode cleanup for spreadsheet-sourced keys: trims, drops a float ".0" suffix, and treats
     * nan/none/null literals as empty.
     */
    public static String normalizeBarcode(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.strip();
        String lower = s.toLowerCase();
        if (lower.equals("nan") || lower.equals("none") || lower.equals("null")) {
            return "";
        }
        if (s.endsWith(".0") && s.length() > 2 && s.substring(0, s.length() - 2).chars().allMatch(Character::isDigit)) {
            s = s.substring(0, s.length() - 2);
        }
        return s;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
