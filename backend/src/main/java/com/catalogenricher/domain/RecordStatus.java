package com.catalogenricher.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-row processing status. Every state except PENDING is terminal; the only way back to PENDING is an
 * explicit {@link CatalogRecord#reset()}.
 */
public enum RecordStatus {

    PENDING,
    /** Served from cache with complete, fresh data. */
    FROM_DB,
    NOT_FOUND,
    INVALID_ID,
    NO_ID,
    DONE;

    private static final Map<RecordStatus, Set<RecordStatus>> TRANSITIONS = new EnumMap<>(RecordStatus.class);

    static {
        TRANSITIONS.put(PENDING, Collections.unmodifiableSet(EnumSet.of(FROM_DB, NOT_FOUND, INVALID_ID, NO_ID, DONE)));
        TRANSITIONS.put(FROM_DB, Collections.unmodifiableSet(EnumSet.noneOf(RecordStatus.class)));
        TRANSITIONS.put(NOT_FOUND, Collections.unmodifiableSet(EnumSet.noneOf(RecordStatus.class)));
        TRANSITIONS.put(INVALID_ID, Collections.unmodifiableSet(EnumSet.noneOf(RecordStatus.class)));
        TRANSITIONS.put(NO_ID, Collections.unmodifiableSet(EnumSet.noneOf(RecordStatus.class)));
        TRANSITIONS.put(DONE, Collections.unmodifiableSet(EnumSet.noneOf(RecordStatus.class)));
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(RecordStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<RecordStatus> allowedTargets() {
        return TRANSITIONS.get(this);
    }

    /**
     * Lenient parse for status cells; blank or unknown values map to PENDING.
     */
    public static RecordStatus fromCell(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return RecordStatus.valueOf(value.strip().toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
