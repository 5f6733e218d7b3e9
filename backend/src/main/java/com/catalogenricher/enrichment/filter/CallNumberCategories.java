package com.catalogenricher.enrichment.filter;

import java.util.Comparator;
import java.util.Locale;

/**
 * Category key of a row: first Latin letter of its call number, upper-cased, or "unknown".
 */
public final class CallNumberCategories {

    public static final String UNKNOWN = "unknown";

    /** Letters alphabetically, "unknown" last. */
    public static final Comparator<String> ORDER = Comparator
            .comparing((String c) -> UNKNOWN.equals(c))
            .thenComparing(Comparator.naturalOrder());

    private CallNumberCategories() {
    }

    public static String categoryOf(String callNumber) {
        if (callNumber == null) {
            return UNKNOWN;
        }
        String upper = callNumber.strip().toUpperCase(Locale.ROOT);
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                return String.valueOf(c);
            }
        }
        return UNKNOWN;
    }
}
