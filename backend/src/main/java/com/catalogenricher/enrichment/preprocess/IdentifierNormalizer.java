package com.catalogenricher.enrichment.preprocess;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ISBN-style identifier cleanup and validation.
 * <p>
 * Spreadsheet exports turn identifiers into numbers ({@code 9787121123456.0}, {@code 9.787121123456E12}); those
 * are converted back to plain digits before separators (spaces, hyphens, dots, prefixes) are stripped.
 * Valid results are 13 digits, or 9 digits followed by a digit or X.
 */
public final class IdentifierNormalizer {

    private static final Pattern NUMERIC_ARTIFACT = Pattern.compile("^\\d+(\\.\\d+)?([eE][+-]?\\d+)?$");
    private static final Pattern NON_IDENTIFIER_CHARS = Pattern.compile("[^0-9X]");
    private static final Pattern VALID = Pattern.compile("^(\\d{13}|\\d{9}[\\dX])$");

    private IdentifierNormalizer() {
    }

    /**
     * Cleaned form of the raw value; "" when the raw value is blank or a missing-value literal.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        if (isBlank(raw)) {
            return "";
        }
        String s = raw.strip();
        if (NUMERIC_ARTIFACT.matcher(s).matches() && (s.indexOf('.') >= 0 || s.indexOf('e') >= 0 || s.indexOf('E') >= 0)) {
            s = fromNumber(s);
        }
        return NON_IDENTIFIER_CHARS.matcher(s.toUpperCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Normalized identifier when the cleaned value is valid.
     */
    public static Optional<String> normalize(String raw) {
        String cleaned = clean(raw);
        return isValid(cleaned) ? Optional.of(cleaned) : Optional.empty();
    }

    public static boolean isValid(String cleaned) {
        return cleaned != null && VALID.matcher(cleaned).matches();
    }

    /**
     * True for null, blank and missing-value literals (nan, none, null).
     */
    public static boolean isBlank(String raw) {
        if (raw == null) {
            return true;
        }
        String lower = raw.strip().toLowerCase(Locale.ROOT);
        return lower.isEmpty() || lower.equals("nan") || lower.equals("none") || lower.equals("null");
    }

    private static String fromNumber(String s) {
        try {
            BigDecimal value = new BigDecimal(s);
            if (value.signum() < 0) {
                return s;
            }
            return value.stripTrailingZeros().scale() <= 0
                    ? value.toBigIntegerExact().toString()
                    : s;
        } catch (NumberFormatException | ArithmeticException e) {
            return s;
        }
    }
}
