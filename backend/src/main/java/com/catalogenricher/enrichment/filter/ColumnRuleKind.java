package com.catalogenricher.enrichment.filter;

import com.catalogenricher.enrichment.config.EnrichmentConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Fixed set of auxiliary column rule kinds and their configuration keys.
 */
public enum ColumnRuleKind {

    NOT_EMPTY("not_empty") {
        @Override
        public ColumnRule create(String column, String pattern) {
            return new NotEmptyRule(column);
        }
    },
    REGEX("regex") {
        @Override
        public ColumnRule create(String column, String pattern) {
            if (pattern == null || pattern.isEmpty()) {
                throw new EnrichmentConfigurationException("Regex rule on column '" + column + "' has no pattern");
            }
            try {
                return new RegexRule(column, Pattern.compile(pattern));
            } catch (PatternSyntaxException e) {
                throw new EnrichmentConfigurationException(
                        "Regex rule on column '" + column + "' has an invalid pattern: " + e.getDescription());
            }
        }
    };

    private final String key;

    ColumnRuleKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public abstract ColumnRule create(String column, String pattern);

    public static ColumnRuleKind fromKey(String key) {
        String normalized = key == null ? "" : key.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new EnrichmentConfigurationException("Unknown column filter type '" + key + "'"));
    }
}
