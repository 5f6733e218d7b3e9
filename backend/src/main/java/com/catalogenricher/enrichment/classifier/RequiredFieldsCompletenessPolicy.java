package com.catalogenricher.enrichment.classifier;

import com.catalogenricher.enrichment.cache.CacheEntry;

import java.util.Collection;
import java.util.List;

/**
 * Complete when every configured logical field is present and non-blank.
 */
public class RequiredFieldsCompletenessPolicy implements CompletenessPolicy {

    private final List<String> requiredFields;

    public RequiredFieldsCompletenessPolicy(Collection<String> requiredFields) {
        this.requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    @Override
    public boolean isComplete(CacheEntry entry) {
        for (String field : requiredFields) {
            if (!entry.hasField(field)) {
                return false;
            }
        }
        return true;
    }

    public List<String> getRequiredFields() {
        return requiredFields;
    }
}
