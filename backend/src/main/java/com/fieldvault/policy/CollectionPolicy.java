package com.fieldvault.policy;

import java.util.Set;

/**
 * Which fields of one collection are encrypted.
 *
 * Fields in neither set are still encrypted when they hold a scalar value; only exempt fields
 * and nested values stay in plaintext.
 */
public record CollectionPolicy(Set<String> sensitiveFields, Set<String> exemptFields, String schemeVersion) {

    public CollectionPolicy {
        sensitiveFields = Set.copyOf(sensitiveFields);
        exemptFields = Set.copyOf(exemptFields);
    }

    public boolean isSensitive(String field) {
        return sensitiveFields.contains(field);
    }

    public boolean isExempt(String field) {
        return exemptFields.contains(field);
    }
}
