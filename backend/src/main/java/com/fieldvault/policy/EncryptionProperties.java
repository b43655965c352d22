package com.fieldvault.policy;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Encryption policy table and key-wait tuning.
 *
 * <pre>
 * fieldvault.encryption:
 *   enabled: true
 *   scheme-version: "1"
 *   ready-timeout: 6s
 *   poll-interval: 100ms
 *   unencrypted-fields: [id, userId, createdAt, ...]
 *   collections:
 *     expenses:
 *       sensitive-fields: [amount, description]
 *       exempt-fields: []
 * </pre>
 */
@ConfigurationProperties(prefix = "fieldvault.encryption")
public record EncryptionProperties(

    /** Master switch. When false, writes are stored as-is. */
    @DefaultValue("true") boolean enabled,

    @DefaultValue("1") String schemeVersion,

    /** Hard ceiling on how long a codec call waits for the key. */
    @DefaultValue("6s") Duration readyTimeout,

    @DefaultValue("100ms") Duration pollInterval,

    /** Fields left in plaintext in every collection (query and filter keys). */
    Set<String> unencryptedFields,

    Map<String, CollectionRules> collections

) {

    public EncryptionProperties {
        unencryptedFields = unencryptedFields == null ? Set.of() : Set.copyOf(unencryptedFields);
        collections = collections == null ? Map.of() : Map.copyOf(collections);
    }

    public record CollectionRules(Set<String> sensitiveFields, Set<String> exemptFields, String schemeVersion) {

        public CollectionRules {
            sensitiveFields = sensitiveFields == null ? Set.of() : Set.copyOf(sensitiveFields);
            exemptFields = exemptFields == null ? Set.of() : Set.copyOf(exemptFields);
        }
    }
}
