package com.fieldvault.policy;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fieldvault.codec.EncodedFields;

/**
 * Read-only table of collection name to {@link CollectionPolicy}, built once from configuration.
 * A collection with no entry is not encrypted.
 */
@Component
public class PolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    private final boolean enabled;
    private final String schemeVersion;
    private final Map<String, CollectionPolicy> policies;

    public PolicyRegistry(EncryptionProperties properties) {
        this.enabled = properties.enabled();
        this.schemeVersion = properties.schemeVersion();

        Map<String, CollectionPolicy> table = new HashMap<>();
        properties.collections().forEach((collection, rules) -> {
            Set<String> exempt = new HashSet<>(properties.unencryptedFields());
            exempt.addAll(rules.exemptFields());
            exempt.add(EncodedFields.CONTAINER);
            exempt.add(EncodedFields.SCHEME_VERSION);
            exempt.removeAll(rules.sensitiveFields());

            String version = rules.schemeVersion() != null ? rules.schemeVersion() : schemeVersion;
            table.put(collection, new CollectionPolicy(rules.sensitiveFields(), exempt, version));
        });
        this.policies = Map.copyOf(table);

        log.info("Encryption policy loaded: enabled={}, schemeVersion={}, collections={}",
                enabled, schemeVersion, policies.size());
    }

    public Optional<CollectionPolicy> policyFor(String collection) {
        return Optional.ofNullable(collection).map(policies::get);
    }

    public boolean isEncryptionEnabled() {
        return enabled;
    }

    public String schemeVersion() {
        return schemeVersion;
    }

    public Set<String> collections() {
        return policies.keySet();
    }
}
