package com.fieldvault.codec;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fieldvault.crypto.DataKey;
import com.fieldvault.crypto.FieldCipher;
import com.fieldvault.crypto.FieldDecryptException;
import com.fieldvault.crypto.Sanitizer;
import com.fieldvault.policy.CollectionPolicy;
import com.fieldvault.policy.EncryptionProperties;
import com.fieldvault.policy.PolicyRegistry;
import com.fieldvault.session.EncryptionSession;

/**
 * Encrypts and decrypts the fields of one record according to its collection policy.
 *
 * <p><strong>Encode:</strong> sensitive fields with a value, and every other non-exempt scalar
 * field, are encrypted and moved into the {@value EncodedFields#CONTAINER} map; the plaintext
 * copy is removed. Nested maps and lists that are not listed as sensitive stay in plaintext.
 * When the key is not ready, the collection has no policy, or encryption is switched off, the
 * record is returned unmodified so the write can still proceed.
 *
 * <p><strong>Decode:</strong> each field is decrypted on its own. A field that fails keeps its
 * plaintext copy if the record still has one and is dropped otherwise; the rest of the record is
 * returned either way. Neither direction throws.
 */
@Component
public class DocumentCodec {

    private static final Logger log = LoggerFactory.getLogger(DocumentCodec.class);

    private final EncryptionSession session;
    private final FieldCipher cipher;
    private final PolicyRegistry policies;
    private final Duration readyTimeout;

    private final AtomicLong unencryptedWrites = new AtomicLong();
    private final AtomicLong degradedReads = new AtomicLong();

    @Autowired
    public DocumentCodec(EncryptionSession session, FieldCipher cipher, PolicyRegistry policies,
            EncryptionProperties properties) {
        this(session, cipher, policies, properties.readyTimeout());
    }

    public DocumentCodec(EncryptionSession session, FieldCipher cipher, PolicyRegistry policies,
            Duration readyTimeout) {
        this.session = session;
        this.cipher = cipher;
        this.policies = policies;
        this.readyTimeout = readyTimeout;
    }

    public Map<String, Object> encode(Map<String, Object> record, String collection) {
        return encode(record, collection, readyTimeout);
    }

    Map<String, Object> encode(Map<String, Object> record, String collection, Duration keyWait) {
        if (record == null) {
            return null;
        }
        if (!policies.isEncryptionEnabled()) {
            log.debug("Encryption disabled, storing {} record as-is", collection);
            return record;
        }
        Optional<CollectionPolicy> policy = policies.policyFor(collection);
        if (policy.isEmpty()) {
            log.debug("No encryption policy for collection {}, storing as-is", collection);
            return record;
        }

        Optional<DataKey> key = session.waitForReady(keyWait) ? session.currentKey() : Optional.empty();
        if (key.isEmpty()) {
            unencryptedWrites.incrementAndGet();
            log.warn("Encryption key not ready, storing {} record unencrypted", collection);
            return record;
        }

        try {
            return encrypt(record, policy.get(), key.get());
        } catch (RuntimeException e) {
            unencryptedWrites.incrementAndGet();
            log.error("Field encryption failed for collection {}, storing unencrypted", collection, e);
            return record;
        }
    }

    public DecodeResult decode(Map<String, Object> record, String collection) {
        return decode(record, collection, readyTimeout);
    }

    DecodeResult decode(Map<String, Object> record, String collection, Duration keyWait) {
        if (!isEncrypted(record)) {
            return DecodeResult.decoded(record);
        }
        if (!(record.get(EncodedFields.CONTAINER) instanceof Map<?, ?> container)) {
            log.warn("Malformed {} container in {} record", EncodedFields.CONTAINER, collection);
            return DecodeResult.failed(record,
                    new IllegalArgumentException(EncodedFields.CONTAINER + " is not a map"));
        }

        Map<String, Object> decoded = new LinkedHashMap<>(record);
        decoded.remove(EncodedFields.CONTAINER);
        decoded.remove(EncodedFields.SCHEME_VERSION);

        Optional<DataKey> key = session.waitForReady(keyWait) ? session.currentKey() : Optional.empty();
        if (key.isEmpty()) {
            degradedReads.incrementAndGet();
            log.warn("Encryption key not ready, returning {} record without its {} encrypted fields",
                    collection, container.size());
            Set<String> missing = new LinkedHashSet<>();
            container.keySet().forEach(field -> missing.add(String.valueOf(field)));
            return DecodeResult.partial(decoded, missing, Set.of());
        }

        Set<String> missing = new LinkedHashSet<>();
        Set<String> failed = new LinkedHashSet<>();
        for (Map.Entry<?, ?> entry : container.entrySet()) {
            String field = String.valueOf(entry.getKey());
            try {
                Object value = entry.getValue();
                Object plain = value instanceof String text ? cipher.decrypt(key.get(), text) : value;
                decoded.put(field, Sanitizer.unescape(plain));
            } catch (FieldDecryptException | RuntimeException e) {
                failed.add(field);
                if (!decoded.containsKey(field)) {
                    missing.add(field);
                }
                log.warn("Could not decrypt field {} of {} record: {}", field, collection, e.getMessage());
            }
        }

        if (failed.isEmpty()) {
            return DecodeResult.decoded(decoded);
        }
        degradedReads.incrementAndGet();
        return DecodeResult.partial(decoded, missing, failed);
    }

    public boolean isEncrypted(Map<String, Object> record) {
        return record != null && record.get(EncodedFields.CONTAINER) != null;
    }

    /** True when writes to {@code collection} would be encrypted once the key is ready. */
    public boolean appliesTo(String collection) {
        return policies.isEncryptionEnabled() && policies.policyFor(collection).isPresent();
    }

    /** Writes stored in plaintext because the key was unavailable or encryption failed. */
    public long unencryptedWrites() {
        return unencryptedWrites.get();
    }

    /** Reads that returned a partial record. */
    public long degradedReads() {
        return degradedReads.get();
    }

    private Map<String, Object> encrypt(Map<String, Object> record, CollectionPolicy policy, DataKey key) {
        Map<String, Object> encoded = new LinkedHashMap<>(record);
        Map<String, Object> container = new LinkedHashMap<>();
        if (record.get(EncodedFields.CONTAINER) instanceof Map<?, ?> existing) {
            // A field present in the record replaces its old cipher text, whether or not it is re-encrypted.
            existing.forEach((field, value) -> {
                String name = String.valueOf(field);
                if (!record.containsKey(name)) {
                    container.put(name, value);
                }
            });
        }

        for (Map.Entry<String, Object> entry : record.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            if (!shouldEncrypt(field, value, policy)) {
                continue;
            }
            container.put(field, cipher.encrypt(key, Sanitizer.escape(value)));
            encoded.remove(field);
        }

        if (!container.isEmpty()) {
            encoded.put(EncodedFields.CONTAINER, container);
            encoded.put(EncodedFields.SCHEME_VERSION, policy.schemeVersion());
        } else {
            encoded.remove(EncodedFields.CONTAINER);
            encoded.remove(EncodedFields.SCHEME_VERSION);
        }
        return encoded;
    }

    private static boolean shouldEncrypt(String field, Object value, CollectionPolicy policy) {
        if (value == null || (value instanceof String text && text.isEmpty())) {
            return false;
        }
        if (EncodedFields.isMarker(field)) {
            return false;
        }
        if (policy.isSensitive(field)) {
            return true;
        }
        return !policy.isExempt(field) && isScalar(value);
    }

    private static boolean isScalar(Object value) {
        return !(value instanceof Map) && !(value instanceof Collection) && !value.getClass().isArray();
    }
}
