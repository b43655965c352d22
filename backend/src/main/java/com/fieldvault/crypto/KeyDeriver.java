package com.fieldvault.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.springframework.stereotype.Component;

/**
 * Derives the per-account AES-256 data key.
 *
 * <p>Derivation is deterministic: the same account id yields the same key on every device and in
 * every process, so nothing has to be stored or transmitted. The inputs are:
 * <ul>
 *   <li>salt: first 16 bytes of SHA-256({@value #SALT_LABEL} + accountId)</li>
 *   <li>key material: UTF-8 of {@value #KEY_LABEL} + accountId</li>
 *   <li>PBKDF2-HMAC-SHA256, {@value #ITERATIONS} iterations, 256-bit output</li>
 * </ul>
 * The account id is not a secret. Anyone holding it can rebuild the key.
 */
@Component
public class KeyDeriver {

    static final String SALT_LABEL = "fieldvault-salt-v1:";
    static final String KEY_LABEL = "fieldvault-key-v1:";
    static final int ITERATIONS = 100_000;
    static final int SALT_BYTES = 16;

    public DataKey deriveKey(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new KeyDerivationException("Cannot derive a key without an authenticated account");
        }

        byte[] material = (KEY_LABEL + accountId).getBytes(StandardCharsets.UTF_8);
        byte[] raw = null;
        try {
            byte[] salt = Arrays.copyOf(sha256((SALT_LABEL + accountId).getBytes(StandardCharsets.UTF_8)), SALT_BYTES);

            PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(material, salt, ITERATIONS);
            KeyParameter params = (KeyParameter) generator.generateDerivedParameters(DataKey.LENGTH_BYTES * 8);
            raw = params.getKey();
            return new DataKey(raw);
        } catch (RuntimeException e) {
            throw new KeyDerivationException("PBKDF2 key derivation failed", e);
        } finally {
            Arrays.fill(material, (byte) 0);
            if (raw != null) {
                Arrays.fill(raw, (byte) 0);
            }
        }
    }

    private static byte[] sha256(byte[] input) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
