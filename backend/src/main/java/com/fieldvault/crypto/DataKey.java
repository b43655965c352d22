package com.fieldvault.crypto;

import java.util.Arrays;

import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256 key material for one signed-in account.
 *
 * Lives only in process memory. {@link #destroy()} zeroes the bytes; a destroyed key refuses
 * to produce a {@link SecretKeySpec}.
 */
public final class DataKey {

    public static final int LENGTH_BYTES = 32;

    private final byte[] material;
    private volatile boolean destroyed;

    public DataKey(byte[] material) {
        if (material == null || material.length != LENGTH_BYTES) {
            throw new IllegalArgumentException("AES-256 key must be " + LENGTH_BYTES + " bytes");
        }
        this.material = material.clone();
    }

    SecretKeySpec toSecretKey() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return new SecretKeySpec(material, "AES");
    }

    /** Copy of the raw bytes, for equality checks in callers that compare derivations. */
    public byte[] getEncoded() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return material.clone();
    }

    public void destroy() {
        destroyed = true;
        Arrays.fill(material, (byte) 0);
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return destroyed ? "DataKey[destroyed]" : "DataKey[AES-256]";
    }
}
