package com.fieldvault.crypto;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * AES-256-GCM encryption of a single field value.
 *
 * <p>Wire format: Base64(nonce[12] || ciphertext || tag[16]). Every call to
 * {@link #encrypt(DataKey, Object)} draws a fresh random nonce.
 *
 * <p>Strings are encrypted as their UTF-8 text; any other value is written as JSON first.
 * On decryption the plaintext is read back as strict JSON when it parses, so numbers, booleans,
 * objects and arrays come back with the shape they were encrypted with. Text that is not JSON is
 * returned as a string.
 */
@Component
public class FieldCipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    static final int IV_SIZE = 12;     // 96-bit nonce
    static final int TAG_SIZE = 128;   // 128-bit authentication tag
    static final int MIN_PAYLOAD_BYTES = IV_SIZE + TAG_SIZE / 8;

    private final ObjectMapper objectMapper;
    private final ObjectReader jsonReader;
    private final SecureRandom random = new SecureRandom();

    public FieldCipher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.jsonReader = objectMapper.readerFor(Object.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Encrypts one value. {@code null} and the empty string are returned unchanged.
     */
    public String encrypt(DataKey key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text && text.isEmpty()) {
            return text;
        }
        String plaintext = value instanceof String text ? text : toJson(value);

        byte[] iv = new byte[IV_SIZE];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, key.toSecretKey(), new GCMParameterSpec(TAG_SIZE, iv));

            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] result = new byte[IV_SIZE + ciphertext.length];
            System.arraycopy(iv, 0, result, 0, IV_SIZE);
            System.arraycopy(ciphertext, 0, result, IV_SIZE, ciphertext.length);

            return Base64.getEncoder().encodeToString(result);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Decrypts one value.
     *
     * <p>Input that is not Base64, or too short to hold a nonce and a tag, is treated as a legacy
     * plaintext value and returned as-is.
     *
     * @throws FieldDecryptException if authentication fails (tampered data or a different key)
     */
    public Object decrypt(DataKey key, String cipherText) throws FieldDecryptException {
        if (cipherText == null || cipherText.isEmpty()) {
            return cipherText;
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(cipherText);
        } catch (IllegalArgumentException notBase64) {
            return cipherText;
        }
        if (decoded.length < MIN_PAYLOAD_BYTES) {
            return cipherText;
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, key.toSecretKey(), new GCMParameterSpec(TAG_SIZE, decoded, 0, IV_SIZE));
            plaintext = cipher.doFinal(decoded, IV_SIZE, decoded.length - IV_SIZE);
        } catch (GeneralSecurityException e) {
            throw new FieldDecryptException("AES-GCM authentication failed", e);
        }
        return fromJson(new String(plaintext, StandardCharsets.UTF_8));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName() + " is not JSON-serializable", e);
        }
    }

    private Object fromJson(String text) {
        try {
            return jsonReader.readValue(text);
        } catch (IOException notJson) {
            return text;
        }
    }
}
