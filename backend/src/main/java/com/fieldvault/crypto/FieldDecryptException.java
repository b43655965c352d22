package com.fieldvault.crypto;

/**
 * A single field could not be decrypted: authentication tag mismatch (tampering or wrong key)
 * or an undecodable plaintext. Recoverable per field.
 */
public class FieldDecryptException extends Exception {

    public FieldDecryptException(String message, Throwable cause) {
        super(message, cause);
    }
}
