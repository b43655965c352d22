package com.fieldvault.crypto;

/**
 * Key setup could not produce a usable key. Fatal to initialization, never retried automatically.
 */
public class KeyDerivationException extends RuntimeException {

    public KeyDerivationException(String message) {
        super(message);
    }

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
