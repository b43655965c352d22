package com.fieldvault.session;

/**
 * An operation that cannot fall back to plaintext was called without a ready key.
 */
public class KeyNotReadyException extends RuntimeException {

    public KeyNotReadyException(String message) {
        super(message);
    }
}
