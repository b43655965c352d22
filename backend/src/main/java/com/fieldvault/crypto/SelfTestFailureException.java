package com.fieldvault.crypto;

/**
 * A freshly derived key failed its encrypt/decrypt round trip.
 */
public class SelfTestFailureException extends KeyDerivationException {

    public SelfTestFailureException(String message) {
        super(message);
    }

    public SelfTestFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
