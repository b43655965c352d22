package com.fieldvault.session;

/**
 * Outcome of one {@link EncryptionSession#initialize(String)} call. Failures are reported as a
 * value; {@code cause} is null when the key is ready.
 */
public record InitializationResult(KeyState state, Throwable cause) {

    public static InitializationResult ready() {
        return new InitializationResult(KeyState.READY, null);
    }

    public static InitializationResult failed(Throwable cause) {
        return new InitializationResult(KeyState.FAILED, cause);
    }

    public boolean isReady() {
        return state == KeyState.READY;
    }
}
