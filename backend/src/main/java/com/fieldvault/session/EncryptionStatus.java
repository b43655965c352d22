package com.fieldvault.session;

/**
 * Snapshot for operators. The two counters show how often the degraded paths were taken.
 */
public record EncryptionStatus(
        boolean enabled,
        KeyState state,
        boolean ready,
        String schemeVersion,
        long unencryptedWrites,
        long degradedReads
) {}
