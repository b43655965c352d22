package com.fieldvault.session;

/**
 * Sent by the identity provider integration once authentication has completed.
 */
public record SignInRequest(String accountId) {}
