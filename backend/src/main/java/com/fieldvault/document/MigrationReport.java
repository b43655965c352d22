package com.fieldvault.document;

/**
 * Totals from one legacy-encryption run over a collection.
 *
 * skipped: records with no field the policy would encrypt
 */
public record MigrationReport(int total, int encrypted, int alreadyEncrypted, int skipped, int failed) {}
