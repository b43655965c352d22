package com.fieldvault.document;

import java.util.Map;
import java.util.Set;

import com.fieldvault.codec.DecodeResult;

/**
 * Document as returned to the client.
 *
 * status: DECODED, PARTIALLY_DECODED or FAILED
 * missingFields: encrypted fields that could not be recovered and were left out
 * failedFields: fields whose decryption failed (tampered, or written under another key)
 */
public record DocumentResponse(
        String id,
        DecodeResult.Status status,
        Map<String, Object> fields,
        Set<String> missingFields,
        Set<String> failedFields
) {

    public static DocumentResponse from(StoredDocument document) {
        DecodeResult result = document.result();
        return new DocumentResponse(document.id(), result.status(), result.record(),
                result.missingFields(), result.failedFields());
    }
}
