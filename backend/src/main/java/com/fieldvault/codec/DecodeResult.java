package com.fieldvault.codec;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of decoding one record.
 *
 * <ul>
 *   <li>{@code DECODED}: every encrypted field was recovered, or the record was never encrypted.</li>
 *   <li>{@code PARTIALLY_DECODED}: {@code record} holds what could be recovered.
 *       {@code missingFields} were dropped; {@code failedFields} failed authentication (a failed
 *       field that still had a plaintext copy is in {@code failedFields} only).</li>
 *   <li>{@code FAILED}: the record could not be decoded at all and is returned unchanged.</li>
 * </ul>
 */
public record DecodeResult(
        Status status,
        Map<String, Object> record,
        Set<String> missingFields,
        Set<String> failedFields,
        Throwable cause) {

    public enum Status {
        DECODED,
        PARTIALLY_DECODED,
        FAILED
    }

    public DecodeResult {
        missingFields = Set.copyOf(missingFields);
        failedFields = Set.copyOf(failedFields);
    }

    public static DecodeResult decoded(Map<String, Object> record) {
        return new DecodeResult(Status.DECODED, record, Set.of(), Set.of(), null);
    }

    public static DecodeResult partial(Map<String, Object> record, Set<String> missingFields, Set<String> failedFields) {
        return new DecodeResult(Status.PARTIALLY_DECODED, record, missingFields, failedFields, null);
    }

    public static DecodeResult failed(Map<String, Object> record, Throwable cause) {
        return new DecodeResult(Status.FAILED, record, Set.of(), Set.of(), cause);
    }

    public boolean hasErrors() {
        return status != Status.DECODED;
    }
}
