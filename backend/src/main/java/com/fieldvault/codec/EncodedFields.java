package com.fieldvault.codec;

/**
 * Marker field names written into an encoded record. The store persists them verbatim.
 */
public final class EncodedFields {

    /** Map of field name to CipherText. */
    public static final String CONTAINER = "encryptedFields";

    public static final String SCHEME_VERSION = "schemeVersion";

    private EncodedFields() {
    }

    public static boolean isMarker(String field) {
        return CONTAINER.equals(field) || SCHEME_VERSION.equals(field);
    }
}
