package com.fieldvault.document;

import com.fieldvault.codec.DecodeResult;

/**
 * A decoded read: the document id plus what the codec recovered.
 */
public record StoredDocument(String id, DecodeResult result) {}
