package com.fieldvault.document;

/**
 * A stored body that is not a JSON object.
 */
public class CorruptDocumentException extends RuntimeException {

    public CorruptDocumentException(DocumentKey key, Throwable cause) {
        super("Stored document " + key.collection() + "/" + key.id() + " is not valid JSON", cause);
    }
}
