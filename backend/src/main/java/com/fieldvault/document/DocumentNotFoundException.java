package com.fieldvault.document;

public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(String collection, String id) {
        super("Document not found: " + collection + "/" + id);
    }
}
