package com.fieldvault.document;

public record SaveResponse(String collection, String id) {}
