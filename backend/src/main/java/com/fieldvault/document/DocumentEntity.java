package com.fieldvault.document;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * One stored record. The body is the JSON produced by the codec, including any
 * {@code encryptedFields} / {@code schemeVersion} markers; the store never looks inside it.
 */
@Table("documents")
public class DocumentEntity {

    @PrimaryKey
    private DocumentKey key;

    @Column("body")
    private String body;

    @Column("updated_at")
    private long updatedAt;

    public DocumentEntity() {}

    public DocumentEntity(DocumentKey key, String body, long updatedAt) {
        this.key = key;
        this.body = body;
        this.updatedAt = updatedAt;
    }

    // Getters & Setters
    public DocumentKey getKey() { return key; }
    public void setKey(DocumentKey key) { this.key = key; }
    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }
    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
}
