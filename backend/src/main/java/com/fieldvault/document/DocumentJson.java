package com.fieldvault.document;

import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts between records and the JSON text held in {@link DocumentEntity#getBody()}.
 */
@Component
class DocumentJson {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    DocumentJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    DocumentEntity toEntity(String collection, String id, Map<String, Object> record) {
        try {
            return new DocumentEntity(new DocumentKey(collection, id),
                    objectMapper.writeValueAsString(record), System.currentTimeMillis());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not JSON-serializable", e);
        }
    }

    Map<String, Object> readBody(DocumentEntity entity) {
        try {
            return objectMapper.readValue(entity.getBody(), RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new CorruptDocumentException(entity.getKey(), e);
        }
    }
}
