package com.fieldvault.common;

import java.time.Instant;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.fieldvault.document.CorruptDocumentException;
import com.fieldvault.document.DocumentNotFoundException;
import com.fieldvault.session.KeyNotReadyException;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(KeyNotReadyException.class)
    public ResponseEntity<Map<String, Object>> keyNotReady(KeyNotReadyException ex) {
        return error(HttpStatus.CONFLICT, "key_not_ready", ex.getMessage());
    }

    @ExceptionHandler(CorruptDocumentException.class)
    public ResponseEntity<Map<String, Object>> corrupt(CorruptDocumentException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "corrupt_document", ex.getMessage());
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(DocumentNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", reason,
                "message", message == null ? reason : message,
                "ts", Instant.now().toString()
        ));
    }
}
