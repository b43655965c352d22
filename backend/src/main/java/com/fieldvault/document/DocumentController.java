package com.fieldvault.document;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/documents/{collection}")
public class DocumentController {

    private final DocumentService documentService;
    private final LegacyMigrationService migrationService;

    public DocumentController(DocumentService documentService, LegacyMigrationService migrationService) {
        this.documentService = documentService;
        this.migrationService = migrationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SaveResponse> create(@PathVariable String collection, @RequestBody Map<String, Object> record) {
        return documentService.save(collection, null, record)
                .map(id -> new SaveResponse(collection, id));
    }

    @PutMapping("/{id}")
    public Mono<SaveResponse> replace(@PathVariable String collection, @PathVariable String id,
            @RequestBody Map<String, Object> record) {
        return documentService.save(collection, id, record)
                .map(saved -> new SaveResponse(collection, saved));
    }

    @GetMapping("/{id}")
    public Mono<DocumentResponse> get(@PathVariable String collection, @PathVariable String id) {
        return documentService.find(collection, id)
                .map(DocumentResponse::from);
    }

    @GetMapping
    public Flux<DocumentResponse> list(@PathVariable String collection) {
        return documentService.findAll(collection)
                .flatMapIterable(documents -> documents)
                .map(DocumentResponse::from);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@PathVariable String collection, @PathVariable String id) {
        return documentService.delete(collection, id);
    }

    /**
     * Encrypts documents of this collection that are still stored in plaintext.
     * Requires a signed-in session.
     */
    @PostMapping("/_migrate")
    public Mono<MigrationReport> migrate(@PathVariable String collection) {
        return migrationService.migrate(collection);
    }
}
