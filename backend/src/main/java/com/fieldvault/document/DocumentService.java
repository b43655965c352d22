package com.fieldvault.document;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fieldvault.codec.BatchCodec;
import com.fieldvault.codec.DecodeResult;
import com.fieldvault.codec.DocumentCodec;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Store layer for encrypted documents.
 *
 * <p>Records are encoded immediately before a write and decoded immediately after a read. The
 * repository only ever sees the encoded JSON. Encoding never blocks a write: if the key is not
 * ready the record is stored in plaintext (see {@link DocumentCodec}).
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentRepository repository;
    private final DocumentCodec codec;
    private final BatchCodec batchCodec;
    private final DocumentJson json;

    DocumentService(DocumentRepository repository, DocumentCodec codec, BatchCodec batchCodec, DocumentJson json) {
        this.repository = repository;
        this.codec = codec;
        this.batchCodec = batchCodec;
        this.json = json;
    }

    /**
     * Encodes and stores a record. A null {@code id} creates a new document.
     *
     * @return the document id
     */
    public Mono<String> save(String collection, String id, Map<String, Object> record) {
        if (record == null) {
            return Mono.error(new IllegalArgumentException("Document body is required"));
        }
        String documentId = id != null ? id : UUID.randomUUID().toString();

        return Mono.fromCallable(() -> codec.encode(record, collection))
                .subscribeOn(Schedulers.boundedElastic())
                .map(encoded -> json.toEntity(collection, documentId, encoded))
                .flatMap(repository::save)
                .doOnNext(saved -> log.debug("Stored {}/{}", collection, documentId))
                .thenReturn(documentId);
    }

    public Mono<StoredDocument> find(String collection, String id) {
        return repository.findById(new DocumentKey(collection, id))
                .switchIfEmpty(Mono.error(new DocumentNotFoundException(collection, id)))
                .map(json::readBody)
                .flatMap(record -> Mono.fromCallable(() -> codec.decode(record, collection))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(result -> new StoredDocument(id, result));
    }

    /**
     * Reads and decodes every document of a collection. Documents that fail to decode are still
     * returned, flagged in their {@link DecodeResult}. A body that cannot be parsed fails only its
     * own slot.
     */
    public Mono<List<StoredDocument>> findAll(String collection) {
        return repository.findAllByKeyCollection(collection)
                .collectList()
                .flatMap(entities -> {
                    DecodeResult[] unreadable = new DecodeResult[entities.size()];
                    List<Map<String, Object>> records = new ArrayList<>(entities.size());
                    for (int i = 0; i < entities.size(); i++) {
                        try {
                            records.add(json.readBody(entities.get(i)));
                        } catch (CorruptDocumentException e) {
                            log.warn("Unreadable document in {}: {}", collection, e.getMessage());
                            unreadable[i] = DecodeResult.failed(Map.of(), e);
                        }
                    }
                    return batchCodec.decodeAll(records, collection)
                            .map(results -> {
                                Iterator<DecodeResult> decoded = results.iterator();
                                List<StoredDocument> documents = new ArrayList<>(entities.size());
                                for (int i = 0; i < entities.size(); i++) {
                                    DecodeResult result = unreadable[i] != null ? unreadable[i] : decoded.next();
                                    documents.add(new StoredDocument(entities.get(i).getKey().id(), result));
                                }
                                return documents;
                            });
                });
    }

    public Mono<Void> delete(String collection, String id) {
        return repository.deleteById(new DocumentKey(collection, id));
    }
}
