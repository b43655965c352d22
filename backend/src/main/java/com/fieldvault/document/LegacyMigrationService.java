package com.fieldvault.document;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fieldvault.codec.DocumentCodec;
import com.fieldvault.session.EncryptionSession;
import com.fieldvault.session.KeyNotReadyException;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Encrypts documents that were written before encryption was available (or while the key was
 * not ready). Documents that already carry an encrypted-fields container are left alone. A
 * failure on one document is counted and the run continues.
 */
@Service
public class LegacyMigrationService {

    private static final Logger log = LoggerFactory.getLogger(LegacyMigrationService.class);

    private enum Outcome { ENCRYPTED, ALREADY_ENCRYPTED, SKIPPED, FAILED }

    private final DocumentRepository repository;
    private final DocumentCodec codec;
    private final EncryptionSession session;
    private final DocumentJson json;

    LegacyMigrationService(DocumentRepository repository, DocumentCodec codec, EncryptionSession session,
            DocumentJson json) {
        this.repository = repository;
        this.codec = codec;
        this.session = session;
        this.json = json;
    }

    public Mono<MigrationReport> migrate(String collection) {
        if (!codec.appliesTo(collection)) {
            return Mono.error(new IllegalArgumentException("Collection " + collection + " is not encrypted"));
        }
        if (!session.isReady()) {
            return Mono.error(new KeyNotReadyException("Encryption key is not ready"));
        }

        return repository.findAllByKeyCollection(collection)
                .concatMap(entity -> migrateOne(collection, entity))
                .collect(Tally::new, Tally::add)
                .map(Tally::toReport)
                .doOnNext(report -> log.info("Migration of {} finished: {}", collection, report));
    }

    private Mono<Outcome> migrateOne(String collection, DocumentEntity entity) {
        String id = entity.getKey().id();
        return Mono.fromCallable(() -> json.readBody(entity))
                .flatMap(record -> {
                    if (codec.isEncrypted(record)) {
                        return Mono.just(Outcome.ALREADY_ENCRYPTED);
                    }
                    return Mono.fromCallable(() -> codec.encode(record, collection))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMap(encoded -> rewrite(collection, id, encoded));
                })
                .onErrorResume(e -> {
                    log.warn("Failed to migrate {}/{}", collection, id, e);
                    return Mono.just(Outcome.FAILED);
                });
    }

    private Mono<Outcome> rewrite(String collection, String id, Map<String, Object> encoded) {
        if (!codec.isEncrypted(encoded)) {
            // Nothing encryptable, or the key went away mid-run.
            return Mono.just(session.isReady() ? Outcome.SKIPPED : Outcome.FAILED);
        }
        return repository.save(json.toEntity(collection, id, encoded))
                .thenReturn(Outcome.ENCRYPTED);
    }

    private static final class Tally {
        private int total;
        private int encrypted;
        private int alreadyEncrypted;
        private int skipped;
        private int failed;

        void add(Outcome outcome) {
            total++;
            switch (outcome) {
                case ENCRYPTED -> encrypted++;
                case ALREADY_ENCRYPTED -> alreadyEncrypted++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        MigrationReport toReport() {
            return new MigrationReport(total, encrypted, alreadyEncrypted, skipped, failed);
        }
    }
}
