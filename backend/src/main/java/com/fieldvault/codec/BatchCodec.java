package com.fieldvault.codec;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.fieldvault.policy.EncryptionProperties;
import com.fieldvault.session.EncryptionSession;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Runs {@link DocumentCodec} over a list of records in parallel.
 *
 * <p>The key wait happens once per batch, not once per record. Each record is then encoded or
 * decoded as its own task on the codec scheduler; a task that throws yields the original record
 * for that slot. Results are returned in input order.
 */
@Component
public class BatchCodec {

    private static final Logger log = LoggerFactory.getLogger(BatchCodec.class);

    private final DocumentCodec codec;
    private final EncryptionSession session;
    private final Scheduler scheduler;
    private final Duration readyTimeout;

    @Autowired
    public BatchCodec(DocumentCodec codec, EncryptionSession session,
            @Qualifier("fieldCodecScheduler") Scheduler scheduler, EncryptionProperties properties) {
        this(codec, session, scheduler, properties.readyTimeout());
    }

    public BatchCodec(DocumentCodec codec, EncryptionSession session, Scheduler scheduler, Duration readyTimeout) {
        this.codec = codec;
        this.session = session;
        this.scheduler = scheduler;
        this.readyTimeout = readyTimeout;
    }

    public Mono<List<Map<String, Object>>> encodeAll(List<Map<String, Object>> records, String collection) {
        if (records.stream().anyMatch(Objects::isNull)) {
            return Mono.error(new IllegalArgumentException("Batch contains null records"));
        }
        boolean needsKey = codec.appliesTo(collection);
        return awaitKey(needsKey)
                .thenMany(Flux.fromIterable(records)
                        .flatMapSequential(record -> Mono.fromCallable(() -> codec.encode(record, collection, Duration.ZERO))
                                .subscribeOn(scheduler)
                                .onErrorResume(e -> {
                                    log.warn("Encoding one {} record failed, keeping it unchanged", collection, e);
                                    return Mono.just(record);
                                })))
                .collectList();
    }

    public Mono<List<DecodeResult>> decodeAll(List<Map<String, Object>> records, String collection) {
        if (records.stream().anyMatch(Objects::isNull)) {
            return Mono.error(new IllegalArgumentException("Batch contains null records"));
        }
        boolean needsKey = records.stream().anyMatch(codec::isEncrypted);
        return awaitKey(needsKey)
                .thenMany(Flux.fromIterable(records)
                        .flatMapSequential(record -> Mono.fromCallable(() -> codec.decode(record, collection, Duration.ZERO))
                                .subscribeOn(scheduler)
                                .onErrorResume(e -> {
                                    log.warn("Decoding one {} record failed, returning it unchanged", collection, e);
                                    return Mono.just(DecodeResult.failed(record, e));
                                })))
                .collectList();
    }

    private Mono<Boolean> awaitKey(boolean needed) {
        if (!needed) {
            return Mono.just(session.isReady());
        }
        return Mono.fromCallable(() -> session.waitForReady(readyTimeout))
                .subscribeOn(scheduler);
    }
}
