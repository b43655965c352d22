package com.fieldvault.codec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.fieldvault.session.EncryptionSession;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BatchCodecTest {

    private static Scheduler scheduler;
    private static EncryptionSession session;
    private static DocumentCodec codec;

    @BeforeAll
    static void setup() {
        scheduler = Schedulers.newParallel("batch-codec-test", 4);
        session = CodecFixtures.readySession("user-123");
        codec = CodecFixtures.codec(session);
    }

    @AfterAll
    static void teardown() {
        scheduler.dispose();
    }

    private static List<Map<String, Object>> expenses(int count) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("id", "e" + i);
            record.put("amount", 100 + i);
            record.put("note", "Expense #" + i);
            records.add(record);
        }
        return records;
    }

    @Test
    void decodeAllIsolatesCorruptedRecordAndKeepsOrder() {
        BatchCodec batch = new BatchCodec(codec, session, scheduler, CodecFixtures.READY_TIMEOUT);
        List<Map<String, Object>> originals = expenses(10);
        List<Map<String, Object>> encoded = new ArrayList<>();
        originals.forEach(record -> encoded.add(codec.encode(record, "expenses")));

        CodecFixtures.corruptField(encoded.get(5), "amount");

        StepVerifier.create(batch.decodeAll(encoded, "expenses"))
                .assertNext(results -> {
                    assertEquals(10, results.size());
                    for (int i = 0; i < 10; i++) {
                        DecodeResult result = results.get(i);
                        assertEquals("e" + i, result.record().get("id"), "Order must follow the input");
                        if (i == 5) {
                            assertEquals(DecodeResult.Status.PARTIALLY_DECODED, result.status());
                            assertEquals(Set.of("amount"), result.failedFields());
                            assertEquals("Expense #5", result.record().get("note"));
                        } else {
                            assertEquals(DecodeResult.Status.DECODED, result.status());
                            assertEquals(originals.get(i), result.record());
                        }
                    }
                })
                .verifyComplete();
    }

    @Test
    void encodeAllEncryptsEveryRecordInOrder() {
        BatchCodec batch = new BatchCodec(codec, session, scheduler, CodecFixtures.READY_TIMEOUT);

        StepVerifier.create(batch.encodeAll(expenses(25), "expenses"))
                .assertNext(results -> {
                    assertEquals(25, results.size());
                    for (int i = 0; i < results.size(); i++) {
                        assertEquals("e" + i, results.get(i).get("id"));
                        assertTrue(codec.isEncrypted(results.get(i)));
                        assertFalse(results.get(i).containsKey("note"));
                    }
                })
                .verifyComplete();
    }

    @Test
    void encodeFailureKeepsOriginalForThatSlotOnly() {
        DocumentCodec flaky = mock(DocumentCodec.class);
        List<Map<String, Object>> records = expenses(3);
        Map<String, Object> marked = Map.of("id", "done");
        when(flaky.appliesTo("expenses")).thenReturn(true);
        when(flaky.encode(any(), eq("expenses"), eq(Duration.ZERO))).thenReturn(marked);
        when(flaky.encode(records.get(1), "expenses", Duration.ZERO)).thenThrow(new IllegalStateException("boom"));

        BatchCodec batch = new BatchCodec(flaky, session, scheduler, CodecFixtures.READY_TIMEOUT);

        StepVerifier.create(batch.encodeAll(records, "expenses"))
                .assertNext(results -> {
                    assertSame(marked, results.get(0));
                    assertSame(records.get(1), results.get(1));
                    assertSame(marked, results.get(2));
                })
                .verifyComplete();
    }

    @Test
    void decodeFailureYieldsFailedResultForThatSlotOnly() {
        DocumentCodec flaky = mock(DocumentCodec.class);
        List<Map<String, Object>> records = expenses(2);
        when(flaky.isEncrypted(any())).thenReturn(false);
        when(flaky.decode(records.get(0), "expenses", Duration.ZERO)).thenReturn(DecodeResult.decoded(records.get(0)));
        when(flaky.decode(records.get(1), "expenses", Duration.ZERO)).thenThrow(new IllegalStateException("boom"));

        BatchCodec batch = new BatchCodec(flaky, session, scheduler, CodecFixtures.READY_TIMEOUT);

        StepVerifier.create(batch.decodeAll(records, "expenses"))
                .assertNext(results -> {
                    assertEquals(DecodeResult.Status.DECODED, results.get(0).status());
                    assertEquals(DecodeResult.Status.FAILED, results.get(1).status());
                    assertSame(records.get(1), results.get(1).record());
                })
                .verifyComplete();
    }

    @Test
    void keyIsAwaitedOncePerBatch() {
        EncryptionSession cold = spy(CodecFixtures.newSession());
        DocumentCodec coldCodec = CodecFixtures.codec(cold);
        BatchCodec batch = new BatchCodec(coldCodec, cold, scheduler, CodecFixtures.READY_TIMEOUT);

        StepVerifier.create(batch.encodeAll(expenses(8), "expenses"))
                .assertNext(results -> assertEquals(8, results.size()))
                .verifyComplete();

        verify(cold, times(1)).waitForReady(CodecFixtures.READY_TIMEOUT);
        assertEquals(8, coldCodec.unencryptedWrites());
    }

    @Test
    void hundredDocumentsRoundTripWithinBudget() {
        BatchCodec batch = new BatchCodec(codec, session, scheduler, CodecFixtures.READY_TIMEOUT);
        batch.decodeAll(batch.encodeAll(expenses(10), "expenses").block(), "expenses").block();

        long started = System.nanoTime();
        List<Map<String, Object>> encoded = batch.encodeAll(expenses(100), "expenses").block();
        List<DecodeResult> decoded = batch.decodeAll(encoded, "expenses").block();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(100, decoded.size());
        assertTrue(decoded.stream().allMatch(result -> result.status() == DecodeResult.Status.DECODED));
        assertTrue(elapsedMs < 2_000, "100 documents took " + elapsedMs + " ms");
    }

    @Test
    void nullRecordIsRejected() {
        BatchCodec batch = new BatchCodec(codec, session, scheduler, CodecFixtures.READY_TIMEOUT);
        List<Map<String, Object>> records = new ArrayList<>(expenses(2));
        records.add(null);

        StepVerifier.create(batch.decodeAll(records, "expenses"))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void emptyBatchCompletesWithEmptyList() {
        BatchCodec batch = new BatchCodec(codec, session, scheduler, CodecFixtures.READY_TIMEOUT);

        StepVerifier.create(batch.decodeAll(List.of(), "expenses"))
                .assertNext(results -> assertTrue(results.isEmpty()))
                .verifyComplete();
    }
}
