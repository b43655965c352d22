package com.fieldvault.codec;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.fieldvault.crypto.DataKey;
import com.fieldvault.policy.PolicyRegistry;
import com.fieldvault.session.EncryptionSession;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Record-level encode/decode: policy classification, markers, per-field isolation and the
 * degraded paths.
 */
class DocumentCodecTest {

    private static EncryptionSession session;
    private static DocumentCodec codec;

    @BeforeAll
    static void setup() {
        session = CodecFixtures.readySession("user-123");
        codec = CodecFixtures.codec(session);
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    private static Map<String, Object> container(Map<String, Object> encoded) {
        return CodecFixtures.containerOf(encoded);
    }

    // ── Encode ────────────────────────────────────────────────────────────────

    @Test
    void coffeeScenarioRoundTripsExactly() throws Exception {
        Map<String, Object> original = record("amount", 450, "note", "Coffee <script>");

        Map<String, Object> encoded = codec.encode(original, "expenses");

        assertFalse(encoded.containsKey("amount"));
        assertFalse(encoded.containsKey("note"));
        assertEquals(Set.of("amount", "note"), container(encoded).keySet());
        assertEquals("1", encoded.get(EncodedFields.SCHEME_VERSION));

        DataKey key = session.currentKey().orElseThrow();
        assertEquals("Coffee &lt;script&gt;",
                CodecFixtures.CIPHER.decrypt(key, (String) container(encoded).get("note")),
                "Strings are escaped before encryption");

        DecodeResult decoded = codec.decode(encoded, "expenses");
        assertEquals(DecodeResult.Status.DECODED, decoded.status());
        assertEquals(original, decoded.record());
    }

    @Test
    void nonExemptScalarsAreEncryptedByDefault() {
        Map<String, Object> encoded = codec.encode(
                record("id", "e1", "category", "food", "merchant", "Lidl", "quantity", 3), "expenses");

        assertEquals("e1", encoded.get("id"));
        assertEquals("food", encoded.get("category"));
        assertEquals(Set.of("merchant", "quantity"), container(encoded).keySet());
    }

    @Test
    void nestedValuesStayPlaintextUnlessSensitive() {
        Map<String, Object> tags = Map.of("color", "red");
        List<Integer> splits = List.of(100, 200);

        Map<String, Object> encoded = codec.encode(record("labels", tags, "splits", splits), "expenses");

        assertEquals(tags, encoded.get("labels"));
        assertFalse(encoded.containsKey("splits"));
        assertEquals(splits, codec.decode(encoded, "expenses").record().get("splits"));
    }

    @Test
    void nullAndEmptyValuesAreNotEncrypted() {
        Map<String, Object> encoded = codec.encode(record("note", "", "amount", null, "id", "x"), "expenses");

        assertEquals("", encoded.get("note"));
        assertTrue(encoded.containsKey("amount"));
        assertNull(encoded.get("amount"));
        assertFalse(codec.isEncrypted(encoded));
        assertFalse(encoded.containsKey(EncodedFields.SCHEME_VERSION));
    }

    @Test
    void collectionExemptionsAndVersionOverride() {
        Map<String, Object> encoded = codec.encode(record("title", "Todo", "pinned", true), "notes");

        assertEquals(true, encoded.get("pinned"));
        assertEquals(Set.of("title"), container(encoded).keySet());
        assertEquals("2", encoded.get(EncodedFields.SCHEME_VERSION));
    }

    @Test
    void unknownCollectionIsStoredAsIs() {
        Map<String, Object> original = record("name", "Alice");

        assertSame(original, codec.encode(original, "userPreferences"));
    }

    @Test
    void disabledEncryptionStoresAsIs() {
        DocumentCodec disabled = new DocumentCodec(session, CodecFixtures.CIPHER,
                new PolicyRegistry(CodecFixtures.properties(false)), CodecFixtures.READY_TIMEOUT);
        Map<String, Object> original = record("amount", 10);

        assertSame(original, disabled.encode(original, "expenses"));
    }

    @Test
    void reEncodingKeepsExistingEncryptedFields() {
        Map<String, Object> first = codec.encode(record("amount", 450), "expenses");
        Map<String, Object> updated = new LinkedHashMap<>(first);
        updated.put("note", "Refund");

        Map<String, Object> second = codec.encode(updated, "expenses");

        assertEquals(Set.of("amount", "note"), container(second).keySet());
        assertEquals(record("amount", 450, "note", "Refund"), codec.decode(second, "expenses").record());
    }

    @Test
    void reEncodingDropsCipherTextOfClearedField() {
        Map<String, Object> first = codec.encode(record("amount", 450, "note", "Coffee"), "expenses");
        Map<String, Object> edited = new LinkedHashMap<>(first);
        edited.put("note", "");

        Map<String, Object> second = codec.encode(edited, "expenses");

        assertEquals(Set.of("amount"), container(second).keySet());
        assertEquals("", second.get("note"));
        assertEquals(record("amount", 450, "note", ""), codec.decode(second, "expenses").record());
    }

    @Test
    void reEncodingDropsCipherTextOfNulledOrNestedField() {
        Map<String, Object> first = codec.encode(record("amount", 450, "merchant", "Lidl"), "expenses");
        Map<String, Object> edited = new LinkedHashMap<>(first);
        edited.put("amount", null);
        edited.put("merchant", Map.of("name", "Lidl"));

        Map<String, Object> second = codec.encode(edited, "expenses");

        assertFalse(codec.isEncrypted(second));
        assertFalse(second.containsKey(EncodedFields.SCHEME_VERSION));
        assertNull(second.get("amount"));
        assertEquals(Map.of("name", "Lidl"), codec.decode(second, "expenses").record().get("merchant"));
    }

    @Test
    void encodeWithoutSessionDoesNotWaitForTimeout() {
        DocumentCodec coldCodec = new DocumentCodec(CodecFixtures.newSession(), CodecFixtures.CIPHER,
                CodecFixtures.policies(), Duration.ofSeconds(6));

        long started = System.nanoTime();
        coldCodec.encode(record("amount", 1), "expenses");
        DecodeResult decoded = coldCodec.decode(codec.encode(record("amount", 1), "expenses"), "expenses");
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(DecodeResult.Status.PARTIALLY_DECODED, decoded.status());
        assertTrue(elapsedMs < 1_000, "waited " + elapsedMs + " ms");
    }

    @Test
    void encodeBeforeInitializationFallsBackToPlaintext() {
        EncryptionSession cold = CodecFixtures.newSession();
        DocumentCodec coldCodec = CodecFixtures.codec(cold);
        Map<String, Object> original = record("amount", 450, "note", "Coffee");

        Map<String, Object> encoded = coldCodec.encode(original, "expenses");

        assertSame(original, encoded);
        assertFalse(encoded.containsKey(EncodedFields.CONTAINER));
        assertEquals(1, coldCodec.unencryptedWrites(), "Degradation must be counted");
    }

    // ── Decode ────────────────────────────────────────────────────────────────

    @Test
    void legacyRecordIsReturnedAsIs() {
        Map<String, Object> legacy = record("amount", 99, "note", "old");

        DecodeResult result = codec.decode(legacy, "expenses");

        assertEquals(DecodeResult.Status.DECODED, result.status());
        assertSame(legacy, result.record());
    }

    @Test
    void legacyPlaintextInsideContainerIsTolerated() {
        Map<String, Object> mixed = record("id", "x",
                EncodedFields.CONTAINER, Map.of("note", "old note"), EncodedFields.SCHEME_VERSION, "1");

        DecodeResult result = codec.decode(mixed, "expenses");

        assertEquals(DecodeResult.Status.DECODED, result.status());
        assertEquals(record("id", "x", "note", "old note"), result.record());
    }

    @Test
    void corruptedFieldIsDroppedAndFlagged() {
        Map<String, Object> encoded = codec.encode(record("id", "e5", "amount", 450, "note", "Coffee"), "expenses");
        CodecFixtures.corruptField(encoded, "note");

        DecodeResult result = codec.decode(encoded, "expenses");

        assertEquals(DecodeResult.Status.PARTIALLY_DECODED, result.status());
        assertTrue(result.hasErrors());
        assertEquals(Set.of("note"), result.failedFields());
        assertEquals(Set.of("note"), result.missingFields());
        assertEquals(record("id", "e5", "amount", 450), result.record());
    }

    @Test
    void corruptedFieldKeepsLastKnownPlaintext() {
        Map<String, Object> encoded = codec.encode(record("amount", 450, "note", "Coffee"), "expenses");
        CodecFixtures.corruptField(encoded, "note");
        encoded.put("note", "Coffee (cached)");

        DecodeResult result = codec.decode(encoded, "expenses");

        assertEquals(DecodeResult.Status.PARTIALLY_DECODED, result.status());
        assertEquals(Set.of("note"), result.failedFields());
        assertTrue(result.missingFields().isEmpty());
        assertEquals("Coffee (cached)", result.record().get("note"));
        assertEquals(450, result.record().get("amount"));
    }

    @Test
    void decodeWithoutKeyReturnsPlaintextRemainder() {
        Map<String, Object> encoded = codec.encode(record("id", "e1", "amount", 450), "expenses");
        DocumentCodec coldCodec = CodecFixtures.codec(CodecFixtures.newSession());

        DecodeResult result = coldCodec.decode(encoded, "expenses");

        assertEquals(DecodeResult.Status.PARTIALLY_DECODED, result.status());
        assertEquals(record("id", "e1"), result.record());
        assertEquals(Set.of("amount"), result.missingFields());
        assertEquals(1, coldCodec.degradedReads());
    }

    @Test
    void recordsFromAnotherAccountFailPerField() {
        DocumentCodec otherCodec = CodecFixtures.codec(CodecFixtures.readySession("someone-else"));
        Map<String, Object> encoded = otherCodec.encode(record("id", "e1", "amount", 1), "expenses");

        DecodeResult result = codec.decode(encoded, "expenses");

        assertEquals(Set.of("amount"), result.failedFields());
        assertEquals(record("id", "e1"), result.record());
    }

    @Test
    void malformedContainerFails() {
        Map<String, Object> broken = record("id", "x", EncodedFields.CONTAINER, "not-a-map");

        DecodeResult result = codec.decode(broken, "expenses");

        assertEquals(DecodeResult.Status.FAILED, result.status());
        assertSame(broken, result.record());
        assertNotNull(result.cause());
    }
}
