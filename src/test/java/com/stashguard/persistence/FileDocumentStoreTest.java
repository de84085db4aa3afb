package com.stashguard.persistence;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class FileDocumentStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private FileDocumentStore store;
    private DocumentPath player;

    @BeforeEach
    void setUp() {
        store = new FileDocumentStore(tempDir, Clock.fixed(NOW, ZoneOffset.UTC));
        player = DocumentPath.of("players", "p1");
    }

    @Test
    void testBatchUnderOneRootIsPersisted() throws StoreException {
        JsonArray items = new JsonArray();
        items.add("weapon:sword");

        store.batch()
            .set(player.child("stash", "current"), Map.of("items", FieldValue.of(items), "lastUpdated", FieldValue.serverTimestamp()))
            .merge(player, Map.of("updateCount", FieldValue.increment(1)))
            .commit();

        JsonObject stash = store.read(player.child("stash", "current")).orElseThrow();
        assertEquals(1, stash.getAsJsonArray("items").size());
        assertEquals(NOW.toString(), stash.get("lastUpdated").getAsString());
        assertEquals(1, store.read(player).orElseThrow().get("updateCount").getAsLong());
        assertTrue(Files.exists(tempDir.resolve("players").resolve("p1.json")));
    }

    @Test
    void testDocumentsSurviveReopen() throws StoreException {
        store.batch().merge(player, Map.of("updateCount", FieldValue.increment(1))).commit();
        store.batch().merge(player, Map.of("updateCount", FieldValue.increment(1))).commit();

        FileDocumentStore reopened = new FileDocumentStore(tempDir, Clock.systemUTC());

        assertEquals(2, reopened.read(player).orElseThrow().get("updateCount").getAsLong());
    }

    @Test
    void testBatchSpanningRootsRejectedWithoutWriting() {
        WriteBatch batch = store.batch()
            .set(player, Map.of("a", FieldValue.of(1)))
            .set(DocumentPath.of("players", "p2"), Map.of("a", FieldValue.of(2)));

        assertThrows(StoreException.class, batch::commit);
        assertFalse(Files.exists(tempDir.resolve("players").resolve("p1.json")));
    }

    @Test
    void testListDecodesDocumentIds() throws StoreException {
        store.batch().set(DocumentPath.of("items", "weapon:sword"), Map.of("item_name", FieldValue.of("Sword"))).commit();
        store.batch().set(DocumentPath.of("items", "misc:coin"), Map.of("item_name", FieldValue.of("Coin"))).commit();

        Map<String, JsonObject> items = store.list("items");

        assertEquals(2, items.size());
        assertEquals("Sword", items.get("weapon:sword").get("item_name").getAsString());
    }

    @Test
    void testReplacingSubdocumentLeavesSiblingsAlone() throws StoreException {
        store.batch()
            .set(player.child("stash", "current"), Map.of("items", FieldValue.of(new JsonArray())))
            .set(player.child("equipment", "current"), Map.of("items", FieldValue.of(new JsonArray())))
            .commit();
        store.batch().set(player.child("stash", "current"), Map.of("marker", FieldValue.of("new"))).commit();

        assertTrue(store.read(player.child("equipment", "current")).isPresent());
        assertFalse(store.read(player.child("stash", "current")).orElseThrow().has("items"));
        assertTrue(store.read(player).isEmpty());
    }

    @Test
    void testCorruptFileReportedAsStoreException() throws Exception {
        Files.createDirectories(tempDir.resolve("players"));
        Files.writeString(tempDir.resolve("players").resolve("p1.json"), "{not json");

        assertThrows(StoreException.class, () -> store.read(player));
    }

    @Test
    void testUnsupportedSchemaVersionRejected() throws Exception {
        Files.createDirectories(tempDir.resolve("players"));
        Files.writeString(tempDir.resolve("players").resolve("p1.json"), "{\"schemaVersion\": 99, \"root\": {}}");

        assertThrows(StoreException.class, () -> store.read(player));
    }

    @Test
    void testNonNumericSchemaVersionReportedAsStoreException() throws Exception {
        Files.createDirectories(tempDir.resolve("items"));
        Files.writeString(tempDir.resolve("items").resolve("weapon%3Asword.json"), "{\"schemaVersion\": \"abc\", \"root\": {}}");

        assertThrows(StoreException.class, () -> store.list("items"));
        assertThrows(StoreException.class, () -> store.read(DocumentPath.of("items", "weapon:sword")));
    }

    @Test
    void testNonObjectDataReportedAsStoreException() throws Exception {
        Files.createDirectories(tempDir.resolve("items"));
        Files.writeString(tempDir.resolve("items").resolve("weapon%3Asword.json"), "{\"schemaVersion\": 1, \"root\": {\"data\": 5}}");
        DocumentPath sword = DocumentPath.of("items", "weapon:sword");

        assertThrows(StoreException.class, () -> store.list("items"));
        assertThrows(StoreException.class, () -> store.read(sword));
        assertThrows(StoreException.class,
            () -> store.batch().merge(sword, Map.of("max_stack", FieldValue.of(1))).commit());
    }

    @Test
    void testConcurrentIncrementsOnOneRootAreSerialized() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Void>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    store.batch().merge(player, Map.of("updateCount", FieldValue.increment(1))).commit();
                    return null;
                }));
            }
            start.countDown();
            for (Future<Void> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads, store.read(player).orElseThrow().get("updateCount").getAsLong());
    }
}
