package com.stashguard.persistence;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryDocumentStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryDocumentStore store;
    private DocumentPath player;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(Clock.fixed(NOW, ZoneOffset.UTC));
        player = DocumentPath.of("players", "p1");
    }

    @Test
    void testSetReplacesDocument() throws StoreException {
        store.batch().set(player, Map.of("a", FieldValue.of(1), "b", FieldValue.of("x"))).commit();
        store.batch().set(player, Map.of("c", FieldValue.of("y"))).commit();

        JsonObject document = store.read(player).orElseThrow();
        assertFalse(document.has("a"));
        assertEquals("y", document.get("c").getAsString());
    }

    @Test
    void testMergeKeepsOtherFields() throws StoreException {
        store.batch().set(player, Map.of("name", FieldValue.of("Ada"))).commit();
        store.batch().merge(player, Map.of("level", FieldValue.of(3))).commit();

        JsonObject document = store.read(player).orElseThrow();
        assertEquals("Ada", document.get("name").getAsString());
        assertEquals(3, document.get("level").getAsInt());
    }

    @Test
    void testIncrementStartsFromZeroAndAccumulates() throws StoreException {
        store.batch().merge(player, Map.of("updateCount", FieldValue.increment(1))).commit();
        store.batch().merge(player, Map.of("updateCount", FieldValue.increment(1))).commit();

        assertEquals(2, store.read(player).orElseThrow().get("updateCount").getAsLong());
    }

    @Test
    void testServerTimestampUsesCommitTime() throws StoreException {
        store.batch().set(player, Map.of("lastUpdated", FieldValue.serverTimestamp())).commit();

        assertEquals(NOW.toString(), store.read(player).orElseThrow().get("lastUpdated").getAsString());
    }

    @Test
    void testReadReturnsCopy() throws StoreException {
        store.batch().set(player, Map.of("items", FieldValue.of(new JsonArray()))).commit();

        store.read(player).orElseThrow().add("mutated", new JsonObject());

        assertFalse(store.read(player).orElseThrow().has("mutated"));
    }

    @Test
    void testListReturnsOnlyTopLevelDocumentsOfCollection() throws StoreException {
        store.batch()
            .set(DocumentPath.of("items", "weapon:sword"), Map.of("item_name", FieldValue.of("Sword")))
            .set(DocumentPath.of("items", "misc:coin"), Map.of("item_name", FieldValue.of("Coin")))
            .set(player.child("items", "nested"), Map.of("item_name", FieldValue.of("Nested")))
            .commit();

        Map<String, JsonObject> items = store.list("items");

        assertEquals(2, items.size());
        assertTrue(items.containsKey("weapon:sword"));
        assertTrue(items.containsKey("misc:coin"));
        assertEquals(3, store.size());
    }

    @Test
    void testBatchCannotBeReused() throws StoreException {
        WriteBatch batch = store.batch().set(player, Map.of("a", FieldValue.of(1)));
        batch.commit();

        assertThrows(IllegalStateException.class, batch::commit);
        assertThrows(IllegalStateException.class, () -> batch.set(player, Map.of()));
    }

    @Test
    void testMissingDocument() {
        assertTrue(store.read(DocumentPath.of("players", "nobody")).isEmpty());
        assertTrue(store.list("players").isEmpty());
    }
}
