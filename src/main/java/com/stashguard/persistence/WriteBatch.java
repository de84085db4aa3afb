package com.stashguard.persistence;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit of work over a {@link DocumentStore}: collects writes, then commits all of them or none.
 *
 * <p>A batch may be committed once. Writes are applied in the order they were added, so a
 * later write to the same document sees the effect of an earlier one.
 */
public class WriteBatch {

    private final DocumentStore store;
    private final List<DocumentWrite> writes = new ArrayList<>();
    private boolean committed = false;

    WriteBatch(DocumentStore store) {
        this.store = store;
    }

    /**
     * Replaces the document at {@code path} with the given fields.
     */
    public WriteBatch set(DocumentPath path, Map<String, FieldValue> fields) {
        return add(new DocumentWrite(path, false, fields));
    }

    /**
     * Replaces the document at {@code path} with the members of a JSON object.
     */
    public WriteBatch set(DocumentPath path, JsonObject data) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : data.entrySet()) {
            fields.put(entry.getKey(), FieldValue.of(entry.getValue()));
        }
        return set(path, fields);
    }

    /**
     * Updates the named fields of the document at {@code path}, creating it if absent.
     * Fields not named are left untouched.
     */
    public WriteBatch merge(DocumentPath path, Map<String, FieldValue> fields) {
        return add(new DocumentWrite(path, true, fields));
    }

    /**
     * Commits every collected write atomically.
     *
     * @throws StoreException if the store cannot commit; nothing is applied in that case
     * @throws IllegalStateException if the batch was already committed
     */
    public void commit() throws StoreException {
        ensureOpen();
        committed = true;
        store.commit(Collections.unmodifiableList(new ArrayList<>(writes)));
    }

    private WriteBatch add(DocumentWrite write) {
        ensureOpen();
        writes.add(write);
        return this;
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Write batch already committed");
        }
    }
}
