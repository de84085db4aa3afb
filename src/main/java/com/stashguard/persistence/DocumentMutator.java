package com.stashguard.persistence;

import com.google.gson.JsonObject;

import java.time.Instant;
import java.util.Map;

/**
 * Applies a single {@link DocumentWrite} to a stored document.
 */
final class DocumentMutator {

    private DocumentMutator() {
    }

    /**
     * Computes the document that results from a write.
     *
     * @param existing the stored document, or null if absent
     * @param write the write to apply
     * @param commitTime timestamp used for server-timestamp fields
     * @return a new document; {@code existing} is not modified
     */
    static JsonObject apply(JsonObject existing, DocumentWrite write, Instant commitTime) {
        JsonObject base = write.merge() ? existing : null;
        JsonObject result = base != null ? base.deepCopy() : new JsonObject();
        for (Map.Entry<String, FieldValue> entry : write.fields().entrySet()) {
            String field = entry.getKey();
            result.add(field, entry.getValue().resolve(base != null ? base.get(field) : null, commitTime));
        }
        return result;
    }
}
