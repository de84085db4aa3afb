package com.stashguard.persistence;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Process-local document store. Each commit builds a new document map and swaps it in,
 * so readers never observe half of a batch.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private volatile Map<DocumentPath, JsonObject> documents = Map.of();
    private final Clock clock;

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<JsonObject> read(DocumentPath path) {
        JsonObject document = documents.get(path);
        return Optional.ofNullable(document).map(JsonObject::deepCopy);
    }

    @Override
    public Map<String, JsonObject> list(String collection) {
        Map<String, JsonObject> result = new TreeMap<>();
        for (Map.Entry<DocumentPath, JsonObject> entry : documents.entrySet()) {
            DocumentPath path = entry.getKey();
            if (path.isRoot() && path.collection().equals(collection)) {
                result.put(path.id(), entry.getValue().deepCopy());
            }
        }
        return result;
    }

    @Override
    public synchronized void commit(List<DocumentWrite> writes) {
        Instant commitTime = clock.instant();
        Map<DocumentPath, JsonObject> staged = new HashMap<>(documents);
        for (DocumentWrite write : writes) {
            staged.put(write.path(), DocumentMutator.apply(staged.get(write.path()), write, commitTime));
        }
        documents = Collections.unmodifiableMap(staged);
        LOGGER.debug("Committed {} writes", writes.size());
    }

    /**
     * @return the number of stored documents, including subcollection documents
     */
    public int size() {
        return documents.size();
    }
}
