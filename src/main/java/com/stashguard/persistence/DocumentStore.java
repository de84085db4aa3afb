package com.stashguard.persistence;

import com.google.gson.JsonObject;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document database holding player documents and the item catalog.
 */
public interface DocumentStore {

    /**
     * Reads one document.
     *
     * @param path document address
     * @return a copy of the document, or empty if it does not exist
     * @throws StoreException if the store cannot be read
     */
    Optional<JsonObject> read(DocumentPath path) throws StoreException;

    /**
     * Lists every document of a top-level collection.
     *
     * @param collection collection name
     * @return copies of the documents keyed by id
     * @throws StoreException if the store cannot be read
     */
    Map<String, JsonObject> list(String collection) throws StoreException;

    /**
     * Applies a set of writes atomically: either every write becomes durable or none does.
     *
     * @param writes writes in application order
     * @throws StoreException if the commit fails
     */
    void commit(List<DocumentWrite> writes) throws StoreException;

    /**
     * Starts a new unit of work against this store.
     */
    default WriteBatch batch() {
        return new WriteBatch(this);
    }
}
