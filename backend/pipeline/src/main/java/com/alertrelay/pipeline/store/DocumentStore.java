package com.alertrelay.pipeline.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted documents grouped in slash-separated collection paths (for example
 * {@code organizations/org-1/alerts}). Field values are JSON-compatible: strings, numbers, booleans,
 * lists and maps. Timestamps are stored as epoch milliseconds.
 *
 * <p>Every method may throw {@link PersistenceException}. Each single call is atomic for the document it touches;
 * nothing is atomic across documents.
 */
public interface DocumentStore {
    List<StoredDocument> query(String collection, Query query);

    Optional<StoredDocument> get(String collection, String id);

    void set(String collection, String id, Map<String, Object> fields, boolean merge);

    /**
     * Changes the given fields of an existing document.
     *
     * @throws DocumentNotFoundException if the document does not exist
     */
    void update(String collection, String id, Map<String, Object> fields);

    void delete(String collection, String id);

    /**
     * Adds {@code delta} to a numeric field without a read-modify-write by the caller. A missing field counts as zero.
     *
     * @return the value after the increment
     * @throws DocumentNotFoundException if the document does not exist
     */
    long atomicIncrement(String collection, String id, String field, long delta);

    String newId(String collection);
}
