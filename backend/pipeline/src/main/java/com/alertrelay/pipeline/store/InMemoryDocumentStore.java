package com.alertrelay.pipeline.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

public class InMemoryDocumentStore implements DocumentStore {
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, Map<String, Object>>> collections = new HashMap<>();

    public InMemoryDocumentStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public List<StoredDocument> query(String collection, Query query) {
        lock.lock();
        try {
            List<StoredDocument> snapshot = new ArrayList<>();
            for (Map.Entry<String, Map<String, Object>> entry : documents(collection).entrySet()) {
                snapshot.add(new StoredDocument(entry.getKey(), DocumentValues.deepCopy(entry.getValue())));
            }
            return query.apply(snapshot);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StoredDocument> get(String collection, String id) {
        lock.lock();
        try {
            Map<String, Object> fields = documents(collection).get(id);
            if (fields == null) {
                return Optional.empty();
            }
            return Optional.of(new StoredDocument(id, DocumentValues.deepCopy(fields)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String collection, String id, Map<String, Object> fields, boolean merge) {
        lock.lock();
        try {
            Map<String, Object> resolved = DocumentValues.resolveForWrite(fields, clock.millis());
            Map<String, Map<String, Object>> docs = collections.computeIfAbsent(collection, ignored -> new LinkedHashMap<>());
            Map<String, Object> existing = docs.get(id);
            if (merge && existing != null) {
                existing.putAll(resolved);
            } else {
                docs.put(id, resolved);
            }
            afterWrite();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void update(String collection, String id, Map<String, Object> fields) {
        lock.lock();
        try {
            Map<String, Object> existing = documents(collection).get(id);
            if (existing == null) {
                throw new DocumentNotFoundException(collection, id);
            }
            existing.putAll(DocumentValues.resolveForWrite(fields, clock.millis()));
            afterWrite();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String collection, String id) {
        lock.lock();
        try {
            if (documents(collection).remove(id) != null) {
                afterWrite();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long atomicIncrement(String collection, String id, String field, long delta) {
        lock.lock();
        try {
            Map<String, Object> existing = documents(collection).get(id);
            if (existing == null) {
                throw new DocumentNotFoundException(collection, id);
            }
            Object current = existing.get(field);
            if (current != null && !(current instanceof Number)) {
                throw new PersistenceException("Field " + field + " of " + collection + "/" + id + " is not numeric");
            }
            long next = (current == null ? 0L : ((Number) current).longValue()) + delta;
            existing.put(field, next);
            afterWrite();
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String newId(String collection) {
        return UUID.randomUUID().toString();
    }

    // Runs with the lock held after every successful mutation.
    protected void afterWrite() {
    }

    protected Map<String, Map<String, Map<String, Object>>> snapshot() {
        lock.lock();
        try {
            Map<String, Map<String, Map<String, Object>>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, Map<String, Object>>> entry : collections.entrySet()) {
                Map<String, Map<String, Object>> docs = new LinkedHashMap<>();
                entry.getValue().forEach((id, fields) -> docs.put(id, DocumentValues.deepCopy(fields)));
                copy.put(entry.getKey(), docs);
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    protected void restore(Map<String, Map<String, Map<String, Object>>> loaded) {
        lock.lock();
        try {
            collections.clear();
            for (Map.Entry<String, Map<String, Map<String, Object>>> entry : loaded.entrySet()) {
                Map<String, Map<String, Object>> docs = new LinkedHashMap<>();
                entry.getValue().forEach((id, fields) -> docs.put(id, DocumentValues.deepCopy(fields)));
                collections.put(entry.getKey(), docs);
            }
        } finally {
            lock.unlock();
        }
    }

    protected ReentrantLock lock() {
        return lock;
    }

    private Map<String, Map<String, Object>> documents(String collection) {
        return collections.getOrDefault(collection, Map.of());
    }
}
