package com.alertrelay.pipeline.support;

import com.alertrelay.pipeline.store.InMemoryDocumentStore;
import com.alertrelay.pipeline.store.PersistenceException;
import com.alertrelay.pipeline.store.Query;
import com.alertrelay.pipeline.store.StoredDocument;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class FaultyDocumentStore extends InMemoryDocumentStore {
    public enum Operation {
        QUERY,
        SET,
        UPDATE,
        INCREMENT
    }

    private final Set<String> faults = ConcurrentHashMap.newKeySet();

    public FaultyDocumentStore(Clock clock) {
        super(clock);
    }

    public void failOn(Operation operation, String collection) {
        faults.add(key(operation, collection));
    }

    public void heal() {
        faults.clear();
    }

    @Override
    public List<StoredDocument> query(String collection, Query query) {
        check(Operation.QUERY, collection);
        return super.query(collection, query);
    }

    @Override
    public void set(String collection, String id, Map<String, Object> fields, boolean merge) {
        check(Operation.SET, collection);
        super.set(collection, id, fields, merge);
    }

    @Override
    public void update(String collection, String id, Map<String, Object> fields) {
        check(Operation.UPDATE, collection);
        super.update(collection, id, fields);
    }

    @Override
    public long atomicIncrement(String collection, String id, String field, long delta) {
        check(Operation.INCREMENT, collection);
        return super.atomicIncrement(collection, id, field, delta);
    }

    private void check(Operation operation, String collection) {
        if (faults.contains(key(operation, collection))) {
            throw new PersistenceException("injected " + operation + " failure on " + collection);
        }
    }

    private static String key(Operation operation, String collection) {
        return operation + ":" + collection;
    }
}
