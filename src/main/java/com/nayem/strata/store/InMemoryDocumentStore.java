package com.nayem.strata.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link DocumentStore}.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Single-user editors
 * </p>
 * <p>
 * Note: contents are lost on restart. Use {@link RedisDocumentStore} to keep
 * the working copy across sessions.
 * </p>
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<StoreCollection<?>, List<?>> collections = new ConcurrentHashMap<>();
    private final Map<String, BaselineSnapshot> snapshots = new ConcurrentHashMap<>();
    private final AtomicReference<BaselineSnapshot> baseline = new AtomicReference<>();

    @Override
    @SuppressWarnings("unchecked")
    public <E> List<E> get(StoreCollection<E> collection) {
        List<?> values = collections.get(collection);
        return values == null ? List.of() : (List<E>) values;
    }

    @Override
    public <E> void set(StoreCollection<E> collection, List<E> values) {
        collections.put(collection, List.copyOf(values));
    }

    @Override
    public Optional<BaselineSnapshot> getBaseline() {
        return Optional.ofNullable(baseline.get());
    }

    @Override
    public void setBaseline(BaselineSnapshot snapshot) {
        baseline.set(snapshot);
    }

    @Override
    public Optional<BaselineSnapshot> getSnapshot(String name) {
        return Optional.ofNullable(snapshots.get(name));
    }

    @Override
    public void setSnapshot(String name, BaselineSnapshot snapshot) {
        snapshots.put(name, snapshot);
    }

    @Override
    public void removeSnapshot(String name) {
        snapshots.remove(name);
    }

    /**
     * Clears all stored state. Useful for testing.
     */
    public void clear() {
        collections.clear();
        snapshots.clear();
        baseline.set(null);
    }
}
