package com.nayem.strata.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable copy of every store collection.
 */
public final class DataSnapshot {

    private final Map<StoreCollection<?>, List<?>> collections;

    private DataSnapshot(Map<StoreCollection<?>, List<?>> collections) {
        this.collections = collections;
    }

    public static DataSnapshot empty() {
        return new DataSnapshot(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @SuppressWarnings("unchecked")
    public <E> List<E> get(StoreCollection<E> collection) {
        List<?> values = collections.get(collection);
        return values == null ? List.of() : (List<E>) values;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.collections.putAll(collections);
        return builder;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DataSnapshot that)) {
            return false;
        }
        for (StoreCollection<?> collection : StoreCollection.ALL) {
            if (!get(collection).equals(that.get(collection))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (StoreCollection<?> collection : StoreCollection.ALL) {
            hash = 31 * hash + get(collection).hashCode();
        }
        return hash;
    }

    public static class Builder {
        private final Map<StoreCollection<?>, List<?>> collections = new LinkedHashMap<>();

        public <E> Builder put(StoreCollection<E> collection, List<E> values) {
            collections.put(collection, List.copyOf(values));
            return this;
        }

        public DataSnapshot build() {
            return new DataSnapshot(Map.copyOf(collections));
        }
    }
}
