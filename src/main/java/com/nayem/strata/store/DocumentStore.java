package com.nayem.strata.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of the working copy: one list per named collection plus the
 * global baseline and any number of named snapshots.
 * <p>
 * Writes replace a whole collection at once; readers never observe a partly
 * written collection.
 * </p>
 */
public interface DocumentStore {

    <E> List<E> get(StoreCollection<E> collection);

    <E> void set(StoreCollection<E> collection, List<E> values);

    Optional<BaselineSnapshot> getBaseline();

    void setBaseline(BaselineSnapshot baseline);

    Optional<BaselineSnapshot> getSnapshot(String name);

    void setSnapshot(String name, BaselineSnapshot snapshot);

    void removeSnapshot(String name);

    /**
     * Copies the current contents of every collection.
     */
    default DataSnapshot snapshot() {
        DataSnapshot.Builder builder = DataSnapshot.builder();
        for (StoreCollection<?> collection : StoreCollection.ALL) {
            copy(builder, collection);
        }
        return builder.build();
    }

    private <E> void copy(DataSnapshot.Builder builder, StoreCollection<E> collection) {
        builder.put(collection, get(collection));
    }
}
