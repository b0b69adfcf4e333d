package com.nayem.strata.tracking;

import com.nayem.strata.model.DocumentCodec;
import com.nayem.strata.model.Identified;
import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.model.SourceKey;
import com.nayem.strata.store.BaselineSnapshot;
import com.nayem.strata.store.DataSnapshot;
import com.nayem.strata.store.DocumentStore;
import com.nayem.strata.store.StoreCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Answers whether the working copy has changed since it was loaded.
 * <p>
 * Every query is derived on demand from the document store and the current
 * baseline; nothing is cached between calls. Without a baseline there is
 * nothing to compare against, so nothing has changed.
 * </p>
 * <p>
 * Remote divergence compares the working copy with the baseline captured at
 * the last sync, not with a fresh copy of the remote. A change someone else
 * pushes after that sync stays invisible until the next one.
 * </p>
 */
public class ChangeTracker {

    private static final Logger log = LoggerFactory.getLogger(ChangeTracker.class);

    private final DocumentStore store;
    private final RemoteContext remote;
    private final PendingChanges pending;
    private final SourceBaselines sourceBaselines;
    private final DocumentCodec codec;

    public ChangeTracker(DocumentStore store, RemoteContext remote, PendingChanges pending,
            SourceBaselines sourceBaselines, DocumentCodec codec) {
        this.store = store;
        this.remote = remote;
        this.pending = pending;
        this.sourceBaselines = sourceBaselines;
        this.codec = codec;
    }

    public boolean hasLocalChanges() {
        Optional<BaselineSnapshot> baseline = store.getBaseline();
        if (baseline.isEmpty()) {
            return false;
        }
        return !store.snapshot().equals(baseline.get().data()) || pending.hasPending();
    }

    /**
     * Sums id-level additions, removals and modifications over every tracked
     * collection, one more if the taxonomy order changed at all, and the
     * externally reported pending counts.
     */
    public int getChangeCount() {
        Optional<BaselineSnapshot> baseline = store.getBaseline();
        if (baseline.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (ChangeSet changes : collectionChanges(baseline.get().data()).values()) {
            count += changes.totalChanges();
        }
        if (taxonomyOrderChanged(baseline.get().data())) {
            count++;
        }
        return count + pending.pendingOverrideCount() + pending.stagedConfigurationCount();
    }

    /**
     * Completes with {@code false} unless the user is authenticated, a remote
     * source is selected and a baseline exists; otherwise with whether any
     * tracked collection or the taxonomy order differs from the baseline.
     */
    public CompletableFuture<Boolean> hasRemoteDivergence() {
        if (!remote.hasSelectedSource()) {
            return CompletableFuture.completedFuture(false);
        }
        return remote.isAuthenticated().thenApply(authenticated -> {
            if (!Boolean.TRUE.equals(authenticated)) {
                return false;
            }
            return store.getBaseline().map(baseline -> differs(baseline.data())).orElse(false);
        });
    }

    public CompletableFuture<ChangeTrackingState> getChangeTrackingState() {
        boolean local = hasLocalChanges();
        int count = getChangeCount();
        Instant lastSync = store.getBaseline().map(BaselineSnapshot::capturedAt).orElse(null);
        return hasRemoteDivergence()
                .thenApply(divergence -> ChangeTrackingState.of(local, divergence, count, lastSync));
    }

    /**
     * Per-collection change sets against the current baseline, empty without
     * one.
     */
    public Map<StoreCollection<?>, ChangeSet> collectionChanges() {
        return store.getBaseline()
                .map(baseline -> collectionChanges(baseline.data()))
                .orElse(Map.of());
    }

    /**
     * Replaces the global baseline with the current store contents.
     */
    public BaselineSnapshot captureBaseline() {
        BaselineSnapshot baseline = BaselineSnapshot.of(store.snapshot());
        store.setBaseline(baseline);
        log.debug("Captured baseline at {}", baseline.capturedAt());
        return baseline;
    }

    public void captureSourceBaseline(SourceKey key, SourceDocument document) {
        sourceBaselines.put(key, codec.toTree(document));
    }

    public void clearSourceBaseline(SourceKey key) {
        sourceBaselines.remove(key);
    }

    public boolean hasSourceBaseline(SourceKey key) {
        return sourceBaselines.contains(key);
    }

    /**
     * Diffs the top-level fields of {@code current} against the baseline of
     * its source. Without a baseline every field counts as added.
     */
    public ChangeSet diffSource(SourceKey key, SourceDocument current) {
        return StructuralDiff.diffKeys(
                sourceBaselines.get(key).map(SourceBaselines.Entry::document).orElse(null),
                codec.toTree(current));
    }

    private boolean differs(DataSnapshot baseline) {
        for (StoreCollection<?> collection : StoreCollection.TRACKED) {
            if (!store.get(collection).equals(baseline.get(collection))) {
                return true;
            }
        }
        return taxonomyOrderChanged(baseline);
    }

    private boolean taxonomyOrderChanged(DataSnapshot baseline) {
        return !store.get(StoreCollection.TAXONOMY_ORDER).equals(baseline.get(StoreCollection.TAXONOMY_ORDER));
    }

    private Map<StoreCollection<?>, ChangeSet> collectionChanges(DataSnapshot baseline) {
        Map<StoreCollection<?>, ChangeSet> changes = new LinkedHashMap<>();
        for (StoreCollection<?> collection : StoreCollection.TRACKED) {
            changes.put(collection, StructuralDiff.diffById(entities(baseline.get(collection)),
                    entities(store.get(collection))));
        }
        return changes;
    }

    @SuppressWarnings("unchecked")
    private static List<? extends Identified> entities(List<?> values) {
        return (List<? extends Identified>) values;
    }
}
