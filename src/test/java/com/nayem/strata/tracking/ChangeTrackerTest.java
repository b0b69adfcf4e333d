package com.nayem.strata.tracking;

import com.nayem.strata.SampleDocuments;
import com.nayem.strata.model.CoreDocument;
import com.nayem.strata.model.DocumentCodec;
import com.nayem.strata.model.Mode;
import com.nayem.strata.model.SourceKey;
import com.nayem.strata.model.Theme;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.ValueType;
import com.nayem.strata.store.InMemoryDocumentStore;
import com.nayem.strata.store.StoreCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.nayem.strata.SampleDocuments.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeTrackerTest {

    private InMemoryDocumentStore store;
    private SourceBaselines sourceBaselines;
    private final DocumentCodec codec = new DocumentCodec();

    private static Token t1(String value) {
        return Token.builder("T1").resolvedValueTypeId("color").value(List.of("light"), text(value)).build();
    }

    private static RemoteContext remote(boolean authenticated, boolean selected) {
        return new RemoteContext() {
            @Override
            public CompletableFuture<Boolean> isAuthenticated() {
                return CompletableFuture.completedFuture(authenticated);
            }

            @Override
            public boolean hasSelectedSource() {
                return selected;
            }
        };
    }

    private ChangeTracker tracker(RemoteContext remote, PendingChanges pending) {
        return new ChangeTracker(store, remote, pending, sourceBaselines, codec);
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        sourceBaselines = new SourceBaselines();
        store.set(StoreCollection.TOKENS, List.of(t1("#000")));
        store.set(StoreCollection.VALUE_TYPES, List.of(new ValueType("color", "Color", "color")));
        store.set(StoreCollection.TAXONOMY_ORDER, List.of("category", "property"));
    }

    @Test
    void nothingChangesWithoutABaseline() {
        ChangeTracker tracker = tracker(remote(true, true), PendingChanges.of(2, 1));

        assertFalse(tracker.hasLocalChanges());
        assertEquals(0, tracker.getChangeCount());
        assertFalse(tracker.hasRemoteDivergence().join());
        assertThat(tracker.collectionChanges()).isEmpty();
    }

    @Test
    void singleValueEditCountsAsOneChange() {
        ChangeTracker tracker = tracker(remote(true, true), PendingChanges.NONE);
        tracker.captureBaseline();

        store.set(StoreCollection.TOKENS, List.of(t1("#111")));

        assertTrue(tracker.hasLocalChanges());
        assertEquals(1, tracker.getChangeCount());
        assertThat(tracker.collectionChanges().get(StoreCollection.TOKENS).modified()).containsExactly("T1");
    }

    @Test
    void changeCountAddsCollectionsTaxonomyOrderAndPendingCounts() {
        ChangeTracker tracker = tracker(remote(true, true), PendingChanges.of(2, 1));
        tracker.captureBaseline();

        List<Token> tokens = new ArrayList<>(store.get(StoreCollection.TOKENS));
        tokens.add(Token.builder("T2").resolvedValueTypeId("color").build());
        store.set(StoreCollection.TOKENS, tokens);
        store.set(StoreCollection.VALUE_TYPES, List.of());
        store.set(StoreCollection.THEMES, List.of(new Theme("ocean", "Ocean", null, false, null)));
        store.set(StoreCollection.TAXONOMY_ORDER, List.of("property", "category"));

        // 1 added token + 1 removed value type + 1 added theme + taxonomy order + 2 + 1 pending
        assertEquals(7, tracker.getChangeCount());
    }

    @Test
    void pendingChangesAloneCountAsLocalChanges() {
        ChangeTracker tracker = tracker(remote(true, true), PendingChanges.of(1, 0));
        tracker.captureBaseline();

        assertTrue(tracker.hasLocalChanges());
        assertEquals(1, tracker.getChangeCount());
        assertFalse(tracker.hasRemoteDivergence().join());
    }

    @Test
    void dimensionOrderAndModeEditsAreLocalChanges() {
        store.set(StoreCollection.DIMENSION_ORDER, List.of("color-scheme", "density"));
        store.set(StoreCollection.MODES, List.of(new Mode("light", "Light", null, "color-scheme")));
        ChangeTracker tracker = tracker(remote(true, true), PendingChanges.NONE);
        tracker.captureBaseline();
        assertFalse(tracker.hasLocalChanges());

        store.set(StoreCollection.DIMENSION_ORDER, List.of("density", "color-scheme"));
        assertTrue(tracker.hasLocalChanges());

        store.set(StoreCollection.DIMENSION_ORDER, List.of("color-scheme", "density"));
        store.set(StoreCollection.MODES, List.of(new Mode("light", "Day", null, "color-scheme")));
        assertTrue(tracker.hasLocalChanges());
    }

    @Test
    void divergenceNeedsSelectedSourceAndAuthentication() {
        ChangeTracker unselected = tracker(remote(true, false), PendingChanges.NONE);
        ChangeTracker anonymous = tracker(remote(false, true), PendingChanges.NONE);
        ChangeTracker connected = tracker(remote(true, true), PendingChanges.NONE);
        connected.captureBaseline();
        store.set(StoreCollection.TOKENS, List.of(t1("#111")));

        assertFalse(unselected.hasRemoteDivergence().join());
        assertFalse(anonymous.hasRemoteDivergence().join());
        assertTrue(connected.hasRemoteDivergence().join());
    }

    @Test
    void exportIsBlockedOnlyByLocalChangesThatDiverged() {
        ChangeTracker tracker = tracker(remote(true, true), PendingChanges.NONE);
        tracker.captureBaseline();

        ChangeTrackingState clean = tracker.getChangeTrackingState().join();
        assertFalse(clean.hasLocalChanges());
        assertTrue(clean.canExport());
        assertThat(clean.lastSync()).isNotNull();

        store.set(StoreCollection.TOKENS, List.of(t1("#111")));
        ChangeTrackingState dirty = tracker.getChangeTrackingState().join();
        assertTrue(dirty.hasLocalChanges());
        assertTrue(dirty.hasRemoteDivergence());
        assertFalse(dirty.canExport());

        ChangeTrackingState offline = tracker(RemoteContext.DISCONNECTED, PendingChanges.NONE)
                .getChangeTrackingState().join();
        assertTrue(offline.hasLocalChanges());
        assertFalse(offline.hasRemoteDivergence());
        assertTrue(offline.canExport());
    }

    @Test
    void sourceDiffComparesTopLevelFieldsAgainstTheSourceBaseline() {
        ChangeTracker tracker = tracker(remote(true, true), PendingChanges.NONE);
        CoreDocument core = SampleDocuments.core();
        SourceKey key = core.sourceKey();

        assertThat(tracker.diffSource(key, core).added()).contains("systemId", "tokens");

        tracker.captureSourceBaseline(key, core);
        assertTrue(tracker.hasSourceBaseline(key));
        assertTrue(tracker.diffSource(key, core).isEmpty());

        CoreDocument edited = SampleDocuments.core(List.of(SampleDocuments.primaryColor()));
        ChangeSet changes = tracker.diffSource(key, edited);
        assertThat(changes.modified()).containsExactly("tokens");
        assertEquals(1, changes.totalChanges());

        tracker.clearSourceBaseline(key);
        assertFalse(tracker.hasSourceBaseline(key));
    }
}
