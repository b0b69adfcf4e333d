package com.nayem.strata.source;

import com.nayem.strata.SampleDocuments;
import com.nayem.strata.merge.MergeResult;
import com.nayem.strata.model.DocumentCodec;
import com.nayem.strata.model.PlatformExtensionDocument;
import com.nayem.strata.model.SourceKey;
import com.nayem.strata.model.ThemeOverrideDocument;
import com.nayem.strata.model.ThemeTokenOverride;
import com.nayem.strata.model.Token;
import com.nayem.strata.model.TokenOverride;
import com.nayem.strata.model.TokenValue;
import com.nayem.strata.store.BaselineSnapshot;
import com.nayem.strata.store.InMemoryDocumentStore;
import com.nayem.strata.store.StoreCollection;
import com.nayem.strata.tracking.SourceBaselines;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.nayem.strata.SampleDocuments.value;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceManagerTest {

    private static final String REPO = "https://git.example.com/acme/tokens";
    private static final SourceKey CORE = SourceKey.core(SampleDocuments.SYSTEM_ID);
    private static final SourceKey IOS = SourceKey.platform("ios");
    private static final SourceKey WEB = SourceKey.platform("web");
    private static final SourceKey OCEAN = SourceKey.theme("ocean");

    private final DocumentCodec codec = new DocumentCodec();
    private RecordingGateway gateway;
    private InMemoryDocumentStore store;
    private SourceBaselines sourceBaselines;
    private SimpleMeterRegistry registry;
    private SourceManager manager;

    /**
     * Serves files from memory. A path can be made to fail or to hang until
     * completed by the test.
     */
    static class RecordingGateway implements NetworkGateway {
        final Map<String, String> files = new ConcurrentHashMap<>();
        final Map<String, CompletableFuture<RemoteFile>> held = new ConcurrentHashMap<>();
        final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
        final List<String> writes = new CopyOnWriteArrayList<>();
        final Set<String> branches = ConcurrentHashMap.newKeySet();

        @Override
        public CompletableFuture<RemoteFile> fetchFile(String repositoryUri, String filePath, String branch) {
            fetches.computeIfAbsent(filePath, path -> new AtomicInteger()).incrementAndGet();
            branches.add(branch);
            CompletableFuture<RemoteFile> pending = held.remove(filePath);
            if (pending != null) {
                return pending;
            }
            String content = files.get(filePath);
            if (content == null) {
                return CompletableFuture.failedFuture(new IOException("404 Not Found: " + filePath));
            }
            return CompletableFuture.completedFuture(RemoteFile.of(content));
        }

        @Override
        public CompletableFuture<Void> writeFile(String repositoryUri, String filePath, String branch,
                String content, String message) {
            files.put(filePath, content);
            writes.add(filePath + ":" + message);
            return CompletableFuture.completedFuture(null);
        }

        int fetchCount(String filePath) {
            AtomicInteger count = fetches.get(filePath);
            return count == null ? 0 : count.get();
        }
    }

    private static SourceLocation at(String filePath) {
        return new SourceLocation(REPO, null, filePath);
    }

    private static PlatformExtensionDocument iosExtension(String light) {
        return PlatformExtensionDocument.of(SampleDocuments.SYSTEM_ID, "ios",
                List.of(TokenOverride.values("color.primary", List.of(value("light", light)))));
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private TokenValue publishedLight(String tokenId) {
        Token token = store.get(StoreCollection.TOKENS).stream()
                .filter(candidate -> candidate.id().equals(tokenId))
                .findFirst()
                .orElseThrow();
        return token.valueFor(Set.of("light")).value();
    }

    @BeforeEach
    void setUp() {
        gateway = new RecordingGateway();
        gateway.files.put("core.json", codec.toJson(SampleDocuments.core()));
        gateway.files.put("ios.json", codec.toJson(iosExtension("#111111")));
        store = new InMemoryDocumentStore();
        sourceBaselines = new SourceBaselines();
        registry = new SimpleMeterRegistry();
        manager = SourceManager.builder()
                .gateway(gateway)
                .store(store)
                .sourceBaselines(sourceBaselines)
                .metrics(registry)
                .build();
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void linkingCoreAndExtensionPublishesTheMergedView() throws Exception {
        SourceLink core = await(manager.link(CORE, at("core.json")));
        assertEquals(LinkStatus.SYNCED, core.status());
        assertEquals(SampleDocuments.text("#0055ff"), publishedLight("color.primary"));

        SourceLink ios = await(manager.link(IOS, at("ios.json")));

        assertEquals(LinkStatus.SYNCED, ios.status());
        assertEquals(SampleDocuments.text("#111111"), publishedLight("color.primary"));
        assertThat(store.get(StoreCollection.DIMENSION_ORDER)).containsExactly("color-scheme", "density");
        assertThat(store.get(StoreCollection.MODES)).hasSize(4);
        assertTrue(store.getBaseline().isPresent());
        assertTrue(sourceBaselines.contains(CORE));
        assertTrue(sourceBaselines.contains(IOS));
        assertEquals(2, manager.getMetrics().linkCount(LinkStatus.SYNCED));
        assertTrue(manager.hasSelectedSource());
    }

    @Test
    void missingBranchFallsBackToTheDefault() throws Exception {
        SourceLink core = await(manager.link(CORE, at("core.json")));

        assertEquals("main", core.location().branch());
        assertThat(gateway.branches).containsExactly("main");
    }

    @Test
    void failedExtensionIsExcludedWhileTheRestPublishes() throws Exception {
        await(manager.link(CORE, at("core.json")));
        await(manager.link(IOS, at("ios.json")));

        SourceLink web = await(manager.link(WEB, at("web.json")));

        assertEquals(LinkStatus.ERROR, web.status());
        assertThat(web.error()).contains("404 Not Found");
        MergeResult merge = manager.getLastMerge().orElseThrow();
        assertThat(merge.excludedSources()).containsExactly(WEB);
        assertEquals(SampleDocuments.text("#111111"), publishedLight("color.primary"));
        assertEquals(LinkStatus.SYNCED, manager.getLink(IOS).orElseThrow().status());
        assertEquals(1.0, registry.get("strata.source.fetch.failed").counter().count());
    }

    @Test
    void documentForAnotherSourceIsRejected() throws Exception {
        await(manager.link(CORE, at("core.json")));

        SourceLink web = await(manager.link(WEB, at("ios.json")));

        assertEquals(LinkStatus.ERROR, web.status());
        assertThat(web.error()).contains(SourceManager.Codes.IDENTITY_MISMATCH);
        assertTrue(manager.getDocument(WEB).isEmpty());
        assertFalse(sourceBaselines.contains(WEB));
    }

    @Test
    void invalidDocumentLeavesTheLinkInError() throws Exception {
        gateway.files.put("broken.json", "{\"systemId\": 42");

        SourceLink core = await(manager.link(CORE, at("broken.json")));

        assertEquals(LinkStatus.ERROR, core.status());
        assertTrue(manager.getLastMerge().isEmpty());
        assertThat(store.get(StoreCollection.TOKENS)).isEmpty();
    }

    @Test
    void unlinkingAnExtensionRemovesItsLayerAndBaseline() throws Exception {
        await(manager.link(CORE, at("core.json")));
        await(manager.link(IOS, at("ios.json")));

        await(manager.unlink(IOS));

        assertTrue(manager.getLink(IOS).isEmpty());
        assertTrue(manager.getDocument(IOS).isEmpty());
        assertFalse(sourceBaselines.contains(IOS));
        assertEquals(SampleDocuments.text("#0055ff"), publishedLight("color.primary"));
        assertEquals(1, manager.getMetrics().linkCount(LinkStatus.SYNCED));
    }

    @Test
    void unlinkingTheCoreKeepsThePublishedView() throws Exception {
        await(manager.link(CORE, at("core.json")));

        await(manager.unlink(CORE));

        assertFalse(manager.hasSelectedSource());
        assertThat(store.get(StoreCollection.TOKENS)).hasSize(3);
    }

    @Test
    void resultOfAnOlderLinkIsDiscarded() throws Exception {
        await(manager.link(CORE, at("core.json")));
        CompletableFuture<RemoteFile> slow = new CompletableFuture<>();
        gateway.held.put("ios-old.json", slow);

        CompletableFuture<SourceLink> first = manager.link(IOS, at("ios-old.json"));
        SourceLink second = await(manager.link(IOS, at("ios.json")));
        slow.complete(RemoteFile.of(codec.toJson(iosExtension("#999999"))));
        SourceLink firstOutcome = await(first);

        assertEquals(second.generation(), firstOutcome.generation());
        assertEquals("ios.json", firstOutcome.location().filePath());
        assertEquals(SampleDocuments.text("#111111"), publishedLight("color.primary"));
        assertEquals(1.0, registry.get("strata.source.stale").counter().count());
    }

    @Test
    void repeatedLinksAreServedFromTheCacheUntilRefreshed() throws Exception {
        await(manager.link(CORE, at("core.json")));
        await(manager.link(CORE, at("core.json")));
        assertEquals(1, gateway.fetchCount("core.json"));

        await(manager.refresh(CORE));

        assertEquals(2, gateway.fetchCount("core.json"));
        assertEquals(1.0, registry.get("strata.source.cache.hits").counter().count());
    }

    @Test
    void refreshOfAnUnlinkedSourceFails() {
        assertThatThrownBy(() -> await(manager.refresh(IOS)))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void persistWritesThenReloadsFromWhatWasWritten() throws Exception {
        await(manager.link(CORE, at("core.json")));
        await(manager.link(IOS, at("ios.json")));

        SourceLink persisted = await(manager.persist(IOS, iosExtension("#222222"), "Darken primary on iOS"));

        assertEquals(LinkStatus.SYNCED, persisted.status());
        assertThat(gateway.writes).containsExactly("ios.json:Darken primary on iOS");
        assertEquals(1, gateway.fetchCount("ios.json"));
        assertEquals(iosExtension("#222222"), manager.getDocument(IOS).orElseThrow());
        assertEquals(SampleDocuments.text("#222222"), publishedLight("color.primary"));
    }

    @Test
    void persistRejectsForeignOrUnlinkedTargets() throws Exception {
        await(manager.link(CORE, at("core.json")));

        assertThatThrownBy(() -> await(manager.persist(IOS, iosExtension("#222222"), "msg")))
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> await(manager.persist(CORE, iosExtension("#222222"), "msg")))
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(gateway.writes).isEmpty();
    }

    @Test
    void viewingThroughAThemeAppliesItsOverride() throws Exception {
        gateway.files.put("ocean.json", codec.toJson(ThemeOverrideDocument.of(SampleDocuments.SYSTEM_ID, "ocean",
                List.of(new ThemeTokenOverride("color.primary", List.of(value("light", "#003399")))))));
        await(manager.link(CORE, at("core.json")));
        await(manager.link(OCEAN, at("ocean.json")));

        assertEquals(SampleDocuments.text("#0055ff"), publishedLight("color.primary"));

        MergeResult merge = await(manager.viewThrough(null, "ocean")).orElseThrow();

        assertEquals(SampleDocuments.text("#003399"), merge.resolved().token("color.primary")
                .valueFor(Set.of("light")).value());
        assertEquals(SampleDocuments.text("#003399"), publishedLight("color.primary"));
    }

    @Test
    void lensSwitchKeepsTheBaselineWhileLoadsReplaceIt() throws Exception {
        await(manager.link(CORE, at("core.json")));
        await(manager.link(IOS, at("ios.json")));
        BaselineSnapshot loaded = store.getBaseline().orElseThrow();

        await(manager.viewThrough("web", null));

        assertSame(loaded, store.getBaseline().orElseThrow());
        assertEquals(SampleDocuments.text("#0055ff"), publishedLight("color.primary"));

        await(manager.unlink(IOS));

        assertNotSame(loaded, store.getBaseline().orElseThrow());
        assertEquals(store.snapshot(), store.getBaseline().orElseThrow().data());
    }

    @Test
    void viewingThroughAPlatformFiltersOtherExtensions() throws Exception {
        await(manager.link(CORE, at("core.json")));
        await(manager.link(IOS, at("ios.json")));

        await(manager.viewThrough("web", null));

        assertEquals(SampleDocuments.text("#0055ff"), publishedLight("color.primary"));
    }

    @Test
    void builderRequiresAGateway() {
        assertThatThrownBy(() -> SourceManager.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("NetworkGateway");
    }
}
