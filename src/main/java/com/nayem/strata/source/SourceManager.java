package com.nayem.strata.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.nayem.strata.merge.MergeEngine;
import com.nayem.strata.merge.MergeIssue;
import com.nayem.strata.merge.MergeResult;
import com.nayem.strata.merge.MergedView;
import com.nayem.strata.model.CoreDocument;
import com.nayem.strata.model.DocumentCodec;
import com.nayem.strata.model.SourceDocument;
import com.nayem.strata.model.SourceKey;
import com.nayem.strata.store.BaselineSnapshot;
import com.nayem.strata.store.DocumentStore;
import com.nayem.strata.store.InMemoryDocumentStore;
import com.nayem.strata.store.StoreCollection;
import com.nayem.strata.tracking.RemoteContext;
import com.nayem.strata.tracking.SourceBaselines;
import com.nayem.strata.validation.SchemaValidator;
import com.nayem.strata.validation.ValidationError;
import com.nayem.strata.validation.ValidationResult;
import com.nayem.strata.worker.CoalescingBatch;
import com.nayem.strata.worker.FunctionalLayerMutation;
import com.nayem.strata.worker.ViewWorker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Links sources to repository files and keeps the published view in step with
 * them.
 * <p>
 * Fetches run on a shared executor. Everything after a fetch (validation,
 * storing the layer, re-merging, publishing) is submitted to a single
 * {@link ViewWorker}, so merges never interleave and the store only ever sees
 * the result of a complete merge. Every link or refresh takes a new
 * generation; a result whose generation has been superseded, or whose source
 * was unlinked meanwhile, is dropped.
 * </p>
 */
public class SourceManager implements RemoteContext, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SourceManager.class);

    static final String VIEW_KEY = "resolved-view";

    interface Codes {
        String UNAVAILABLE = "source.unavailable";
        String IDENTITY_MISMATCH = "source.identity_mismatch";
    }

    private final NetworkGateway gateway;
    private final DocumentStore store;
    private final SchemaValidator validator;
    private final MergeEngine mergeEngine;
    private final SourceBaselines sourceBaselines;
    private final DocumentCodec codec;
    private final SourceMetrics metrics;
    private final Duration fetchTimeout;
    private final String defaultBranch;
    private final Duration shutdownTimeout;
    private final Duration shutdownPollingInterval;
    private final ExecutorService executor;

    private final Cache<String, String> contentCache;
    private final SingleFlightGroup<String> flights;
    private final ViewWorker<LayerState> worker;
    private final LayerState state = new LayerState();
    private final ConcurrentHashMap<SourceKey, SourceLink> links = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private volatile MergeResult lastMerge;
    // set by loads and unlinks, read and cleared by the merge worker
    private volatile boolean layersReloaded;

    private SourceManager(Builder builder, ExecutorService executor) {
        this.gateway = builder.gateway;
        this.store = builder.store;
        this.codec = builder.codec;
        this.validator = builder.validator != null ? builder.validator : new SchemaValidator(codec.mapper());
        this.mergeEngine = builder.mergeEngine;
        this.sourceBaselines = builder.sourceBaselines;
        this.metrics = new SourceMetrics(builder.registry);
        this.fetchTimeout = builder.fetchTimeout;
        this.defaultBranch = builder.defaultBranch;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.shutdownPollingInterval = builder.shutdownPollingInterval;
        this.executor = executor;

        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder().expireAfterWrite(builder.cacheTtl);
        if (builder.cacheMaxSize > 0) {
            cacheBuilder.maximumSize(builder.cacheMaxSize);
        }
        this.contentCache = cacheBuilder.build();
        this.flights = new SingleFlightGroup<>(executor);
        this.worker = new ViewWorker<>(VIEW_KEY, this::process, builder.maxPendingUpdates,
                builder.maxCoalesceIterations, executor);
    }

    /**
     * Links a source to a file and loads it. Linking an already linked source
     * replaces its location and reloads it.
     *
     * @return completes with the link once the loaded content has been merged,
     *         or with the link as it stood when the result was discarded
     */
    public CompletableFuture<SourceLink> link(SourceKey key, SourceLocation location) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(location, "location");
        SourceLink loading = SourceLink.loading(key, location.withDefaultBranch(defaultBranch),
                generations.incrementAndGet());
        SourceLink previous = links.put(key, loading);
        metrics.recordStatusChange(previous == null ? null : previous.status(), LinkStatus.LOADING);
        log.debug("Loading {} from {} (generation {})", key, loading.location(), loading.generation());
        return load(loading);
    }

    /**
     * Reloads a linked source, bypassing the content cache. A fetch still in
     * flight for it is cancelled.
     */
    public CompletableFuture<SourceLink> refresh(SourceKey key) {
        SourceLink current = links.get(key);
        if (current == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Source is not linked: " + key));
        }
        String cacheKey = cacheKey(key, current.location());
        flights.cancel(cacheKey);
        contentCache.invalidate(cacheKey);
        return link(key, current.location());
    }

    /**
     * Removes a source with its cached content, its layer and its baseline, then
     * re-merges what is left. Unlinking the core leaves the published view as
     * it is.
     */
    public CompletableFuture<Void> unlink(SourceKey key) {
        SourceLink removed = links.remove(key);
        if (removed == null) {
            return CompletableFuture.completedFuture(null);
        }
        metrics.recordStatusChange(removed.status(), null);
        String cacheKey = cacheKey(key, removed.location());
        flights.cancel(cacheKey);
        contentCache.invalidate(cacheKey);
        return worker.submit(FunctionalLayerMutation.of(VIEW_KEY, layers -> {
            layers.remove(key);
            sourceBaselines.remove(key);
            layersReloaded = true;
            log.info("Unlinked {}", key);
        }));
    }

    /**
     * Writes a document back to the file its source is linked to, then reloads
     * the source from what was written.
     *
     * @throws IllegalArgumentException (through the future) if the source is
     *                                  not linked or the document belongs to
     *                                  another source
     */
    public CompletableFuture<SourceLink> persist(SourceKey key, SourceDocument document, String message) {
        SourceLink current = links.get(key);
        if (current == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Source is not linked: " + key));
        }
        if (!document.sourceKey().equals(key)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Document of " + document.sourceKey() + " cannot be persisted to " + key));
        }
        SourceLocation location = current.location();
        String content = codec.toJson(document);
        return gateway.writeFile(location.repositoryUri(), location.filePath(), location.branch(), content, message)
                .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw new SourceUnavailableException(key, "Failed to write " + location + ": "
                                + unwrap(error).getMessage(), unwrap(error));
                    }
                    log.info("Persisted {} to {}", key, location);
                    contentCache.put(cacheKey(key, location), content);
                    return location;
                })
                .thenCompose(written -> link(key, written));
    }

    /**
     * Selects the platform and theme the published view is resolved for.
     * {@code null} means every platform and the core's default theme.
     */
    public CompletableFuture<Optional<MergeResult>> viewThrough(String platformId, String themeId) {
        return worker.submit(FunctionalLayerMutation.of(VIEW_KEY, layers -> {
            layers.lens(platformId, themeId);
            log.info("Viewing through platform={} theme={}", platformId, themeId);
        })).thenApply(ignored -> getLastMerge());
    }

    public Optional<SourceLink> getLink(SourceKey key) {
        return Optional.ofNullable(links.get(key));
    }

    public List<SourceLink> getLinks() {
        return List.copyOf(links.values());
    }

    public Optional<MergeResult> getLastMerge() {
        return Optional.ofNullable(lastMerge);
    }

    /**
     * The last valid document loaded for a source.
     */
    public Optional<SourceDocument> getDocument(SourceKey key) {
        return state.document(key);
    }

    public SourceMetrics getMetrics() {
        return metrics;
    }

    @Override
    public CompletableFuture<Boolean> isAuthenticated() {
        return gateway.isAuthenticated();
    }

    @Override
    public boolean hasSelectedSource() {
        return !links.isEmpty();
    }

    private CompletableFuture<SourceLink> load(SourceLink link) {
        return fetch(link)
                .handle((content, error) -> error == null
                        ? FunctionalLayerMutation.<LayerState>of(VIEW_KEY, layers -> accept(link, content, layers))
                        : FunctionalLayerMutation.<LayerState>of(VIEW_KEY, layers -> reject(link, unwrap(error), layers)))
                .thenCompose(worker::submit)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("Could not apply result for {}: {}", link.key(), unwrap(error).getMessage());
                        transition(link.failed(unwrap(error).getMessage()));
                    }
                })
                .thenApply(ignored -> links.getOrDefault(link.key(), link));
    }

    private CompletableFuture<String> fetch(SourceLink link) {
        String cacheKey = cacheKey(link.key(), link.location());
        String cached = contentCache.getIfPresent(cacheKey);
        if (cached != null) {
            metrics.recordCacheHit();
            return CompletableFuture.completedFuture(cached);
        }
        return flights.doCall(cacheKey, () -> {
            metrics.recordFetch();
            String content = download(link.key(), link.location());
            contentCache.put(cacheKey, content);
            return content;
        });
    }

    private String download(SourceKey key, SourceLocation location) {
        try {
            RemoteFile file = gateway.fetchFile(location.repositoryUri(), location.filePath(), location.branch())
                    .get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (file == null || file.content() == null) {
                throw new SourceUnavailableException(key, "Empty response for " + location);
            }
            return file.content();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(key, "Interrupted while fetching " + location, e);
        } catch (ExecutionException e) {
            metrics.recordFetchFailure();
            throw new SourceUnavailableException(key, "Failed to fetch " + location + ": "
                    + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            metrics.recordFetchFailure();
            throw new SourceUnavailableException(key, "Timed out after " + fetchTimeout.toMillis()
                    + "ms fetching " + location, e);
        }
    }

    private void accept(SourceLink link, String content, LayerState layers) {
        if (isStale(link)) {
            return;
        }
        ValidationResult<? extends SourceDocument> result = validator.validate(link.key().type(), content);
        if (result.isValid() && !result.value().sourceKey().equals(link.key())) {
            result = ValidationResult.invalid(List.of(new ValidationError(Codes.IDENTITY_MISMATCH, "",
                    "document belongs to " + result.value().sourceKey() + ", not " + link.key())));
        }
        layers.put(link.key(), result);
        layersReloaded = true;
        if (result.isValid()) {
            sourceBaselines.put(link.key(), codec.toTree(result.value()));
            transition(link.synced());
            log.info("Loaded {} from {}", link.key(), link.location());
        } else {
            log.warn("{} failed validation with {} error(s), first: {}", link.key(), result.errors().size(),
                    result.errors().get(0));
            transition(link.failed(describe(result.errors())));
        }
    }

    private void reject(SourceLink link, Throwable error, LayerState layers) {
        if (isStale(link)) {
            return;
        }
        layers.put(link.key(), ValidationResult.invalid(List.of(
                new ValidationError(Codes.UNAVAILABLE, "", error.getMessage()))));
        layersReloaded = true;
        log.warn("Could not load {}: {}", link.key(), error.getMessage());
        transition(link.failed(error.getMessage()));
    }

    private boolean isStale(SourceLink link) {
        SourceLink current = links.get(link.key());
        if (current == null || current.generation() != link.generation()) {
            metrics.recordStaleResult();
            log.debug("Discarding result of generation {} for {}", link.generation(), link.key());
            return true;
        }
        return false;
    }

    private void transition(SourceLink next) {
        SourceLink[] replaced = new SourceLink[1];
        links.computeIfPresent(next.key(), (key, current) -> {
            if (current.generation() != next.generation()) {
                return current;
            }
            replaced[0] = current;
            return next;
        });
        if (replaced[0] != null) {
            metrics.recordStatusChange(replaced[0].status(), next.status());
        }
    }

    private void process(CoalescingBatch<LayerState> batch) {
        batch.getAccumulatedMutation().apply(state);
        boolean reloaded = layersReloaded;
        layersReloaded = false;
        remerge(reloaded);
    }

    /**
     * Merges every layer and publishes the result. The global baseline is only
     * replaced when a source was loaded or unlinked, never on a lens switch.
     */
    private void remerge(boolean captureBaseline) {
        Optional<CoreDocument> core = state.core();
        if (core.isEmpty()) {
            log.debug("No valid core linked, keeping the published view");
            return;
        }
        long start = System.nanoTime();
        MergeResult result = mergeEngine.mergeCandidates(core.get(), state.extensionCandidates(),
                state.themeCandidate(), state.mergeOptions());
        publish(result.resolved());
        if (captureBaseline || store.getBaseline().isEmpty()) {
            store.setBaseline(BaselineSnapshot.of(store.snapshot()));
        }
        lastMerge = result;
        reconcile(result);
        metrics.recordMerge(System.nanoTime() - start, result.excludedSources().size(),
                result.policyViolations().size());
        log.info("Published merged view: {} tokens, {} platform(s), {} excluded layer(s)",
                result.analytics().totalTokens(), result.analytics().platformCount(),
                result.excludedSources().size());
    }

    private void publish(MergedView view) {
        store.set(StoreCollection.TOKENS, view.tokens());
        store.set(StoreCollection.COLLECTIONS, view.tokenCollections());
        store.set(StoreCollection.MODES, view.modes());
        store.set(StoreCollection.DIMENSIONS, view.dimensions());
        store.set(StoreCollection.PLATFORMS, view.platforms());
        store.set(StoreCollection.THEMES, view.themes());
        store.set(StoreCollection.TAXONOMIES, view.taxonomies());
        store.set(StoreCollection.ALGORITHMS, view.algorithms());
        store.set(StoreCollection.VALUE_TYPES, view.valueTypes());
        store.set(StoreCollection.TAXONOMY_ORDER, view.taxonomyOrder());
        store.set(StoreCollection.DIMENSION_ORDER, view.dimensionOrder());
    }

    // A schema-valid layer can still be excluded by its reference check.
    private void reconcile(MergeResult result) {
        Set<SourceKey> excluded = result.excludedSources();
        for (SourceLink link : links.values()) {
            if (state.document(link.key()).isEmpty()) {
                continue;
            }
            boolean isExcluded = excluded.contains(link.key());
            if (isExcluded && link.status() == LinkStatus.SYNCED) {
                transition(link.failed(describe(result.issues().stream()
                        .filter(issue -> issue.source().equals(link.key()))
                        .map(MergeIssue::problem)
                        .map(Object::toString)
                        .toList())));
            } else if (!isExcluded && link.status() == LinkStatus.ERROR) {
                transition(link.synced());
            }
        }
    }

    private static String describe(List<?> problems) {
        if (problems.isEmpty()) {
            return "excluded";
        }
        String first = problems.get(0).toString();
        return problems.size() == 1 ? first : first + " (and " + (problems.size() - 1) + " more)";
    }

    private static String cacheKey(SourceKey key, SourceLocation location) {
        return key + "@" + location;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        shutdown();
    }

    public void shutdown() {
        log.info("SourceManager shutting down, draining the merge worker...");

        long start = System.currentTimeMillis();
        long timeoutMs = shutdownTimeout.toMillis();
        long pollingMs = shutdownPollingInterval.toMillis();

        while (worker.isRunning() && System.currentTimeMillis() - start < timeoutMs) {
            try {
                TimeUnit.MILLISECONDS.sleep(pollingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted with the merge worker still active");
                break;
            }
        }

        if (worker.isRunning()) {
            log.error("Shutdown timeout ({}ms) exceeded with merge work pending. Forcing shutdown.", timeoutMs);
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in 5 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        log.info("SourceManager shutdown complete. {} link(s) were active: {}", links.size(),
                links.keySet().stream().map(SourceKey::toString).collect(Collectors.joining(", ")));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating a {@link SourceManager}.
     * <p>
     * Only the network gateway is required. The store defaults to an in-memory
     * one and metrics are off without a registry.
     * </p>
     */
    public static class Builder {
        private NetworkGateway gateway;
        private DocumentStore store = new InMemoryDocumentStore();
        private SchemaValidator validator;
        private MergeEngine mergeEngine = new MergeEngine();
        private SourceBaselines sourceBaselines = new SourceBaselines();
        private DocumentCodec codec = new DocumentCodec();
        private MeterRegistry registry;
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private Duration cacheTtl = Duration.ofMinutes(5);
        private long cacheMaxSize = 256;
        private String defaultBranch = "main";
        private int maxPendingUpdates = 1000;
        private int maxCoalesceIterations = 1000;
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private Duration shutdownPollingInterval = Duration.ofMillis(100);
        private String threadNamePrefix = "strata-source-";
        private ExecutorService executor;

        public Builder gateway(NetworkGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder store(DocumentStore store) {
            this.store = store;
            return this;
        }

        public Builder validator(SchemaValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder mergeEngine(MergeEngine mergeEngine) {
            this.mergeEngine = mergeEngine;
            return this;
        }

        /**
         * Shares per-source baselines with a change tracker.
         */
        public Builder sourceBaselines(SourceBaselines sourceBaselines) {
            this.sourceBaselines = sourceBaselines;
            return this;
        }

        public Builder codec(DocumentCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder metrics(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Bounds every fetch and write. Default is 30 seconds.
         */
        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        /**
         * Set to 0 for an unbounded content cache. Default is 256 entries.
         */
        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        /**
         * Branch used for locations that do not name one. Default is "main".
         */
        public Builder defaultBranch(String defaultBranch) {
            this.defaultBranch = defaultBranch;
            return this;
        }

        public Builder maxPendingUpdates(int maxPendingUpdates) {
            this.maxPendingUpdates = maxPendingUpdates;
            return this;
        }

        public Builder maxCoalesceIterations(int maxCoalesceIterations) {
            this.maxCoalesceIterations = maxCoalesceIterations;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder shutdownPollingInterval(Duration shutdownPollingInterval) {
            this.shutdownPollingInterval = shutdownPollingInterval;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        /**
         * Runs fetches and merges on the given executor instead of an owned
         * cached pool. It is shut down with the manager.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * @throws IllegalStateException if no gateway is set
         */
        public SourceManager build() {
            if (gateway == null) {
                throw new IllegalStateException("A NetworkGateway is required.");
            }
            ExecutorService executorService = executor;
            if (executorService == null) {
                AtomicInteger counter = new AtomicInteger();
                executorService = Executors.newCachedThreadPool(runnable -> {
                    Thread thread = new Thread(runnable, threadNamePrefix + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
            }
            return new SourceManager(this, executorService);
        }
    }
}
