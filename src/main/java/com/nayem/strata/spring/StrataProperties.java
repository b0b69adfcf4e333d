package com.nayem.strata.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the token layering engine.
 * <p>
 * Bound from {@code application.yml} under the {@code strata} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "strata")
@Validated
public class StrataProperties {

    /**
     * Upper bound for a single fetch or write through the network gateway.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration fetchTimeout = Duration.ofSeconds(30);

    /**
     * Branch used for source locations that do not name one.
     */
    @NotBlank
    private String defaultBranch = "main";

    /**
     * Maximum time to wait for the merge worker to drain during shutdown.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * How frequently to poll for shutdown completion.
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration shutdownPollingInterval = Duration.ofMillis(100);

    /**
     * Prefix for fetch and merge thread names.
     */
    private String threadNamePrefix = "strata-source-";

    @Valid
    private Store store = new Store();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Worker worker = new Worker();

    /**
     * Where the working copy and its baselines are kept.
     */
    public static class Store {
        /**
         * Storage backend: 'memory' (development) or 'redis' (shared).
         */
        @Pattern(regexp = "(?i)memory|redis")
        private String backend = "memory";

        /**
         * Prefix of every Redis key written by the store.
         */
        @NotBlank
        private String keyPrefix = "strata:";

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    /**
     * Cache of fetched source content.
     */
    public static class Cache {
        /**
         * How long fetched content is reused before it is fetched again.
         */
        @DurationUnit(ChronoUnit.MINUTES)
        private Duration ttl = Duration.ofMinutes(5);

        /**
         * Maximum cached files. Set to 0 for unbounded.
         */
        @Min(0)
        private long maxSize = 256;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }
    }

    /**
     * Limits of the merge worker.
     */
    public static class Worker {
        /**
         * Maximum queued layer mutations before new ones are rejected.
         */
        @Min(1)
        private int maxPendingUpdates = 1000;

        /**
         * Maximum coalesce iterations before detecting cyclic coalescing.
         */
        @Min(1)
        private int maxCoalesceIterations = 1000;

        public int getMaxPendingUpdates() {
            return maxPendingUpdates;
        }

        public void setMaxPendingUpdates(int maxPendingUpdates) {
            this.maxPendingUpdates = maxPendingUpdates;
        }

        public int getMaxCoalesceIterations() {
            return maxCoalesceIterations;
        }

        public void setMaxCoalesceIterations(int maxCoalesceIterations) {
            this.maxCoalesceIterations = maxCoalesceIterations;
        }
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    public void setDefaultBranch(String defaultBranch) {
        this.defaultBranch = defaultBranch;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getShutdownPollingInterval() {
        return shutdownPollingInterval;
    }

    public void setShutdownPollingInterval(Duration shutdownPollingInterval) {
        this.shutdownPollingInterval = shutdownPollingInterval;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }
}
