package com.nayem.strata.source;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for source loading and merging. A {@code null} registry
 * turns every recording into a no-op.
 */
public class SourceMetrics {

    private final Map<LinkStatus, AtomicLong> linksByStatus = new EnumMap<>(LinkStatus.class);
    private final Counter fetchCounter;
    private final Counter fetchFailureCounter;
    private final Counter cacheHitCounter;
    private final Counter staleResultCounter;
    private final Counter excludedLayerCounter;
    private final Counter policyViolationCounter;
    private final Timer mergeTimer;

    public SourceMetrics(MeterRegistry registry) {
        for (LinkStatus status : LinkStatus.values()) {
            linksByStatus.put(status, new AtomicLong());
        }

        if (registry != null) {
            linksByStatus.forEach((status, count) -> Gauge.builder("strata.source.links", count, AtomicLong::get)
                    .description("Number of source links by status")
                    .tag("status", status.name().toLowerCase())
                    .register(registry));

            this.fetchCounter = Counter.builder("strata.source.fetch")
                    .description("Source fetches issued to the network gateway")
                    .register(registry);
            this.fetchFailureCounter = Counter.builder("strata.source.fetch.failed")
                    .description("Source fetches that failed")
                    .register(registry);
            this.cacheHitCounter = Counter.builder("strata.source.cache.hits")
                    .description("Fetches served from the content cache")
                    .register(registry);
            this.staleResultCounter = Counter.builder("strata.source.stale")
                    .description("Fetch results discarded because a newer refresh or an unlink superseded them")
                    .register(registry);
            this.excludedLayerCounter = Counter.builder("strata.merge.excluded")
                    .description("Layers excluded from a merge")
                    .register(registry);
            this.policyViolationCounter = Counter.builder("strata.merge.policy.violations")
                    .description("Overrides skipped for violating a policy")
                    .register(registry);
            this.mergeTimer = Timer.builder("strata.merge.duration")
                    .description("Time to re-merge and publish the resolved view")
                    .register(registry);
        } else {
            this.fetchCounter = null;
            this.fetchFailureCounter = null;
            this.cacheHitCounter = null;
            this.staleResultCounter = null;
            this.excludedLayerCounter = null;
            this.policyViolationCounter = null;
            this.mergeTimer = null;
        }
    }

    public static SourceMetrics noOp() {
        return new SourceMetrics(null);
    }

    public void recordStatusChange(LinkStatus oldStatus, LinkStatus newStatus) {
        if (oldStatus != null) {
            linksByStatus.get(oldStatus).decrementAndGet();
        }
        if (newStatus != null) {
            linksByStatus.get(newStatus).incrementAndGet();
        }
    }

    public long linkCount(LinkStatus status) {
        return linksByStatus.get(status).get();
    }

    public void recordFetch() {
        if (fetchCounter != null) {
            fetchCounter.increment();
        }
    }

    public void recordFetchFailure() {
        if (fetchFailureCounter != null) {
            fetchFailureCounter.increment();
        }
    }

    public void recordCacheHit() {
        if (cacheHitCounter != null) {
            cacheHitCounter.increment();
        }
    }

    public void recordStaleResult() {
        if (staleResultCounter != null) {
            staleResultCounter.increment();
        }
    }

    public void recordMerge(long durationNanos, int excludedLayers, int policyViolations) {
        if (mergeTimer != null) {
            mergeTimer.record(durationNanos, TimeUnit.NANOSECONDS);
        }
        if (excludedLayerCounter != null && excludedLayers > 0) {
            excludedLayerCounter.increment(excludedLayers);
        }
        if (policyViolationCounter != null && policyViolations > 0) {
            policyViolationCounter.increment(policyViolations);
        }
    }
}
