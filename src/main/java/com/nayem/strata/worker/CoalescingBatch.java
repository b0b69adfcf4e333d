package com.nayem.strata.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The queued work of one view: a single accumulated mutation and every caller
 * waiting for it to be applied. Holds at most {@code maxBatchSize} waiters and
 * fails after {@code maxCoalesceIterations} coalesces in a row that return the
 * same instance.
 *
 * @param <S> the layer state type
 */
public class CoalescingBatch<S> {
    private static final Logger log = LoggerFactory.getLogger(CoalescingBatch.class);

    private LayerMutation<S> accumulatedMutation;
    private final List<CompletableFuture<Void>> waiters;
    private final int maxBatchSize;
    private final int maxCoalesceIterations;
    private int coalescenceCount = 0;

    public CoalescingBatch(LayerMutation<S> initialMutation, int maxBatchSize, int maxCoalesceIterations) {
        this.accumulatedMutation = initialMutation;
        this.waiters = new ArrayList<>(1);
        this.maxBatchSize = maxBatchSize;
        this.maxCoalesceIterations = maxCoalesceIterations;
    }

    /**
     * Coalesces a later mutation into the accumulated one.
     *
     * @throws IllegalArgumentException if the mutation targets another view
     * @throws IllegalStateException    if the batch is full or coalescing cycles
     */
    public void add(LayerMutation<S> newMutation) {
        if (!accumulatedMutation.getViewKey().equals(newMutation.getViewKey())) {
            throw new IllegalArgumentException("Cannot coalesce mutations of different views");
        }

        if (waiters.size() >= maxBatchSize) {
            throw new IllegalStateException(String.format(
                    "Batch size limit exceeded (%d). Consider increasing strata.worker.max-pending-updates.",
                    maxBatchSize));
        }

        LayerMutation<S> previous = this.accumulatedMutation;
        LayerMutation<S> coalesced = previous.coalesce(newMutation);

        if (coalesced == previous) {
            coalescenceCount++;
            if (coalescenceCount >= maxCoalesceIterations) {
                log.error("Cyclic coalescing detected for view '{}' after {} consecutive same-instance returns. "
                                + "Mutation class: {}.",
                        previous.getViewKey(), coalescenceCount, previous.getClass().getName());
                throw new IllegalStateException(String.format(
                        "Cyclic coalescing detected after %d consecutive same-instance returns for view '%s'",
                        maxCoalesceIterations, previous.getViewKey()));
            }
        } else {
            coalescenceCount = 0;
        }

        this.accumulatedMutation = coalesced;
    }

    public void addWaiter(CompletableFuture<Void> future) {
        this.waiters.add(future);
    }

    public LayerMutation<S> getAccumulatedMutation() {
        return accumulatedMutation;
    }

    public List<CompletableFuture<Void>> getWaiters() {
        return waiters;
    }

    public int getBatchSize() {
        return waiters.size();
    }
}
