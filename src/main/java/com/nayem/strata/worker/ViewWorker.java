package com.nayem.strata.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Serializes every change to one merged view.
 * <p>
 * At most one batch is processed at a time. Mutations submitted while a batch
 * is running coalesce into the next one, so the processor always sees the
 * full effect of everything submitted before it started.
 * </p>
 *
 * @param <S> the layer state type
 */
public class ViewWorker<S> {
    private static final Logger log = LoggerFactory.getLogger(ViewWorker.class);

    private final String viewKey;
    private final Consumer<CoalescingBatch<S>> processor;
    private final int maxPendingUpdates;
    private final int maxCoalesceIterations;
    private final ExecutorService executor;

    private final ReentrantLock lock = new ReentrantLock();
    private CoalescingBatch<S> pendingBatch;
    private volatile boolean isRunning;

    public ViewWorker(String viewKey, Consumer<CoalescingBatch<S>> processor, int maxPendingUpdates,
            ExecutorService executor) {
        this(viewKey, processor, maxPendingUpdates, 1000, executor);
    }

    public ViewWorker(String viewKey, Consumer<CoalescingBatch<S>> processor, int maxPendingUpdates,
            int maxCoalesceIterations, ExecutorService executor) {
        this.viewKey = viewKey;
        this.processor = processor;
        this.maxPendingUpdates = maxPendingUpdates;
        this.maxCoalesceIterations = maxCoalesceIterations;
        this.executor = executor;
    }

    public boolean isRunning() {
        return isRunning;
    }

    public String getViewKey() {
        return viewKey;
    }

    /**
     * Queues a mutation. Thread-safe, non-blocking.
     *
     * @return completes once the mutation has been applied, or exceptionally if
     *         it was rejected or the processor failed
     */
    public CompletableFuture<Void> submit(LayerMutation<S> mutation) {
        CompletableFuture<Void> future = new CompletableFuture<>();

        lock.lock();
        try {
            int pending = pendingBatch != null ? pendingBatch.getWaiters().size() : 0;
            if (pending >= maxPendingUpdates) {
                future.completeExceptionally(new RejectedExecutionException(
                        "Backpressure: too many pending updates for view " + viewKey));
                return future;
            }

            if (pendingBatch == null) {
                pendingBatch = new CoalescingBatch<>(mutation, maxPendingUpdates, maxCoalesceIterations);
            } else {
                try {
                    pendingBatch.add(mutation);
                } catch (IllegalStateException | IllegalArgumentException e) {
                    future.completeExceptionally(e);
                    return future;
                }
            }
            pendingBatch.addWaiter(future);

            if (!isRunning) {
                isRunning = true;
                try {
                    executor.execute(this::runLoop);
                } catch (RejectedExecutionException e) {
                    isRunning = false;
                    CoalescingBatch<S> orphaned = pendingBatch;
                    pendingBatch = null;
                    orphaned.getWaiters().forEach(waiter -> waiter.completeExceptionally(e));
                }
            }
        } finally {
            lock.unlock();
        }

        return future;
    }

    private void runLoop() {
        while (true) {
            CoalescingBatch<S> batchToProcess;

            lock.lock();
            try {
                if (pendingBatch == null) {
                    isRunning = false;
                    return;
                }
                batchToProcess = pendingBatch;
                pendingBatch = null;
            } finally {
                lock.unlock();
            }

            try {
                processor.accept(batchToProcess);
                batchToProcess.getWaiters().forEach(f -> f.complete(null));
            } catch (Exception e) {
                log.error("Failed to apply {} update(s) to view {}", batchToProcess.getBatchSize(), viewKey, e);
                batchToProcess.getWaiters().forEach(f -> f.completeExceptionally(e));
            }
        }
    }
}
