package com.nayem.strata.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * ViewWorker edge cases: backpressure, coalescing while busy, processor
 * failures and running status.
 */
class ViewWorkerTest {

    private ExecutorService executor;
    private List<String> applied;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        applied = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Consumer<CoalescingBatch<List<String>>> applyingTo(List<String> state) {
        return batch -> batch.getAccumulatedMutation().apply(state);
    }

    private static LayerMutation<List<String>> adding(String layer) {
        return FunctionalLayerMutation.of("view", state -> state.add(layer));
    }

    @Test
    void testBackpressureEnforcement() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Consumer<CoalescingBatch<List<String>>> blocking = batch -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        ViewWorker<List<String>> worker = new ViewWorker<>("view", blocking, 3, executor);
        worker.submit(adding("core"));
        assertTrue(started.await(1, TimeUnit.SECONDS));

        List<CompletableFuture<Void>> queued = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            queued.add(worker.submit(adding("platform-" + i)));
        }

        CompletableFuture<Void> rejected = worker.submit(adding("theme"));
        ExecutionException exception = assertThrows(ExecutionException.class, rejected::get);
        assertTrue(exception.getCause() instanceof RejectedExecutionException);
        assertTrue(exception.getCause().getMessage().contains("Backpressure"));

        release.countDown();
        CompletableFuture.allOf(queued.toArray(CompletableFuture[]::new)).get(2, TimeUnit.SECONDS);
    }

    @Test
    void testMutationsQueuedWhileBusyAreAppliedInOrderInOneBatch() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        Consumer<CoalescingBatch<List<String>>> processor = batch -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            batchSizes.add(batch.getBatchSize());
            batch.getAccumulatedMutation().apply(applied);
        };

        ViewWorker<List<String>> worker = new ViewWorker<>("view", processor, 100, executor);
        CompletableFuture<Void> first = worker.submit(adding("core"));
        assertTrue(started.await(1, TimeUnit.SECONDS));

        CompletableFuture<Void> second = worker.submit(adding("ios"));
        CompletableFuture<Void> third = worker.submit(adding("web"));
        release.countDown();

        CompletableFuture.allOf(first, second, third).get(2, TimeUnit.SECONDS);
        assertEquals(List.of("core", "ios", "web"), applied);
        assertEquals(List.of(1, 2), batchSizes);
    }

    @Test
    void testProcessorExceptionPropagation() {
        RuntimeException failure = new RuntimeException("merge failed");
        ViewWorker<List<String>> worker = new ViewWorker<>("view", batch -> {
            throw failure;
        }, 1000, executor);

        CompletableFuture<Void> future = worker.submit(adding("core"));

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> future.get(2, TimeUnit.SECONDS));
        assertEquals(failure, exception.getCause());
    }

    @Test
    void testWorkerRecoversAfterProcessorFailure() throws Exception {
        ViewWorker<List<String>> worker = new ViewWorker<>("view", applyingTo(applied), 1000, executor);

        CompletableFuture<Void> failed = worker.submit(FunctionalLayerMutation.of("view", state -> {
            throw new IllegalStateException("bad layer");
        }));
        assertThrows(ExecutionException.class, () -> failed.get(2, TimeUnit.SECONDS));

        worker.submit(adding("core")).get(2, TimeUnit.SECONDS);
        assertEquals(List.of("core"), applied);
    }

    @Test
    void testMutationForAnotherViewIsRejected() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ViewWorker<List<String>> worker = new ViewWorker<>("view", batch -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, 1000, executor);

        worker.submit(adding("core"));
        assertTrue(started.await(1, TimeUnit.SECONDS));
        worker.submit(adding("ios"));

        CompletableFuture<Void> foreign = worker.submit(FunctionalLayerMutation.of("other", state -> {
        }));
        ExecutionException exception = assertThrows(ExecutionException.class, foreign::get);
        assertTrue(exception.getCause() instanceof IllegalArgumentException);
        release.countDown();
    }

    @Test
    void testRunningStatus() throws Exception {
        CountDownLatch processingStarted = new CountDownLatch(1);
        CountDownLatch allowComplete = new CountDownLatch(1);
        ViewWorker<List<String>> worker = new ViewWorker<>("view", batch -> {
            processingStarted.countDown();
            try {
                allowComplete.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, 1000, executor);

        assertFalse(worker.isRunning());

        CompletableFuture<Void> future = worker.submit(adding("core"));
        assertTrue(processingStarted.await(1, TimeUnit.SECONDS));
        assertTrue(worker.isRunning());

        allowComplete.countDown();
        future.get(1, TimeUnit.SECONDS);
        Thread.sleep(100);

        assertFalse(worker.isRunning());
    }
}
