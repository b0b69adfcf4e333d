package com.nayem.strata.source;

import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Collapses concurrent calls for the same key into one execution whose result
 * every caller shares.
 * <p>
 * Used so that two refreshes of one source issue a single fetch.
 * </p>
 */
public class SingleFlightGroup<V> {

    private final ConcurrentHashMap<String, FlightFuture<V>> flights = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public SingleFlightGroup(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Runs {@code supplier} on the executor unless a call for {@code key} is
     * already in flight, in which case the caller shares that call's result.
     * The caller's MDC is carried onto the executor thread.
     */
    public CompletableFuture<V> doCall(String key, Supplier<V> supplier) {
        return doCall(key, supplier, null);
    }

    /**
     * @param timeout applied to the shared future, so it ends the wait of every
     *                caller of the flight; {@code null} waits indefinitely
     */
    public CompletableFuture<V> doCall(String key, Supplier<V> supplier, Duration timeout) {
        final Map<String, String> mdcContext = MDC.getCopyOfContextMap();

        FlightFuture<V> future = flights.computeIfAbsent(key, k -> {
            FlightFuture<V> flight = new FlightFuture<>();

            Future<?> task = executor.submit(() -> {
                if (mdcContext != null) {
                    MDC.setContextMap(mdcContext);
                }
                try {
                    flight.complete(supplier.get());
                } catch (Throwable e) {
                    flight.completeExceptionally(e);
                } finally {
                    MDC.clear();
                    flights.remove(key, flight);
                }
            });

            flight.setTask(task);
            return flight;
        });

        if (timeout != null) {
            return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return future;
    }

    /**
     * Cancels and interrupts the call in flight for {@code key}, if any.
     */
    public boolean cancel(String key) {
        FlightFuture<V> future = flights.remove(key);
        if (future != null) {
            return future.cancel(true);
        }
        return false;
    }

    public boolean isInFlight(String key) {
        return flights.containsKey(key);
    }

    // cancelling the shared future interrupts the fetch behind it
    private static class FlightFuture<V> extends CompletableFuture<V> {
        private volatile Future<?> task;

        void setTask(Future<?> task) {
            this.task = task;
            if (isCancelled()) {
                task.cancel(true);
            }
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            if (cancelled && task != null) {
                task.cancel(mayInterruptIfRunning);
            }
            return cancelled;
        }
    }
}
