package com.nayem.tenancy.reconcile;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Suppresses duplicate concurrent calls (the "SingleFlight" pattern from Go's
 * sync/singleflight).
 * <p>
 * While a call for a key is in flight, further callers for that key get the
 * same future instead of starting a second execution. Once it finishes, the
 * next call starts a new one: the key is released before the shared future
 * completes.
 * </p>
 */
public class SingleFlightGroup<V> {

    private final ConcurrentHashMap<String, CompletableFuture<V>> flights = new ConcurrentHashMap<>();
    private final Executor executor;

    public SingleFlightGroup(Executor executor) {
        this.executor = executor;
    }

    /**
     * Executes the supplier unless an execution for the key is already in
     * progress, in which case that execution's future is returned.
     *
     * @param key      The unique key identifying the operation
     * @param supplier The operation to execute
     * @return A future completing with the shared result
     */
    public CompletableFuture<V> doCall(String key, Supplier<V> supplier) {
        final Map<String, String> mdcContext = MDC.getCopyOfContextMap();

        return flights.computeIfAbsent(key, k -> {
            CompletableFuture<V> flight = new CompletableFuture<>();
            executor.execute(() -> {
                if (mdcContext != null) {
                    MDC.setContextMap(mdcContext);
                }
                try {
                    V result = supplier.get();
                    // Release the key first so callers reacting to completion start a new flight.
                    flights.remove(key, flight);
                    flight.complete(result);
                } catch (Throwable e) {
                    flights.remove(key, flight);
                    flight.completeExceptionally(e);
                } finally {
                    MDC.clear();
                }
            });
            return flight;
        });
    }

    /**
     * Checks if a call is currently in flight for the key.
     */
    public boolean isInFlight(String key) {
        return flights.containsKey(key);
    }
}
