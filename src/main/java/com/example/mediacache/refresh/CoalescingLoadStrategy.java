package com.example.mediacache.refresh;

import com.example.mediacache.backend.MetadataRetrievalException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Collapses concurrent misses on the same key into one upstream call. The first caller
 * runs the loader on its own thread; callers arriving while it is in flight wait for and
 * share its result, or its failure.
 */
public class CoalescingLoadStrategy<V> implements LoadStrategy<V> {

    private final ConcurrentHashMap<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    @Override
    public V load(String key, Supplier<V> loader) {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            return await(key, existing);
        }

        try {
            V value = loader.get();
            mine.complete(value);
            return value;
        } catch (Throwable t) {
            // waiters must be released whatever the loader threw
            mine.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private V await(String key, CompletableFuture<V> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataRetrievalException("Interrupted while waiting for in-flight load of " + key, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new MetadataRetrievalException("In-flight load failed for " + key, e.getCause());
        }
    }
}
