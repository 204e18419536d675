package org.aincraft.vecstore.pool;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.aincraft.vecstore.backend.BackendStrategy;

/**
 * A pooled backend with its one-time readiness future and lease count.
 * An evicted entry is cleaned up once the last lease is released.
 */
final class PoolEntry {
    private final PoolKey key;
    private final BackendStrategy instance;
    private volatile long lastAccess;
    private CompletableFuture<BackendStrategy> ready;
    private int leases;
    private boolean evicted;

    PoolEntry(PoolKey key, BackendStrategy instance) {
        this.key = key;
        this.instance = instance;
        this.lastAccess = System.currentTimeMillis();
    }

    PoolKey key() {
        return key;
    }

    BackendStrategy instance() {
        return instance;
    }

    long lastAccess() {
        return lastAccess;
    }

    void touch() {
        lastAccess = System.currentTimeMillis();
    }

    /**
     * Runs the initializer once per entry. A failed run is forgotten so the next caller retries.
     */
    synchronized CompletableFuture<BackendStrategy> ready(Function<BackendStrategy, CompletableFuture<?>> initializer) {
        if (ready == null || ready.isCompletedExceptionally()) {
            CompletableFuture<?> init;
            try {
                init = initializer.apply(instance);
            } catch (RuntimeException e) {
                init = CompletableFuture.failedFuture(e);
            }
            ready = init.thenApply(ignored -> instance);
        }
        return ready;
    }

    synchronized void lease() {
        leases++;
    }

    /**
     * @return true if the entry was evicted and this was the last lease
     */
    synchronized boolean release() {
        leases--;
        return evicted && leases == 0;
    }

    /**
     * @return true if nobody holds a lease and the instance can be cleaned up now
     */
    synchronized boolean markEvicted() {
        evicted = true;
        return leases == 0;
    }
}
