package org.aincraft.vecstore.pool;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.aincraft.vecstore.backend.BackendFactory;
import org.aincraft.vecstore.backend.BackendStrategy;
import org.aincraft.vecstore.backend.IndexConfig;

/**
 * Keyed cache of live backends. At most one instance exists per key; callers borrow
 * instances and never close them. When the pool grows past its maximum size an entry is
 * evicted and cleaned up after its last lease is released.
 */
public class InstancePool {
    private final Logger logger;
    private final BackendFactory factory;
    private final int maxInstances;
    private final Cache<PoolKey, PoolEntry> entries;
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();

    public InstancePool(Logger logger, BackendFactory factory, int maxInstances) {
        Preconditions.checkArgument(maxInstances > 0, "maxInstances must be positive");
        this.logger = logger;
        this.factory = Preconditions.checkNotNull(factory, "factory cannot be null");
        this.maxInstances = maxInstances;
        this.entries = Caffeine.newBuilder()
            .maximumSize(maxInstances)
            .executor(Runnable::run)
            .<PoolKey, PoolEntry>removalListener(this::onRemoval)
            .build();
    }

    /**
     * Returns the pooled backend for the key, creating it from the factory on first use.
     * The returned instance may not be loaded yet; see {@link #acquire}.
     */
    public BackendStrategy getInstance(PoolKey key, IndexConfig config) {
        return entry(key, config).instance();
    }

    /**
     * Returns the pooled backend once its initializer has completed.
     * The initializer runs once per live instance; a failed run is retried by the next caller.
     */
    public CompletableFuture<BackendStrategy> acquire(PoolKey key, IndexConfig config,
                                                      Function<BackendStrategy, CompletableFuture<?>> initializer) {
        return entry(key, config).ready(initializer);
    }

    /**
     * Runs {@code action} against the ready backend. The instance is not cleaned up by an
     * eviction until the action's future completes.
     */
    public <T> CompletableFuture<T> withInstance(PoolKey key, IndexConfig config,
                                                 Function<BackendStrategy, CompletableFuture<?>> initializer,
                                                 Function<BackendStrategy, CompletableFuture<T>> action) {
        PoolEntry entry = entry(key, config);
        entry.lease();
        CompletableFuture<T> result;
        try {
            result = entry.ready(initializer).thenCompose(action);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.whenComplete((value, error) -> {
            if (entry.release()) {
                cleanup(entry, "released after eviction");
            }
        });
    }

    private PoolEntry entry(PoolKey key, IndexConfig config) {
        Preconditions.checkNotNull(key, "key cannot be null");
        PoolEntry entry = entries.get(key, k -> {
            created.incrementAndGet();
            logger.fine("Creating backend instance " + k);
            return new PoolEntry(k, factory.create(config));
        });
        entry.touch();
        return entry;
    }

    /**
     * Evicts the key and cleans up its instance.
     *
     * @return CompletableFuture that completes after cleanup, immediately if the key was absent
     */
    public CompletableFuture<Void> clearInstance(PoolKey key) {
        PoolEntry entry = entries.asMap().remove(key);
        if (entry == null) {
            return CompletableFuture.completedFuture(null);
        }
        logger.fine("Cleared backend instance " + key);
        return entry.instance().cleanup();
    }

    public CompletableFuture<Void> clearAll() {
        List<PoolKey> keys = new ArrayList<>(entries.asMap().keySet());
        CompletableFuture<?>[] cleanups = keys.stream()
            .map(this::clearInstance)
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(cleanups)
            .thenRun(() -> logger.info("Cleared " + keys.size() + " pooled backend instances"));
    }

    public Set<PoolKey> keys() {
        return Set.copyOf(entries.asMap().keySet());
    }

    public int size() {
        return entries.asMap().size();
    }

    public boolean contains(PoolKey key) {
        return entries.asMap().containsKey(key);
    }

    public PoolStats stats() {
        List<String> keys = entries.asMap().values().stream()
            .sorted(Comparator.comparingLong(PoolEntry::lastAccess).reversed())
            .map(entry -> entry.key().toString())
            .toList();
        return new PoolStats(size(), maxInstances, created.get(), evicted.get(), keys);
    }

    /**
     * Runs pending size-based evictions now.
     */
    void cleanUp() {
        entries.cleanUp();
    }

    private void onRemoval(PoolKey key, PoolEntry entry, RemovalCause cause) {
        // Explicit removals clean up in clearInstance
        if (entry == null || !cause.wasEvicted()) {
            return;
        }
        evicted.incrementAndGet();
        logger.fine("Evicting backend instance " + key + " (" + cause + ")");
        if (entry.markEvicted()) {
            cleanup(entry, "evicted");
        }
    }

    private void cleanup(PoolEntry entry, String reason) {
        entry.instance().cleanup().whenComplete((ignored, error) -> {
            if (error != null) {
                logger.log(Level.WARNING, "Cleanup of " + entry.key() + " (" + reason + ") failed", error);
            }
        });
    }
}
