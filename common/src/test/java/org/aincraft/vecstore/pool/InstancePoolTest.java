package org.aincraft.vecstore.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import org.aincraft.vecstore.backend.BackendStrategy;
import org.aincraft.vecstore.backend.InMemoryBackend;
import org.aincraft.vecstore.backend.IndexConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InstancePoolTest {
    private static final Logger LOGGER = Logger.getLogger(InstancePoolTest.class.getName());

    @TempDir
    Path base;

    private ExecutorService executor;
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger cleanups = new AtomicInteger();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private InstancePool pool(int maxInstances) {
        return new InstancePool(LOGGER, config -> {
            created.incrementAndGet();
            return new InMemoryBackend(LOGGER, executor, config) {
                @Override
                public CompletableFuture<Void> cleanup() {
                    cleanups.incrementAndGet();
                    return super.cleanup();
                }
            };
        }, maxInstances);
    }

    private static CompletableFuture<?> load(BackendStrategy backend) {
        return backend.initialize().thenCompose(v -> backend.loadIndex(backend.config()));
    }

    @Test
    void sameKeyReturnsSameInstance() {
        InstancePool pool = pool(20);
        PoolKey key = PoolKey.modelKey("m1", 4, base);
        IndexConfig config = key.toIndexConfig("flat");

        BackendStrategy first = pool.getInstance(key, config);
        BackendStrategy second = pool.getInstance(PoolKey.modelKey("m1", 4, base), config);

        assertThat(second).isSameAs(first);
        assertThat(created).hasValue(1);
        assertThat(pool.size()).isEqualTo(1);
        assertThat(pool.contains(key)).isTrue();
    }

    @Test
    void distinctKeysGetDistinctInstances() {
        InstancePool pool = pool(20);
        PoolKey model = PoolKey.modelKey("m1", 4, base);
        PoolKey document = PoolKey.documentKey(1, "m1", 4, base);
        PoolKey otherDimension = PoolKey.modelKey("m1", 8, base);

        BackendStrategy a = pool.getInstance(model, model.toIndexConfig("flat"));
        BackendStrategy b = pool.getInstance(document, document.toIndexConfig("flat"));
        BackendStrategy c = pool.getInstance(otherDimension, otherDimension.toIndexConfig("flat"));

        assertThat(a).isNotSameAs(b).isNotSameAs(c);
        assertThat(pool.keys()).containsExactlyInAnyOrder(model, document, otherDimension);
    }

    @Test
    void initializerRunsOncePerInstanceUnderConcurrency() throws Exception {
        InstancePool pool = pool(20);
        PoolKey key = PoolKey.documentKey(3, "m1", 4, base);
        IndexConfig config = key.toIndexConfig("flat");
        AtomicInteger initializations = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<CompletableFuture<BackendStrategy>> acquired = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            acquired.add(CompletableFuture.supplyAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return pool.acquire(key, config, backend -> {
                    initializations.incrementAndGet();
                    return load(backend);
                });
            }, executor).thenCompose(future -> future));
        }
        start.countDown();

        List<BackendStrategy> instances = new ArrayList<>();
        for (CompletableFuture<BackendStrategy> future : acquired) {
            instances.add(future.join());
        }
        assertThat(instances).allSatisfy(instance -> assertThat(instance).isSameAs(instances.get(0)));
        assertThat(initializations).hasValue(1);
        assertThat(created).hasValue(1);
    }

    @Test
    void failedInitializationIsRetried() {
        InstancePool pool = pool(20);
        PoolKey key = PoolKey.modelKey("m1", 4, base);
        IndexConfig config = key.toIndexConfig("flat");

        CompletableFuture<BackendStrategy> failed = pool.acquire(key, config,
            backend -> CompletableFuture.failedFuture(new IllegalStateException("disk unavailable")));
        assertThatThrownBy(failed::join).isInstanceOf(CompletionException.class);

        BackendStrategy backend = pool.acquire(key, config, InstancePoolTest::load).join();

        assertThat(backend.state().isReady()).isTrue();
        assertThat(created).hasValue(1);
    }

    @Test
    void clearInstanceCleansUpAndForgetsTheKey() {
        InstancePool pool = pool(20);
        PoolKey key = PoolKey.modelKey("m1", 4, base);
        BackendStrategy first = pool.acquire(key, key.toIndexConfig("flat"), InstancePoolTest::load).join();

        pool.clearInstance(key).join();
        pool.clearInstance(key).join();

        assertThat(cleanups).hasValue(1);
        assertThat(pool.contains(key)).isFalse();
        BackendStrategy second = pool.getInstance(key, key.toIndexConfig("flat"));
        assertThat(second).isNotSameAs(first);
    }

    @Test
    void clearAllCleansEveryInstance() {
        InstancePool pool = pool(20);
        for (int doc = 0; doc < 3; doc++) {
            PoolKey key = PoolKey.documentKey(doc, "m1", 4, base);
            pool.getInstance(key, key.toIndexConfig("flat"));
        }

        pool.clearAll().join();

        assertThat(pool.size()).isZero();
        assertThat(cleanups).hasValue(3);
    }

    @Test
    void growingPastTheLimitEvictsAndCleansUp() {
        InstancePool pool = pool(1);
        PoolKey a = PoolKey.modelKey("a", 4, base);
        PoolKey b = PoolKey.modelKey("b", 4, base);

        pool.getInstance(a, a.toIndexConfig("flat"));
        pool.getInstance(b, b.toIndexConfig("flat"));
        pool.cleanUp();

        assertThat(pool.size()).isEqualTo(1);
        assertThat(pool.stats().evicted()).isEqualTo(1);
        assertThat(cleanups).hasValue(1);
    }

    @Test
    void leasedInstanceIsCleanedUpAfterRelease() {
        InstancePool pool = pool(1);
        PoolKey a = PoolKey.modelKey("a", 4, base);
        PoolKey b = PoolKey.modelKey("b", 4, base);
        CompletableFuture<Void> gate = new CompletableFuture<>();

        CompletableFuture<Void> leased = pool.withInstance(a, a.toIndexConfig("flat"), InstancePoolTest::load,
            backend -> gate);
        pool.getInstance(b, b.toIndexConfig("flat"));
        pool.cleanUp();
        int cleanupsWhileLeased = pool.contains(a) ? -1 : cleanups.get();

        gate.complete(null);
        leased.join();

        if (cleanupsWhileLeased >= 0) {
            // a was the victim: it must have waited for the lease
            assertThat(cleanupsWhileLeased).isZero();
        }
        assertThat(cleanups).hasValue(1);
    }

    @Test
    void keyStringsIdentifyScope() {
        assertThat(PoolKey.modelKey("m1", 4, base).toString()).startsWith("model_m1_4_");
        assertThat(PoolKey.documentKey(9, "m1", 4, base).toString()).startsWith("doc_9_m1_4_");
        assertThat(PoolKey.modelKey("m1", 4, base)).isNotEqualTo(PoolKey.modelKey("m1", 4, base.resolve("other")));
    }
}
