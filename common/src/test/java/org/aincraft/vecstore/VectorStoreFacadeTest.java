package org.aincraft.vecstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.EmbeddingRecord;
import org.aincraft.vecstore.api.IndexStats;
import org.aincraft.vecstore.api.SearchHits;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.backend.BackendFactory;
import org.aincraft.vecstore.backend.SqliteVecBackend;
import org.aincraft.vecstore.config.MapConfigProvider;
import org.aincraft.vecstore.config.VectorStoreConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VectorStoreFacadeTest {
    private static final Logger LOGGER = Logger.getLogger(VectorStoreFacadeTest.class.getName());

    @TempDir
    Path base;

    private VectorStoreFacade store;
    private final AtomicInteger backendsCreated = new AtomicInteger();

    private VectorStoreConfig config(boolean mirror) {
        return new VectorStoreConfig(new MapConfigProvider()
            .with("storage.base-path", base.toString())
            .with("index.mirror-corpus", mirror));
    }

    private VectorStoreFacade facade(VectorStoreConfig config) {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        BackendFactory factory = indexConfig -> {
            backendsCreated.incrementAndGet();
            return new SqliteVecBackend(LOGGER, executor, indexConfig, "", 5000);
        };
        return new VectorStoreFacade(LOGGER, config, executor, factory);
    }

    @BeforeEach
    void setUp() {
        store = facade(config(true));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private void put(long chunkId, long documentId, float... embedding) {
        store.storeEmbedding(new EmbeddingRecord(chunkId, documentId, embedding, "m1", embedding.length)).join();
    }

    @Test
    @DisplayName("corpus search finds the nearest chunk at distance ~0.1414")
    void unitVectorScenario() {
        put(10, 1, 1, 0, 0, 0);
        put(11, 1, 0, 1, 0, 0);

        SearchHits hits = store.search(new float[] {0.9f, 0.1f, 0, 0}, 1, "m1", 4).join();

        assertThat(hits.chunkIds()).containsExactly(10L);
        assertThat(hits.distances()[0]).isCloseTo(0.1414, within(1e-3));
    }

    @Test
    void documentSearchIsIsolated() {
        put(1, 100, 1, 0, 0, 0);
        put(2, 200, 1, 0, 0, 0);
        put(3, 200, 0, 1, 0, 0);

        SearchHits a = store.searchDocument(new float[] {1, 0, 0, 0}, 100, 10, "m1", 4).join();
        SearchHits b = store.searchDocument(new float[] {1, 0, 0, 0}, 200, 10, "m1", 4).join();

        assertThat(a.chunkIds()).containsExactly(1L);
        assertThat(b.chunkIds()).containsExactlyInAnyOrder(2L, 3L);
        assertThat(Files.exists(store.documentIndexPath(100, "m1", 4))).isTrue();
    }

    @Test
    void neverIndexedModelYieldsEmptyResult() {
        assertThat(store.search(new float[] {1, 0}, 5, "unknown", 2).join().isEmpty()).isTrue();
        assertThat(store.search(new float[] {1, 0}, 5, null, null).join().isEmpty()).isTrue();
        assertThat(Files.exists(store.modelIndexPath("unknown", 2))).isFalse();
    }

    @Test
    void pooledIndexesAreReused() {
        put(1, 5, 1, 0, 0, 0);
        put(2, 5, 0, 1, 0, 0);
        store.search(new float[] {1, 0, 0, 0}, 1, "m1", 4).join();
        store.searchDocument(new float[] {1, 0, 0, 0}, 5, 1, "m1", 4).join();

        // one document index and one corpus index
        assertThat(backendsCreated).hasValue(2);
        assertThat(store.getPoolStats().size()).isEqualTo(2);
        assertThat(store.getPoolStats().keys()).anySatisfy(key -> assertThat(key).startsWith("doc_5_m1_4_"));
    }

    @Test
    void deleteDocumentIndexRemovesItsVectorsEverywhere() {
        put(1, 100, 1, 0, 0, 0);
        put(2, 200, 0, 1, 0, 0);

        store.deleteDocumentIndex(100).join();

        assertThat(Files.exists(store.documentIndexPath(100, "m1", 4))).isFalse();
        assertThat(store.searchDocument(new float[] {1, 0, 0, 0}, 100, 10, "m1", 4).join().isEmpty()).isTrue();
        SearchHits corpus = store.search(new float[] {1, 0, 0, 0}, 10, "m1", 4).join();
        assertThat(corpus.chunkIds()).containsExactly(2L);
    }

    @Test
    void deleteDocumentIndexFindsIndexesOnlyOnDisk() {
        put(1, 100, 1, 0, 0, 0);
        store.storeEmbedding(new EmbeddingRecord(2, 100, new float[] {1, 1}, "m2", 2)).join();
        store.clearPool().join();
        assertThat(store.getPoolStats().size()).isZero();

        store.deleteDocumentIndex(100).join();

        assertThat(Files.exists(store.documentIndexPath(100, "m1", 4))).isFalse();
        assertThat(Files.exists(store.documentIndexPath(100, "m2", 2))).isFalse();
        assertThat(store.search(new float[] {1, 1}, 10, "m2", 2).join().isEmpty()).isTrue();
    }

    @Test
    void modelNamesThatSanitizeAlikeKeepSeparateFiles() {
        store.storeEmbedding(new EmbeddingRecord(1, 7, new float[] {1, 0}, "org/m", 2)).join();
        store.storeEmbedding(new EmbeddingRecord(2, 7, new float[] {0, 1}, "org_m", 2)).join();
        assertThat(store.documentIndexPath(7, "org/m", 2)).isNotEqualTo(store.documentIndexPath(7, "org_m", 2));
        store.clearPool().join();

        store.deleteDocumentIndex(7).join();

        assertThat(store.search(new float[] {1, 0}, 10, "org/m", 2).join().isEmpty()).isTrue();
        assertThat(store.search(new float[] {0, 1}, 10, "org_m", 2).join().isEmpty()).isTrue();
        assertThat(Files.exists(store.documentIndexPath(7, "org/m", 2))).isFalse();
        assertThat(Files.exists(store.documentIndexPath(7, "org_m", 2))).isFalse();
    }

    @Test
    void deletingUnknownDocumentIsANoOp() {
        store.deleteDocumentIndex(999).join();

        assertThat(store.getPoolStats().size()).isZero();
    }

    @Test
    void statsFollowTheCurrentModel() {
        IndexStats before = store.getIndexStats().join();
        assertThat(before.initialized()).isFalse();
        assertThat(before.totalVectors()).isZero();

        put(1, 1, 1, 0, 0, 0);
        put(2, 1, 0, 1, 0, 0);
        IndexStats after = store.getIndexStats().join();

        assertThat(after.initialized()).isTrue();
        assertThat(after.totalVectors()).isEqualTo(2);
        assertThat(after.dimension()).isEqualTo(4);
        assertThat(after.indexType()).isEqualTo("flat");
        assertThat(after.currentModel()).isEqualTo("m1");
        assertThat(store.getCurrentModel()).contains("m1");
    }

    @Test
    void batchStoreWritesEveryIndex() {
        store.storeEmbeddings(List.of(
            new EmbeddingRecord(1, 7, new float[] {1, 0}, "m1", 2),
            new EmbeddingRecord(2, 7, new float[] {0, 1}, "m1", 2),
            new EmbeddingRecord(3, 8, new float[] {1, 1}, "m1", 2))).join();

        assertThat(store.search(new float[] {1, 1}, 10, "m1", 2).join().size()).isEqualTo(3);
        assertThat(store.searchDocument(new float[] {1, 1}, 7, 10, "m1", 2).join().size()).isEqualTo(2);
        assertThat(store.deleteChunks("m1", 2, List.of(1L, 2L)).join()).isEqualTo(2);
        assertThat(store.search(new float[] {1, 1}, 10, "m1", 2).join().chunkIds()).containsExactly(3L);
    }

    @Test
    void indexesSurviveARestart() {
        put(1, 1, 1, 0, 0, 0);
        store.shutdown();

        store = facade(config(true));
        SearchHits hits = store.search(new float[] {1, 0, 0, 0}, 1, "m1", 4).join();

        assertThat(hits.chunkIds()).containsExactly(1L);
    }

    @Test
    void mirrorCanBeDisabled() {
        store.shutdown();
        store = facade(config(false));

        put(1, 1, 1, 0, 0, 0);

        assertThat(store.search(new float[] {1, 0, 0, 0}, 1, "m1", 4).join().isEmpty()).isTrue();
        assertThat(store.searchDocument(new float[] {1, 0, 0, 0}, 1, 1, "m1", 4).join().chunkIds())
            .containsExactly(1L);
    }

    @Nested
    class Maintenance {

        @Test
        void requiresACurrentModel() {
            assertThatThrownBy(() -> store.saveIndex().join()).hasCauseInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> store.optimizeIndex().join()).hasCauseInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> store.backupIndex(base.resolve("backup.db")).join())
                .hasCauseInstanceOf(ValidationException.class);
        }

        @Test
        void switchModelOpensTheNewCorpusIndex() {
            put(1, 1, 1, 0, 0, 0);

            store.switchModel("m2", 2).join();

            assertThat(store.getCurrentModel()).contains("m2");
            assertThat(Files.exists(store.modelIndexPath("m2", 2))).isTrue();
            IndexStats stats = store.getIndexStats().join();
            assertThat(stats.dimension()).isEqualTo(2);
            assertThat(stats.totalVectors()).isZero();
            assertThat(store.search(new float[] {1, 0, 0, 0}, 1, "m1", 4).join().chunkIds()).containsExactly(1L);
        }

        @Test
        void switchModelRejectsBadArguments() {
            assertThatThrownBy(() -> store.switchModel(" ", 2).join()).hasCauseInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> store.switchModel("m2", 0).join()).hasCauseInstanceOf(ValidationException.class);
            assertThat(store.getCurrentModel()).isEmpty();
        }

        @Test
        void saveAndOptimizeKeepVectors() {
            put(1, 1, 1, 0, 0, 0);
            put(2, 1, 0, 1, 0, 0);

            store.saveIndex().join();
            store.optimizeIndex().join();

            assertThat(store.search(new float[] {1, 0, 0, 0}, 10, "m1", 4).join().chunkIds())
                .containsExactly(1L, 2L);
        }

        @Test
        void resetEmptiesOnlyTheCorpusIndex() {
            put(1, 1, 1, 0, 0, 0);
            put(2, 1, 0, 1, 0, 0);

            store.resetIndex().join();

            assertThat(store.getIndexStats().join().totalVectors()).isZero();
            assertThat(store.search(new float[] {1, 0, 0, 0}, 10, "m1", 4).join().isEmpty()).isTrue();
            assertThat(store.searchDocument(new float[] {1, 0, 0, 0}, 1, 10, "m1", 4).join().size()).isEqualTo(2);
        }

        @Test
        void restoreBringsBackTheBackedUpVectors() {
            Path backup = base.resolve("backups").resolve("m1.db");
            put(1, 1, 1, 0, 0, 0);
            store.backupIndex(backup).join();
            put(2, 1, 0, 1, 0, 0);

            store.restoreIndex(backup).join();

            assertThat(Files.exists(backup)).isTrue();
            assertThat(store.search(new float[] {0, 1, 0, 0}, 10, "m1", 4).join().chunkIds()).containsExactly(1L);
        }
    }

    @Nested
    class Validation {

        @Test
        void mismatchedEmbeddingLengthFailsBeforeAnyIo() {
            EmbeddingRecord record = new EmbeddingRecord(1, 1, new float[] {1, 0, 0}, "m1", 4);

            assertThatThrownBy(() -> store.storeEmbedding(record).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ValidationException.class);
            assertThat(store.getPoolStats().size()).isZero();
            assertThat(Files.exists(base.resolve("documents"))).isFalse();
        }

        @Test
        void missingFieldsAreRejected() {
            assertThatThrownBy(() -> store.storeEmbedding(new EmbeddingRecord(null, 1, new float[] {1}, "m1", 1)).join())
                .hasCauseInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> store.storeEmbedding(new EmbeddingRecord(1, 1, new float[] {1}, " ", 1)).join())
                .hasCauseInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> store.storeEmbedding(new EmbeddingRecord(1, 1, new float[0], "m1", 0)).join())
                .hasCauseInstanceOf(ValidationException.class);
        }

        @Test
        void queryDimensionMustMatch() {
            put(1, 1, 1, 0, 0, 0);

            assertThatThrownBy(() -> store.search(new float[] {1, 0}, 1, "m1", 4).join())
                .hasCauseInstanceOf(ValidationException.class);
        }
    }
}
