package org.aincraft.vecstore.backend;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.aincraft.vecstore.api.IndexStats;
import org.aincraft.vecstore.api.SearchHits;
import org.aincraft.vecstore.storage.record.VectorEntry;
import org.jetbrains.annotations.Nullable;

/**
 * Storage engine behind one logical index (a model index or a document index).
 * Instances are owned by the instance pool; callers borrow them and must not close them.
 *
 * All I/O runs on the executor the backend was created with.
 */
public interface BackendStrategy {

    /**
     * Prepare resources that do not depend on an index file (directories, executors).
     *
     * @return CompletableFuture that completes when the backend can create or load an index
     */
    CompletableFuture<Void> initialize();

    /**
     * Create the index file, catalog row and vector table for the config.
     * Creating an index that already exists is a no-op.
     *
     * @param config identity of the index
     * @return CompletableFuture containing the index file path
     */
    CompletableFuture<Path> createIndex(IndexConfig config);

    /**
     * Open an existing index file. Missing tables are created, and plain tables are
     * migrated to the accelerated layout when the extension became available.
     *
     * @param config identity of the index
     * @return CompletableFuture that completes when the index is ready
     */
    CompletableFuture<Void> loadIndex(IndexConfig config);

    /**
     * Flush pending state to disk.
     */
    CompletableFuture<Void> saveIndex();

    /**
     * Add one vector for a chunk.
     *
     * @param vector embedding, exactly {@code dimension} floats
     * @param chunkId chunk id; fractional values are truncated
     * @return CompletableFuture that completes when the vector is stored
     */
    CompletableFuture<Void> addVectors(float[] vector, Number chunkId);

    /**
     * Add many vectors at once. Either all entries are stored or none.
     *
     * @return CompletableFuture containing the number of vectors stored
     */
    CompletableFuture<Integer> addVectors(List<VectorEntry> entries);

    /**
     * k-nearest-neighbour search by L2 distance, nearest first.
     */
    CompletableFuture<SearchHits> search(float[] query, int k);

    /**
     * k-nearest-neighbour search returning only hits with {@code distance <= distanceThreshold}.
     */
    CompletableFuture<SearchHits> search(float[] query, int k, @Nullable Double distanceThreshold);

    /**
     * Remove every vector stored for the given chunks.
     *
     * @return CompletableFuture containing the number of vectors removed
     */
    CompletableFuture<Integer> deleteVectors(Collection<Long> chunkIds);

    /**
     * Distinct chunk ids present in the index.
     */
    CompletableFuture<List<Long>> listChunkIds();

    CompletableFuture<IndexStats> getStats();

    /**
     * Drop every vector and recreate an empty index with the same identity.
     */
    CompletableFuture<Void> resetIndex();

    CompletableFuture<Void> optimizeIndex();

    /**
     * Write a consistent copy of the index to {@code target}.
     */
    CompletableFuture<Void> backupIndex(Path target);

    /**
     * Replace the index with a copy produced by {@link #backupIndex(Path)}.
     */
    CompletableFuture<Void> restoreIndex(Path source);

    /**
     * Release file handles and pools. The instance is unusable afterwards.
     */
    CompletableFuture<Void> cleanup();

    /**
     * Whether any index file exists for the document under this backend's model and dimension.
     */
    CompletableFuture<Boolean> documentIndexExists(long documentId);

    /**
     * Delete the document's index file, catalog row and table under this backend's model and dimension.
     */
    CompletableFuture<Void> deleteDocumentIndex(long documentId);

    boolean indexExists();

    /**
     * Size of the index file in bytes, 0 when absent.
     */
    long getIndexFileSize();

    IndexState state();

    IndexConfig config();
}
