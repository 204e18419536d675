package org.aincraft.vecstore.api;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/**
 * Producer-facing entry point of the embedding store.
 * All operations are asynchronous; failures complete the returned future exceptionally
 * with a {@link VectorStoreException} subtype.
 */
public interface VectorStoreService {

    /**
     * Stores a chunk embedding in the index of its document (and the corpus-wide index of its model
     * when mirroring is enabled).
     *
     * @param record The embedding to store
     * @return CompletableFuture that completes when the vector is written
     */
    CompletableFuture<Void> storeEmbedding(EmbeddingRecord record);

    /**
     * Searches the corpus-wide index of a model.
     * A model that was never indexed yields an empty result, not an error.
     *
     * @param queryVector The query embedding
     * @param k Maximum number of results
     * @param modelName Model to search, or null for the current model
     * @param dimension Expected dimension, or null to use the query length
     * @return CompletableFuture containing the ranked hits
     */
    CompletableFuture<SearchHits> search(float[] queryVector, int k, @Nullable String modelName, @Nullable Integer dimension);

    /**
     * Searches only the vectors stored for one document.
     */
    CompletableFuture<SearchHits> searchDocument(float[] queryVector, long documentId, int k,
                                                 @Nullable String modelName, @Nullable Integer dimension);

    /**
     * Drops every index belonging to a document. Deleting an unknown document is a no-op.
     */
    CompletableFuture<Void> deleteDocumentIndex(long documentId);

    /**
     * Statistics of the corpus-wide index of the current model.
     */
    CompletableFuture<IndexStats> getIndexStats();

    /**
     * Makes a model the current one, flushing the previous current index first.
     * The model's corpus index is loaded, or created if it does not exist yet.
     */
    CompletableFuture<Void> switchModel(String modelName, int dimension);

    /**
     * Flushes the current model's corpus index to disk.
     */
    CompletableFuture<Void> saveIndex();

    /**
     * Removes every vector from the current model's corpus index.
     */
    CompletableFuture<Void> resetIndex();

    CompletableFuture<Void> optimizeIndex();

    /**
     * Copies the current model's corpus index to {@code target}, replacing any file there.
     */
    CompletableFuture<Void> backupIndex(Path target);

    /**
     * Replaces the current model's corpus index with a backup made by {@link #backupIndex(Path)}.
     */
    CompletableFuture<Void> restoreIndex(Path source);

    /**
     * Releases pooled indexes and the executor.
     */
    void shutdown();
}
