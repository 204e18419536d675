package org.aincraft.vecstore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.aincraft.vecstore.api.EmbeddingRecord;
import org.aincraft.vecstore.api.IndexStats;
import org.aincraft.vecstore.api.SearchHits;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.api.VectorStoreException;
import org.aincraft.vecstore.api.VectorStoreService;
import org.aincraft.vecstore.backend.AbstractBackend;
import org.aincraft.vecstore.backend.BackendFactory;
import org.aincraft.vecstore.backend.BackendStrategy;
import org.aincraft.vecstore.backend.IndexConfig;
import org.aincraft.vecstore.backend.VectorBackendFactory;
import org.aincraft.vecstore.config.VectorStoreConfig;
import org.aincraft.vecstore.pool.InstancePool;
import org.aincraft.vecstore.pool.PoolKey;
import org.aincraft.vecstore.pool.PoolStats;
import org.aincraft.vecstore.storage.record.ChunkIds;
import org.aincraft.vecstore.storage.record.VectorEntry;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point of the vector store.
 *
 * Every embedding is written to the index of its document and, unless mirroring is
 * disabled, to the corpus-wide index of its model. Backends are borrowed from an
 * {@link InstancePool} owned by this facade, so each (model, dimension, document) index
 * is opened once and reused across calls.
 */
public class VectorStoreFacade implements VectorStoreService {
    private final Logger logger;
    private final VectorStoreConfig config;
    private final ExecutorService executor;
    private final InstancePool pool;
    private final Path basePath;
    private final String fileExtension;
    private volatile String currentModel;
    private volatile int currentDimension;

    public VectorStoreFacade(Logger logger, VectorStoreConfig config) {
        this(logger, config, Executors.newFixedThreadPool(config.getExecutorThreads()));
    }

    private VectorStoreFacade(Logger logger, VectorStoreConfig config, ExecutorService executor) {
        this(logger, config, executor, VectorBackendFactory.create(config, logger, executor));
    }

    /**
     * @param executor shared by the facade and every backend the factory creates; shut down by {@link #shutdown()}
     */
    public VectorStoreFacade(Logger logger, VectorStoreConfig config, ExecutorService executor,
                             BackendFactory backendFactory) {
        this.logger = logger;
        this.config = config;
        this.executor = executor;
        this.pool = new InstancePool(logger, backendFactory, config.getPoolMaxInstances());
        this.basePath = config.getBasePath().toAbsolutePath().normalize();
        this.fileExtension = VectorBackendFactory.resolveType(config, logger).fileExtension();
        String defaultModel = config.getDefaultModel();
        this.currentModel = defaultModel.isBlank() ? null : defaultModel;
        this.currentDimension = Math.max(0, config.getDefaultDimension());
        logger.info("Vector store ready at " + basePath + " (backend " + config.getBackend() + ")");
    }

    @Override
    public CompletableFuture<Void> storeEmbedding(EmbeddingRecord record) {
        long chunkId;
        try {
            chunkId = validate(record);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        useModel(record.model(), record.dimensions());

        PoolKey documentKey = PoolKey.documentKey(record.documentId(), record.model(), record.dimensions(), basePath);
        CompletableFuture<Void> write = withBackend(documentKey,
            backend -> backend.addVectors(record.embedding(), chunkId));
        if (!config.isCorpusMirrorEnabled()) {
            return write;
        }
        PoolKey modelKey = PoolKey.modelKey(record.model(), record.dimensions(), basePath);
        return write.thenCompose(v -> withBackend(modelKey, backend -> backend.addVectors(record.embedding(), chunkId)));
    }

    /**
     * Stores many embeddings, batching writes per target index. All records are validated first.
     */
    public CompletableFuture<Void> storeEmbeddings(List<EmbeddingRecord> records) {
        if (records == null) {
            return CompletableFuture.failedFuture(new ValidationException("Records cannot be null"));
        }
        Map<PoolKey, List<VectorEntry>> batches = new LinkedHashMap<>();
        try {
            for (EmbeddingRecord record : records) {
                long chunkId = validate(record);
                VectorEntry entry = new VectorEntry(chunkId, record.embedding());
                batches.computeIfAbsent(
                    PoolKey.documentKey(record.documentId(), record.model(), record.dimensions(), basePath),
                    key -> new ArrayList<>()).add(entry);
                if (config.isCorpusMirrorEnabled()) {
                    batches.computeIfAbsent(PoolKey.modelKey(record.model(), record.dimensions(), basePath),
                        key -> new ArrayList<>()).add(entry);
                }
            }
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (records.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        EmbeddingRecord last = records.get(records.size() - 1);
        useModel(last.model(), last.dimensions());

        CompletableFuture<?>[] writes = batches.entrySet().stream()
            .map(batch -> withBackend(batch.getKey(), backend -> backend.addVectors(batch.getValue())))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(writes);
    }

    @Override
    public CompletableFuture<SearchHits> search(float[] queryVector, int k, @Nullable String modelName,
                                                @Nullable Integer dimension) {
        String model = modelName != null ? modelName : currentModel;
        if (model == null) {
            logger.fine("Search without a model before anything was indexed");
            return CompletableFuture.completedFuture(SearchHits.empty());
        }
        int dim;
        try {
            dim = validateQuery(queryVector, dimension);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return searchIndex(PoolKey.modelKey(model, dim, basePath), queryVector, k);
    }

    /**
     * Searches the current model's corpus index with the configured default k.
     */
    public CompletableFuture<SearchHits> search(float[] queryVector) {
        return search(queryVector, config.getDefaultSearchK(), null, null);
    }

    @Override
    public CompletableFuture<SearchHits> searchDocument(float[] queryVector, long documentId, int k,
                                                        @Nullable String modelName, @Nullable Integer dimension) {
        String model = modelName != null ? modelName : currentModel;
        if (model == null) {
            return CompletableFuture.completedFuture(SearchHits.empty());
        }
        int dim;
        try {
            dim = validateQuery(queryVector, dimension);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return searchIndex(PoolKey.documentKey(documentId, model, dim, basePath), queryVector, k);
    }

    private CompletableFuture<SearchHits> searchIndex(PoolKey key, float[] query, int k) {
        int limit = Math.min(k, config.getMaxSearchK());
        return CompletableFuture.supplyAsync(() -> isIndexed(key), executor)
            .thenCompose(indexed -> {
                if (!indexed) {
                    logger.fine("No index for " + key + ", returning no results");
                    return CompletableFuture.completedFuture(SearchHits.empty());
                }
                return withBackend(key, backend -> backend.search(query, limit));
            });
    }

    @Override
    public CompletableFuture<Void> deleteDocumentIndex(long documentId) {
        if (documentId < 0) {
            return CompletableFuture.failedFuture(new ValidationException("documentId cannot be negative"));
        }
        logger.info("Deleting indexes of document " + documentId);

        return CompletableFuture.supplyAsync(() -> documentIndexes(documentId), executor)
            .thenCompose(targets -> {
                CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
                for (PoolKey key : targets) {
                    chain = chain.thenCompose(v -> deleteDocumentIndex(documentId, key));
                }
                return chain.thenRun(() -> logger.info("Deleted " + targets.size()
                    + " index(es) of document " + documentId));
            });
    }

    private CompletableFuture<Void> deleteDocumentIndex(long documentId, PoolKey key) {
        CompletableFuture<List<Long>> removed = withBackend(key, backend -> backend.listChunkIds()
            .thenCompose(chunkIds -> backend.deleteDocumentIndex(documentId).thenApply(v -> chunkIds)));
        return removed
            .thenCompose(chunkIds -> pool.clearInstance(key).thenApply(v -> chunkIds))
            .thenCompose(chunkIds -> {
                if (!config.isCorpusMirrorEnabled() || chunkIds.isEmpty()) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                return deleteChunks(key.modelName(), key.dimension(), chunkIds).thenApply(count -> (Void) null);
            });
    }

    /**
     * Every index of the document, pooled or only on disk.
     */
    private Set<PoolKey> documentIndexes(long documentId) {
        Set<PoolKey> targets = new LinkedHashSet<>();
        Set<Path> pooledFiles = new LinkedHashSet<>();
        for (PoolKey key : pool.keys()) {
            if (key.isDocumentKey() && key.documentId() == documentId && key.basePath().equals(basePath)) {
                targets.add(key);
                pooledFiles.add(indexPath(key));
            }
        }

        Path documentsDir = basePath.resolve(AbstractBackend.DOCUMENTS_DIR);
        if (Files.isDirectory(documentsDir)) {
            String prefix = AbstractBackend.documentFilePrefix(documentId);
            try (Stream<Path> files = Files.list(documentsDir)) {
                files.filter(file -> {
                        String name = file.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith("." + fileExtension)
                            && !pooledFiles.contains(file);
                    })
                    .flatMap(file -> VectorBackendFactory.describeIndexFile(file, basePath, logger).stream())
                    .filter(described -> described.documentId() != null && described.documentId() == documentId)
                    .forEach(described -> targets.add(PoolKey.of(described)));
            } catch (IOException e) {
                throw new VectorStoreException("Failed to list document indexes in " + documentsDir, e);
            }
        }
        return targets;
    }

    /**
     * Removes chunks from a model's corpus index.
     *
     * @return CompletableFuture containing the number of vectors removed
     */
    public CompletableFuture<Integer> deleteChunks(String modelName, int dimension, Collection<Long> chunkIds) {
        if (modelName == null || modelName.isBlank()) {
            return CompletableFuture.failedFuture(new ValidationException("modelName is required"));
        }
        if (dimension <= 0) {
            return CompletableFuture.failedFuture(new ValidationException("dimension must be positive"));
        }
        PoolKey key = PoolKey.modelKey(modelName, dimension, basePath);
        List<Long> ids = List.copyOf(chunkIds);
        return CompletableFuture.supplyAsync(() -> isIndexed(key), executor)
            .thenCompose(indexed -> indexed
                ? withBackend(key, backend -> backend.deleteVectors(ids))
                : CompletableFuture.completedFuture(0));
    }

    @Override
    public CompletableFuture<IndexStats> getIndexStats() {
        String model = currentModel;
        int dimension = currentDimension;
        if (model == null || dimension <= 0) {
            return CompletableFuture.completedFuture(IndexStats.uninitialized(model));
        }
        PoolKey key = PoolKey.modelKey(model, dimension, basePath);
        return CompletableFuture.supplyAsync(() -> isIndexed(key), executor)
            .thenCompose(indexed -> indexed
                ? withBackend(key, BackendStrategy::getStats).thenApply(stats -> stats.withCurrentModel(model))
                : CompletableFuture.completedFuture(IndexStats.uninitialized(model)));
    }

    @Override
    public CompletableFuture<Void> switchModel(String modelName, int dimension) {
        if (modelName == null || modelName.isBlank()) {
            return CompletableFuture.failedFuture(new ValidationException("modelName is required"));
        }
        if (dimension <= 0) {
            return CompletableFuture.failedFuture(new ValidationException("dimension must be positive"));
        }
        String previousModel = currentModel;
        int previousDimension = currentDimension;
        CompletableFuture<Void> flush = CompletableFuture.completedFuture(null);
        if (previousModel != null && previousDimension > 0) {
            PoolKey previous = PoolKey.modelKey(previousModel, previousDimension, basePath);
            if (pool.contains(previous)) {
                flush = withBackend(previous, BackendStrategy::saveIndex);
            }
        }
        PoolKey next = PoolKey.modelKey(modelName, dimension, basePath);
        return flush
            .thenCompose(v -> withBackend(next, backend -> CompletableFuture.<Void>completedFuture(null)))
            .thenRun(() -> {
                useModel(modelName, dimension);
                logger.info("Switched to model " + modelName + " (" + dimension + " dimensions)");
            });
    }

    @Override
    public CompletableFuture<Void> saveIndex() {
        return withCurrentIndex(BackendStrategy::saveIndex);
    }

    @Override
    public CompletableFuture<Void> resetIndex() {
        return withCurrentIndex(BackendStrategy::resetIndex);
    }

    @Override
    public CompletableFuture<Void> optimizeIndex() {
        return withCurrentIndex(BackendStrategy::optimizeIndex);
    }

    @Override
    public CompletableFuture<Void> backupIndex(Path target) {
        if (target == null) {
            return CompletableFuture.failedFuture(new ValidationException("Backup target is required"));
        }
        return withCurrentIndex(backend -> backend.backupIndex(target));
    }

    @Override
    public CompletableFuture<Void> restoreIndex(Path source) {
        if (source == null) {
            return CompletableFuture.failedFuture(new ValidationException("Backup source is required"));
        }
        return withCurrentIndex(backend -> backend.restoreIndex(source));
    }

    public PoolStats getPoolStats() {
        return pool.stats();
    }

    /**
     * Releases every pooled backend. Indexes reopen lazily on the next call.
     */
    public CompletableFuture<Void> clearPool() {
        return pool.clearAll();
    }

    public Path documentIndexPath(long documentId, String modelName, int dimension) {
        return AbstractBackend.documentIndexPath(basePath, documentId, modelName, dimension, fileExtension);
    }

    public Path modelIndexPath(String modelName, int dimension) {
        return AbstractBackend.modelIndexPath(basePath, modelName, dimension, fileExtension);
    }

    public Optional<String> getCurrentModel() {
        return Optional.ofNullable(currentModel);
    }

    @Override
    public void shutdown() {
        logger.info("Shutting down vector store");
        try {
            pool.clearAll().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted while releasing pooled indexes", e);
        } catch (ExecutionException | TimeoutException e) {
            logger.log(Level.WARNING, "Failed to release pooled indexes", e);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <T> CompletableFuture<T> withBackend(PoolKey key,
                                                 Function<BackendStrategy, CompletableFuture<T>> action) {
        IndexConfig indexConfig = key.toIndexConfig(config.getDefaultIndexType());
        return pool.withInstance(key, indexConfig, VectorStoreFacade::prepare, action);
    }

    /**
     * Runs a maintenance action on the corpus index of the current model.
     */
    private <T> CompletableFuture<T> withCurrentIndex(Function<BackendStrategy, CompletableFuture<T>> action) {
        String model = currentModel;
        int dimension = currentDimension;
        if (model == null || dimension <= 0) {
            return CompletableFuture.failedFuture(
                new ValidationException("No current model, store an embedding or switch model first"));
        }
        return withBackend(PoolKey.modelKey(model, dimension, basePath), action);
    }

    /**
     * Loads the index file if present, otherwise creates it. Runs once per pooled instance.
     */
    private static CompletableFuture<?> prepare(BackendStrategy backend) {
        return backend.initialize().thenCompose(v -> (CompletableFuture<?>) (backend.indexExists()
            ? backend.loadIndex(backend.config())
            : backend.createIndex(backend.config())));
    }

    private boolean isIndexed(PoolKey key) {
        if (pool.contains(key)) {
            return true;
        }
        return Files.exists(indexPath(key));
    }

    private Path indexPath(PoolKey key) {
        return key.isDocumentKey()
            ? documentIndexPath(key.documentId(), key.modelName(), key.dimension())
            : modelIndexPath(key.modelName(), key.dimension());
    }

    private void useModel(String model, int dimension) {
        this.currentModel = model;
        this.currentDimension = dimension;
    }

    private long validate(EmbeddingRecord record) {
        if (record == null) {
            throw new ValidationException("Record cannot be null");
        }
        if (record.chunkId() == null) {
            throw new ValidationException("chunkId is required");
        }
        if (record.documentId() < 0) {
            throw new ValidationException("documentId cannot be negative");
        }
        if (record.model() == null || record.model().isBlank()) {
            throw new ValidationException("model is required");
        }
        if (record.dimensions() <= 0) {
            throw new ValidationException("dimensions must be positive");
        }
        if (record.embedding() == null || record.embedding().length == 0) {
            throw new ValidationException("Embedding cannot be null or empty");
        }
        if (record.embedding().length != record.dimensions()) {
            throw new ValidationException("Embedding has " + record.embedding().length
                + " dimensions, record declares " + record.dimensions());
        }
        return ChunkIds.toIntegral(record.chunkId(), logger);
    }

    private static int validateQuery(float[] query, @Nullable Integer dimension) {
        if (query == null || query.length == 0) {
            throw new ValidationException("Query vector cannot be null or empty");
        }
        if (dimension != null && dimension != query.length) {
            throw new ValidationException("Query has " + query.length + " dimensions, expected " + dimension);
        }
        return query.length;
    }
}
