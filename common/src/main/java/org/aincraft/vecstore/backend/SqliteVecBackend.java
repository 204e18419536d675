package org.aincraft.vecstore.backend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.IndexStats;
import org.aincraft.vecstore.api.SearchHits;
import org.aincraft.vecstore.api.VectorStoreException;
import org.aincraft.vecstore.storage.SqliteDatabase;
import org.aincraft.vecstore.storage.catalog.CatalogOptions;
import org.aincraft.vecstore.storage.catalog.IndexMetadata;
import org.aincraft.vecstore.storage.catalog.MetadataCatalog;
import org.aincraft.vecstore.storage.index.Capability;
import org.aincraft.vecstore.storage.index.ExtensionProbe;
import org.aincraft.vecstore.storage.index.TableKind;
import org.aincraft.vecstore.storage.index.VirtualIndexManager;
import org.aincraft.vecstore.storage.record.VectorEntry;
import org.aincraft.vecstore.storage.record.VectorRecordStore;
import org.jetbrains.annotations.Nullable;

/**
 * Backend keeping one logical index in its own SQLite file.
 *
 * Each file holds the {@code vector_metadata} catalog and one vector table. With the
 * sqlite-vec extension loaded the table is a {@code vec0} virtual table searched by KNN,
 * otherwise a plain table searched by an exact L2 scan.
 *
 * Thread-safe: a ReadWriteLock keeps reads and writes away from open/close/restore.
 */
public class SqliteVecBackend extends AbstractBackend {
    public static final String EXTENSION = "db";

    private final String extensionPath;
    private final int busyTimeoutMs;
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();

    private Capability capability;
    private SqliteDatabase database;
    private MetadataCatalog catalog;
    private VirtualIndexManager indexManager;
    private VectorRecordStore records;
    private IndexMetadata metadata;

    public SqliteVecBackend(Logger logger, Executor executor, IndexConfig config,
                            String extensionPath, int busyTimeoutMs) {
        super(logger, executor, config);
        this.extensionPath = extensionPath == null ? "" : extensionPath;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    @Override
    protected String fileExtension() {
        return EXTENSION;
    }

    @Override
    public CompletableFuture<Path> createIndex(IndexConfig requested) {
        return CompletableFuture.supplyAsync(() -> {
            checkSameIndex(requested);
            withWriteLock(this::open);
            return indexPath();
        }, executor);
    }

    @Override
    public CompletableFuture<Void> loadIndex(IndexConfig requested) {
        return CompletableFuture.runAsync(() -> {
            checkSameIndex(requested);
            withWriteLock(this::open);
        }, executor);
    }

    /**
     * Opens the file, registers the catalog row and makes sure the vector table exists.
     * Idempotent while the database is open.
     */
    private void open() {
        if (database != null && database.isOpen() && state.isReady()) {
            return;
        }
        state = IndexState.CREATING;
        try {
            if (capability == null) {
                capability = ExtensionProbe.probe(logger, extensionPath);
            }
            database = SqliteDatabase.open(logger, indexPath(), capability, extensionPath, busyTimeoutMs);
            catalog = new MetadataCatalog(database, logger);
            indexManager = new VirtualIndexManager(database, logger);
            records = new VectorRecordStore(database, logger);

            catalog.initialize();
            CatalogOptions options = config.isDocumentIndex()
                ? CatalogOptions.forDocument(config.documentId())
                : CatalogOptions.defaults();
            metadata = catalog.getOrCreateMetadata(config.modelName(), config.dimension(),
                options.withIndexType(config.indexType()));

            TableKind kind = indexManager.ensureTable(metadata.table(), config.dimension());
            if (kind == TableKind.BASE && indexManager.migrate(metadata.table(), config.dimension())) {
                kind = TableKind.ACCELERATED;
            }
            if (kind == TableKind.ACCELERATED && !capability.isAccelerated()) {
                logger.warning("Index " + metadata.table() + " was built with sqlite-vec, which is not loaded; "
                    + "searches will fail until the extension is configured");
            }
            state = kind == TableKind.ACCELERATED ? IndexState.READY : IndexState.READY_DEGRADED;
            logger.info("Opened index " + metadata.table() + " at " + indexPath().toAbsolutePath()
                + " (" + state + ")");
        } catch (RuntimeException e) {
            state = IndexState.ABSENT;
            closeDatabase();
            logger.log(Level.SEVERE, "Failed to open index " + indexPath(), e);
            throw e;
        }
    }

    @Override
    public CompletableFuture<Void> saveIndex() {
        return CompletableFuture.runAsync(() -> withReadLock(() -> {
            requireReady();
            try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
                st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
            } catch (SQLException e) {
                throw new VectorStoreException("Checkpoint failed for " + indexPath(), e);
            }
        }), executor);
    }

    @Override
    public CompletableFuture<Void> addVectors(float[] vector, Number chunkId) {
        return CompletableFuture.runAsync(() -> withReadLock(() -> {
            validateDimensions(vector);
            requireReady();
            records.addVector(metadata.table(), chunkId, vector, config.dimension());
            catalog.incrementVectorCount(metadata.id(), 1);
        }), executor);
    }

    @Override
    public CompletableFuture<Integer> addVectors(List<VectorEntry> entries) {
        return CompletableFuture.supplyAsync(() -> readLocked(() -> {
            entries.forEach(entry -> validateDimensions(entry.embedding()));
            requireReady();
            int added = records.addVectors(metadata.table(), entries, config.dimension());
            catalog.incrementVectorCount(metadata.id(), added);
            return added;
        }), executor);
    }

    @Override
    public CompletableFuture<SearchHits> search(float[] query, int k, @Nullable Double distanceThreshold) {
        return CompletableFuture.supplyAsync(() -> readLocked(() -> {
            validateDimensions(query);
            requireReady();
            return records.search(metadata.table(), query, k, config.dimension(), distanceThreshold);
        }), executor);
    }

    @Override
    public CompletableFuture<Integer> deleteVectors(Collection<Long> chunkIds) {
        return CompletableFuture.supplyAsync(() -> readLocked(() -> {
            requireReady();
            int removed = records.deleteByChunkIds(metadata.table(), chunkIds);
            if (removed > 0) {
                catalog.incrementVectorCount(metadata.id(), -removed);
            }
            return removed;
        }), executor);
    }

    @Override
    public CompletableFuture<List<Long>> listChunkIds() {
        return CompletableFuture.supplyAsync(() -> readLocked(() -> {
            requireReady();
            return records.listChunkIds(metadata.table());
        }), executor);
    }

    @Override
    public CompletableFuture<IndexStats> getStats() {
        return CompletableFuture.supplyAsync(() -> readLocked(() -> {
            if (!state.isReady()) {
                return new IndexStats(0, config.dimension(), config.indexType(), false, config.modelName());
            }
            long total = records.count(metadata.table());
            return new IndexStats(total, metadata.dimension(), metadata.indexType(), true, config.modelName());
        }), executor);
    }

    @Override
    public CompletableFuture<Void> resetIndex() {
        return CompletableFuture.runAsync(() -> withWriteLock(() -> {
            requireReady();
            indexManager.dropTable(metadata.table());
            catalog.deleteMetadata(metadata.id());
            state = IndexState.ABSENT;
            closeDatabase();
            open();
            logger.info("Reset index " + metadata.table());
        }), executor);
    }

    @Override
    public CompletableFuture<Void> optimizeIndex() {
        return CompletableFuture.runAsync(() -> withWriteLock(() -> {
            requireReady();
            try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
                st.execute("VACUUM");
                st.execute("ANALYZE");
            } catch (SQLException e) {
                throw new VectorStoreException("Optimize failed for " + indexPath(), e);
            }
            logger.fine("Optimized " + indexPath());
        }), executor);
    }

    @Override
    public CompletableFuture<Void> backupIndex(Path target) {
        return CompletableFuture.runAsync(() -> withReadLock(() -> {
            requireReady();
            try {
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                // VACUUM INTO refuses to overwrite
                Files.deleteIfExists(target);
            } catch (IOException e) {
                throw new VectorStoreException("Failed to prepare backup target " + target, e);
            }
            try (Connection c = database.getConnection();
                 PreparedStatement ps = c.prepareStatement("VACUUM INTO ?")) {
                ps.setString(1, target.toAbsolutePath().toString());
                ps.execute();
            } catch (SQLException e) {
                throw new VectorStoreException("Backup of " + indexPath() + " failed", e);
            }
            logger.info("Backed up " + indexPath() + " to " + target);
        }), executor);
    }

    @Override
    public CompletableFuture<Void> restoreIndex(Path source) {
        return CompletableFuture.runAsync(() -> withWriteLock(() -> {
            if (!Files.isRegularFile(source)) {
                throw new VectorStoreException("Backup file not found: " + source);
            }
            state = IndexState.ABSENT;
            closeDatabase();
            Path target = indexPath();
            try {
                deleteSidecars(target);
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new VectorStoreException("Failed to restore " + target + " from " + source, e);
            }
            open();
            logger.info("Restored " + target + " from " + source);
        }), executor);
    }

    @Override
    public CompletableFuture<Void> cleanup() {
        return CompletableFuture.runAsync(() -> withWriteLock(() -> {
            closeDatabase();
            if (state != IndexState.DELETED) {
                state = IndexState.ABSENT;
            }
        }), executor);
    }

    @Override
    public CompletableFuture<Void> deleteDocumentIndex(long documentId) {
        return CompletableFuture.runAsync(() -> withWriteLock(() -> {
            Path path = documentIndexPath(documentId);
            boolean own = config.isDocumentIndex() && config.documentId() == documentId;
            if (own && database != null && database.isOpen() && metadata != null) {
                indexManager.dropTable(metadata.table());
                catalog.deleteMetadata(metadata.id());
            }
            if (own) {
                closeDatabase();
                state = IndexState.DELETED;
            }
            try {
                boolean deleted = Files.deleteIfExists(path);
                deleteSidecars(path);
                if (deleted) {
                    logger.info("Deleted document index " + path);
                }
            } catch (IOException e) {
                throw new VectorStoreException("Failed to delete document index " + path, e);
            }
        }), executor);
    }

    @Nullable
    public Capability capability() {
        return capability;
    }

    private void requireReady() {
        if (!state.isReady() || database == null) {
            throw new VectorStoreException("Index " + indexPath() + " is not loaded (" + state + ")");
        }
    }

    private void closeDatabase() {
        if (database != null) {
            database.close();
            database = null;
        }
    }

    private static void deleteSidecars(Path file) throws IOException {
        Files.deleteIfExists(file.resolveSibling(file.getFileName() + "-wal"));
        Files.deleteIfExists(file.resolveSibling(file.getFileName() + "-shm"));
    }

    private void withReadLock(Runnable action) {
        lifecycleLock.readLock().lock();
        try {
            action.run();
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private <T> T readLocked(Supplier<T> action) {
        lifecycleLock.readLock().lock();
        try {
            return action.get();
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private void withWriteLock(Runnable action) {
        lifecycleLock.writeLock().lock();
        try {
            action.run();
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }
}
