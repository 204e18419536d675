package org.aincraft.vecstore.backend;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.IndexStats;
import org.aincraft.vecstore.api.IntegrityException;
import org.aincraft.vecstore.api.SearchHits;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.api.VectorStoreException;
import org.aincraft.vecstore.storage.record.ChunkIds;
import org.aincraft.vecstore.storage.record.VectorCodec;
import org.aincraft.vecstore.storage.record.VectorEntry;
import org.jetbrains.annotations.Nullable;

/**
 * Backend holding vectors in memory and searching them by exact L2 distance.
 * State is written to a flat binary file on {@link #saveIndex()} and read back on
 * {@link #loadIndex(IndexConfig)}.
 *
 * File layout: magic, version, model name, dimension, document id (-1 for none),
 * vector count, then (chunk id, floats) per vector.
 */
public class InMemoryBackend extends AbstractBackend {
    public static final String EXTENSION = "bin";
    static final int MAGIC = 0x56454353;
    static final int VERSION = 1;

    private final ReadWriteLock indexLock = new ReentrantReadWriteLock();
    private final Map<Long, List<float[]>> vectors = new LinkedHashMap<>();
    private volatile boolean dirty = false;

    public InMemoryBackend(Logger logger, Executor executor, IndexConfig config) {
        super(logger, executor, config);
    }

    @Override
    protected String fileExtension() {
        return EXTENSION;
    }

    @Override
    public CompletableFuture<Path> createIndex(IndexConfig requested) {
        return CompletableFuture.supplyAsync(() -> {
            checkSameIndex(requested);
            indexLock.writeLock().lock();
            try {
                if (!state.isReady()) {
                    if (Files.exists(indexPath())) {
                        readFile(indexPath());
                    } else {
                        vectors.clear();
                        writeFile(indexPath());
                    }
                    state = IndexState.READY;
                    logger.info("Created in-memory index at " + indexPath().toAbsolutePath());
                }
                return indexPath();
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> loadIndex(IndexConfig requested) {
        return CompletableFuture.runAsync(() -> {
            checkSameIndex(requested);
            indexLock.writeLock().lock();
            try {
                if (Files.exists(indexPath())) {
                    readFile(indexPath());
                    logger.info("Loaded " + size() + " vectors from " + indexPath().toAbsolutePath());
                } else {
                    vectors.clear();
                }
                state = IndexState.READY;
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> saveIndex() {
        return CompletableFuture.runAsync(() -> {
            indexLock.readLock().lock();
            try {
                requireReady();
                writeFile(indexPath());
            } finally {
                indexLock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> addVectors(float[] vector, Number chunkId) {
        return CompletableFuture.runAsync(() -> {
            validateDimensions(vector);
            long id = ChunkIds.toIntegral(chunkId, logger);
            indexLock.writeLock().lock();
            try {
                requireReady();
                vectors.computeIfAbsent(id, key -> new ArrayList<>()).add(vector.clone());
                dirty = true;
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Integer> addVectors(List<VectorEntry> entries) {
        return CompletableFuture.supplyAsync(() -> {
            entries.forEach(entry -> validateDimensions(entry.embedding()));
            indexLock.writeLock().lock();
            try {
                requireReady();
                for (VectorEntry entry : entries) {
                    vectors.computeIfAbsent(entry.chunkId(), key -> new ArrayList<>()).add(entry.embedding().clone());
                }
                dirty = dirty || !entries.isEmpty();
                return entries.size();
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<SearchHits> search(float[] query, int k, @Nullable Double distanceThreshold) {
        return CompletableFuture.supplyAsync(() -> {
            validateDimensions(query);
            indexLock.readLock().lock();
            try {
                requireReady();
                int total = size();
                if (total == 0) {
                    return SearchHits.empty();
                }
                int limit = Math.min(k, total);
                if (limit <= 0) {
                    throw new ValidationException("k must be positive, got " + k);
                }

                List<Hit> hits = new ArrayList<>(total);
                for (Map.Entry<Long, List<float[]>> entry : vectors.entrySet()) {
                    for (float[] vector : entry.getValue()) {
                        double distance = VectorCodec.l2(query, vector);
                        if (distanceThreshold == null || distance <= distanceThreshold) {
                            hits.add(new Hit(entry.getKey(), distance));
                        }
                    }
                }
                hits.sort(Comparator.comparingDouble(Hit::distance).thenComparingLong(Hit::chunkId));

                int n = Math.min(limit, hits.size());
                long[] chunkIds = new long[n];
                double[] distances = new double[n];
                for (int i = 0; i < n; i++) {
                    chunkIds[i] = hits.get(i).chunkId();
                    distances[i] = hits.get(i).distance();
                }
                return SearchHits.of(chunkIds, distances);
            } finally {
                indexLock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Integer> deleteVectors(Collection<Long> chunkIds) {
        return CompletableFuture.supplyAsync(() -> {
            indexLock.writeLock().lock();
            try {
                requireReady();
                int removed = 0;
                for (Long chunkId : chunkIds) {
                    List<float[]> stored = vectors.remove(chunkId);
                    if (stored != null) {
                        removed += stored.size();
                    }
                }
                dirty = dirty || removed > 0;
                return removed;
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<List<Long>> listChunkIds() {
        return CompletableFuture.supplyAsync(() -> {
            indexLock.readLock().lock();
            try {
                requireReady();
                List<Long> ids = new ArrayList<>(vectors.keySet());
                ids.sort(null);
                return ids;
            } finally {
                indexLock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<IndexStats> getStats() {
        return CompletableFuture.supplyAsync(() -> {
            indexLock.readLock().lock();
            try {
                return new IndexStats(size(), config.dimension(), config.indexType(), state.isReady(),
                    config.modelName());
            } finally {
                indexLock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> resetIndex() {
        return CompletableFuture.runAsync(() -> {
            indexLock.writeLock().lock();
            try {
                requireReady();
                vectors.clear();
                writeFile(indexPath());
                logger.info("Reset in-memory index " + indexPath());
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> optimizeIndex() {
        return CompletableFuture.runAsync(() -> {
            indexLock.writeLock().lock();
            try {
                requireReady();
                vectors.values().removeIf(List::isEmpty);
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> backupIndex(Path target) {
        return CompletableFuture.runAsync(() -> {
            indexLock.readLock().lock();
            try {
                requireReady();
                writeFile(target);
                logger.info("Backed up " + indexPath() + " to " + target);
            } finally {
                indexLock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> restoreIndex(Path source) {
        return CompletableFuture.runAsync(() -> {
            if (!Files.isRegularFile(source)) {
                throw new VectorStoreException("Backup file not found: " + source);
            }
            indexLock.writeLock().lock();
            try {
                readFile(source);
                writeFile(indexPath());
                state = IndexState.READY;
                logger.info("Restored " + indexPath() + " from " + source);
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> cleanup() {
        return CompletableFuture.runAsync(() -> {
            indexLock.writeLock().lock();
            try {
                if (state.isReady() && dirty) {
                    writeFile(indexPath());
                }
                vectors.clear();
                if (state != IndexState.DELETED) {
                    state = IndexState.ABSENT;
                }
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> deleteDocumentIndex(long documentId) {
        return CompletableFuture.runAsync(() -> {
            Path path = documentIndexPath(documentId);
            indexLock.writeLock().lock();
            try {
                if (config.isDocumentIndex() && config.documentId() == documentId) {
                    vectors.clear();
                    dirty = false;
                    state = IndexState.DELETED;
                }
                if (Files.deleteIfExists(path)) {
                    logger.info("Deleted document index " + path);
                }
            } catch (IOException e) {
                throw new VectorStoreException("Failed to delete document index " + path, e);
            } finally {
                indexLock.writeLock().unlock();
            }
        }, executor);
    }

    private int size() {
        int total = 0;
        for (List<float[]> stored : vectors.values()) {
            total += stored.size();
        }
        return total;
    }

    private void requireReady() {
        if (!state.isReady()) {
            throw new VectorStoreException("Index " + indexPath() + " is not loaded (" + state + ")");
        }
    }

    private void writeFile(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp);
                 DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(out))) {
                dos.writeInt(MAGIC);
                dos.writeInt(VERSION);
                dos.writeUTF(config.modelName());
                dos.writeInt(config.dimension());
                dos.writeLong(config.documentId() == null ? -1L : config.documentId());
                dos.writeInt(size());
                for (Map.Entry<Long, List<float[]>> entry : vectors.entrySet()) {
                    for (float[] vector : entry.getValue()) {
                        dos.writeLong(entry.getKey());
                        for (float v : vector) {
                            dos.writeFloat(v);
                        }
                    }
                }
            }
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            dirty = false;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to write " + path, e);
            throw new VectorStoreException("Failed to write index file " + path, e);
        }
    }

    private void readFile(Path path) {
        try (InputStream in = Files.newInputStream(path);
             DataInputStream dis = new DataInputStream(new BufferedInputStream(in))) {
            Header header = readHeader(dis, path);
            if (!header.modelName().equals(config.modelName()) || header.dimension() != config.dimension()) {
                throw new IntegrityException("Index file " + path + " holds " + header.modelName() + "/"
                    + header.dimension() + ", expected " + config.modelName() + "/" + config.dimension());
            }
            Map<Long, List<float[]>> loaded = new LinkedHashMap<>();
            for (int i = 0; i < header.count(); i++) {
                long chunkId = dis.readLong();
                float[] vector = new float[header.dimension()];
                for (int d = 0; d < vector.length; d++) {
                    vector[d] = dis.readFloat();
                }
                loaded.computeIfAbsent(chunkId, key -> new ArrayList<>()).add(vector);
            }
            vectors.clear();
            vectors.putAll(loaded);
            dirty = false;
        } catch (IOException e) {
            throw new IntegrityException("Failed to read index file " + path, e);
        }
    }

    /**
     * Reads only the identity stored in an index file's header.
     */
    static Optional<IndexConfig> describe(Path path, Path basePath) {
        try (InputStream in = Files.newInputStream(path);
             DataInputStream dis = new DataInputStream(new BufferedInputStream(in))) {
            Header header = readHeader(dis, path);
            Long documentId = header.documentId() < 0 ? null : header.documentId();
            return Optional.of(new IndexConfig(header.modelName(), header.dimension(), documentId, basePath, "flat"));
        } catch (IOException e) {
            throw new IntegrityException("Failed to read index header of " + path, e);
        }
    }

    private static Header readHeader(DataInputStream dis, Path path) throws IOException {
        int magic = dis.readInt();
        if (magic != MAGIC) {
            throw new IntegrityException("Not a vector index file: " + path);
        }
        int version = dis.readInt();
        if (version != VERSION) {
            throw new IntegrityException("Unsupported index file version " + version + " in " + path);
        }
        String modelName = dis.readUTF();
        int dimension = dis.readInt();
        long documentId = dis.readLong();
        int count = dis.readInt();
        if (dimension <= 0 || count < 0) {
            throw new IntegrityException("Corrupt header in " + path);
        }
        return new Header(modelName, dimension, documentId, count);
    }

    private record Header(String modelName, int dimension, long documentId, int count) {
    }

    private record Hit(long chunkId, double distance) {
    }
}
