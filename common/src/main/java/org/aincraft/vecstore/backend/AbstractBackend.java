package org.aincraft.vecstore.backend;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.aincraft.vecstore.api.SearchHits;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.api.VectorStoreException;

/**
 * Path layout, validation and state shared by the backends.
 *
 * Index files live at {@code <base>/models/index_<model>_<dim>.<ext>} and
 * {@code <base>/documents/index_doc_<documentId>_<model>_<dim>.<ext>}.
 */
public abstract class AbstractBackend implements BackendStrategy {
    public static final String MODELS_DIR = "models";
    public static final String DOCUMENTS_DIR = "documents";
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final int NAME_HASH_LENGTH = 8;

    protected final Logger logger;
    protected final Executor executor;
    protected final IndexConfig config;
    protected volatile IndexState state = IndexState.ABSENT;

    protected AbstractBackend(Logger logger, Executor executor, IndexConfig config) {
        this.logger = Preconditions.checkNotNull(logger, "logger cannot be null");
        this.executor = Preconditions.checkNotNull(executor, "executor cannot be null");
        validateConfig(config);
        this.config = config;
    }

    /**
     * File extension without the dot.
     */
    protected abstract String fileExtension();

    /**
     * File-safe form of a model name. A name that had to be rewritten gets a hash of the
     * original appended, so "org/m" and "org_m" map to different files.
     */
    public static String sanitizeModelName(String modelName) {
        String sanitized = UNSAFE_FILE_CHARS.matcher(modelName).replaceAll("_");
        if (sanitized.equals(modelName)) {
            return sanitized;
        }
        String hash = Hashing.sha256().hashString(modelName, StandardCharsets.UTF_8).toString();
        return sanitized + "_" + hash.substring(0, NAME_HASH_LENGTH);
    }

    public static Path modelIndexPath(Path basePath, String modelName, int dimension, String extension) {
        return basePath.resolve(MODELS_DIR)
            .resolve("index_" + sanitizeModelName(modelName) + "_" + dimension + "." + extension);
    }

    public static Path documentIndexPath(Path basePath, long documentId, String modelName, int dimension,
                                         String extension) {
        return basePath.resolve(DOCUMENTS_DIR)
            .resolve("index_doc_" + documentId + "_" + sanitizeModelName(modelName) + "_" + dimension + "." + extension);
    }

    /**
     * File name prefix shared by every index file of a document.
     */
    public static String documentFilePrefix(long documentId) {
        return "index_doc_" + documentId + "_";
    }

    public Path indexPath() {
        return config.isDocumentIndex()
            ? documentIndexPath(config.basePath(), config.documentId(), config.modelName(), config.dimension(), fileExtension())
            : modelIndexPath(config.basePath(), config.modelName(), config.dimension(), fileExtension());
    }

    protected Path documentIndexPath(long documentId) {
        return documentIndexPath(config.basePath(), documentId, config.modelName(), config.dimension(), fileExtension());
    }

    protected void validateDimensions(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new ValidationException("Vector cannot be empty");
        }
        if (vector.length != config.dimension()) {
            throw new ValidationException("Vector has " + vector.length + " dimensions, index "
                + config.modelName() + " expects " + config.dimension());
        }
    }

    protected static void validateConfig(IndexConfig config) {
        if (config == null) {
            throw new ValidationException("Index config is required");
        }
        if (config.modelName().isBlank()) {
            throw new ValidationException("modelName is required");
        }
        if (config.dimension() <= 0) {
            throw new ValidationException("dimension must be positive, got " + config.dimension());
        }
        if (config.documentId() != null && config.documentId() < 0) {
            throw new ValidationException("documentId cannot be negative, got " + config.documentId());
        }
    }

    /**
     * Rejects a config that names a different index than the one this instance was built for.
     */
    protected void checkSameIndex(IndexConfig requested) {
        validateConfig(requested);
        if (!requested.modelName().equals(config.modelName())
            || requested.dimension() != config.dimension()
            || !Objects.equals(requested.documentId(), config.documentId())
            || !requested.basePath().equals(config.basePath())) {
            throw new ValidationException("Backend for " + config + " cannot open " + requested);
        }
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(indexPath().toAbsolutePath().getParent());
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to create index directory for " + indexPath(), e);
                throw new VectorStoreException("Backend initialization failed", e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Boolean> documentIndexExists(long documentId) {
        return CompletableFuture.supplyAsync(() -> Files.exists(documentIndexPath(documentId)), executor);
    }

    @Override
    public boolean indexExists() {
        return Files.exists(indexPath());
    }

    @Override
    public long getIndexFileSize() {
        Path path = indexPath();
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read size of " + path, e);
            return 0L;
        }
    }

    @Override
    public CompletableFuture<SearchHits> search(float[] query, int k) {
        return search(query, k, null);
    }

    @Override
    public IndexState state() {
        return state;
    }

    @Override
    public IndexConfig config() {
        return config;
    }
}
