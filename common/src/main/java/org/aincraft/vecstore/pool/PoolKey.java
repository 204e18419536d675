package org.aincraft.vecstore.pool;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.aincraft.vecstore.backend.IndexConfig;
import org.jetbrains.annotations.Nullable;

/**
 * Identity of a pooled backend: (model, dimension, optional document, base path).
 */
public record PoolKey(String modelName, int dimension, @Nullable Long documentId, Path basePath) {

    public PoolKey {
        Preconditions.checkNotNull(modelName, "modelName cannot be null");
        Preconditions.checkNotNull(basePath, "basePath cannot be null");
        basePath = basePath.toAbsolutePath().normalize();
    }

    public static PoolKey modelKey(String modelName, int dimension, Path basePath) {
        return new PoolKey(modelName, dimension, null, basePath);
    }

    public static PoolKey documentKey(long documentId, String modelName, int dimension, Path basePath) {
        return new PoolKey(modelName, dimension, documentId, basePath);
    }

    public static PoolKey of(IndexConfig config) {
        return new PoolKey(config.modelName(), config.dimension(), config.documentId(), config.basePath());
    }

    public boolean isDocumentKey() {
        return documentId != null;
    }

    public IndexConfig toIndexConfig(String indexType) {
        return new IndexConfig(modelName, dimension, documentId, basePath, indexType);
    }

    @Override
    public String toString() {
        String pathHash = Hashing.sha256()
            .hashString(basePath.toString(), StandardCharsets.UTF_8)
            .toString()
            .substring(0, 8);
        return documentId != null
            ? "doc_" + documentId + "_" + modelName + "_" + dimension + "_" + pathHash
            : "model_" + modelName + "_" + dimension + "_" + pathHash;
    }
}
