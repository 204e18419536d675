package org.aincraft.vecstore.backend;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * Identity of one logical index: model, dimension, optional document and the storage root.
 */
public record IndexConfig(
    String modelName,
    int dimension,
    @Nullable Long documentId,
    Path basePath,
    String indexType
) {
    public IndexConfig {
        Preconditions.checkNotNull(modelName, "modelName cannot be null");
        Preconditions.checkNotNull(basePath, "basePath cannot be null");
        Preconditions.checkNotNull(indexType, "indexType cannot be null");
    }

    public static IndexConfig forModel(String modelName, int dimension, Path basePath) {
        return new IndexConfig(modelName, dimension, null, basePath, "flat");
    }

    public static IndexConfig forDocument(long documentId, String modelName, int dimension, Path basePath) {
        return new IndexConfig(modelName, dimension, documentId, basePath, "flat");
    }

    public boolean isDocumentIndex() {
        return documentId != null;
    }
}
