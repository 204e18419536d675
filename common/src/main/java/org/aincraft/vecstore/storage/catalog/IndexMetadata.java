package org.aincraft.vecstore.storage.catalog;

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Catalog row describing one logical index.
 */
public record IndexMetadata(
    long id,
    @Nullable Long documentId,
    String modelName,
    int dimension,
    TableIdentifier table,
    String indexType,
    long totalVectors,
    long createdAt
) {
    public IndexMetadata {
        Preconditions.checkNotNull(modelName, "modelName cannot be null");
        Preconditions.checkNotNull(table, "table cannot be null");
        Preconditions.checkNotNull(indexType, "indexType cannot be null");
        Preconditions.checkArgument(dimension > 0, "dimension must be positive");
    }

    public boolean matches(@Nullable Long documentId, String modelName, int dimension) {
        return Objects.equals(this.documentId, documentId)
            && this.modelName.equals(modelName)
            && this.dimension == dimension;
    }
}
