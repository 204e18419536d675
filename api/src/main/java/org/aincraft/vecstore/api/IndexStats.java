package org.aincraft.vecstore.api;

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.Nullable;

public record IndexStats(
    long totalVectors,
    int dimension,
    String indexType,
    boolean initialized,
    @Nullable String currentModel
) {
    public IndexStats {
        Preconditions.checkNotNull(indexType, "Index type cannot be null");
        Preconditions.checkArgument(totalVectors >= 0, "totalVectors cannot be negative");
    }

    public static IndexStats uninitialized(@Nullable String currentModel) {
        return new IndexStats(0, 0, "unknown", false, currentModel);
    }

    public IndexStats withCurrentModel(@Nullable String model) {
        return new IndexStats(totalVectors, dimension, indexType, initialized, model);
    }
}
