package org.aincraft.vecstore.storage.record;

import com.google.common.base.Preconditions;

/**
 * One (chunk id, vector) pair for a batch insert.
 */
public record VectorEntry(long chunkId, float[] embedding) {
    public VectorEntry {
        Preconditions.checkNotNull(embedding, "embedding cannot be null");
    }
}
