package org.aincraft.vecstore.api;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * One chunk embedding handed over by the embedding producer.
 *
 * The chunk id is a {@link Number} because producers sometimes hand over floating point ids;
 * the store truncates those explicitly and logs a warning.
 */
public record EmbeddingRecord(
    Number chunkId,
    long documentId,
    @Nullable String content,
    float[] embedding,
    String model,
    int dimensions,
    Map<String, Object> metadata
) {
    public EmbeddingRecord {
        // Validation happens in the store so that failures surface as ValidationException
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public EmbeddingRecord(Number chunkId, long documentId, float[] embedding, String model, int dimensions) {
        this(chunkId, documentId, null, embedding, model, dimensions, Map.of());
    }
}
