package org.aincraft.vecstore.api;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * Result of a k-nearest-neighbour query as parallel arrays.
 * {@code distances} are ascending and {@code indices[i] == i} is a positional rank, not a row id.
 */
public record SearchHits(long[] chunkIds, double[] distances, int[] indices) {
    private static final SearchHits EMPTY = new SearchHits(new long[0], new double[0], new int[0]);

    public SearchHits {
        Preconditions.checkNotNull(chunkIds, "chunkIds cannot be null");
        Preconditions.checkNotNull(distances, "distances cannot be null");
        Preconditions.checkNotNull(indices, "indices cannot be null");
        Preconditions.checkArgument(chunkIds.length == distances.length && chunkIds.length == indices.length,
            "Result arrays must have the same length");
    }

    public static SearchHits empty() {
        return EMPTY;
    }

    public static SearchHits of(long[] chunkIds, double[] distances) {
        int[] indices = new int[chunkIds.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        return new SearchHits(chunkIds, distances, indices);
    }

    public int size() {
        return chunkIds.length;
    }

    public boolean isEmpty() {
        return chunkIds.length == 0;
    }

    public boolean containsChunk(long chunkId) {
        for (long id : chunkIds) {
            if (id == chunkId) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "SearchHits{chunkIds=" + Arrays.toString(chunkIds)
            + ", distances=" + Arrays.toString(distances) + "}";
    }
}
