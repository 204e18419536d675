package org.aincraft.vecstore.pool;

import java.util.List;

public record PoolStats(int size, int maxInstances, long created, long evicted, List<String> keys) {
    public PoolStats {
        keys = List.copyOf(keys);
    }
}
