package org.aincraft.vecstore.storage.index;

/**
 * Whether the sqlite-vec extension could be loaded for a database.
 */
public enum Capability {
    /** vec0 virtual tables and the native distance functions are available. */
    ACCELERATED,
    /** Plain tables with an exact L2 scan. */
    BRUTE_FORCE;

    public boolean isAccelerated() {
        return this == ACCELERATED;
    }
}
