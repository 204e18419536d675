package org.aincraft.vecstore.backend;

/**
 * Lifecycle of a logical index as seen by a backend instance.
 */
public enum IndexState {
    ABSENT,
    CREATING,
    READY,
    /** Ready, but searching by exact scan because sqlite-vec is unavailable. */
    READY_DEGRADED,
    DELETED;

    public boolean isReady() {
        return this == READY || this == READY_DEGRADED;
    }
}
