package org.aincraft.vecstore.storage.index;

public enum TableKind {
    MISSING,
    ACCELERATED,
    BASE
}
