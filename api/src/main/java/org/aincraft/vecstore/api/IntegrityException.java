package org.aincraft.vecstore.api;

/**
 * Stored state is inconsistent: colliding metadata rows or a corrupt embedding buffer.
 * Never recovered automatically.
 */
public class IntegrityException extends VectorStoreException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
