package org.aincraft.vecstore.api;

/**
 * Base type for failures raised by the vector store.
 * Storage-level SQL failures are wrapped in this type with context.
 */
public class VectorStoreException extends RuntimeException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
