package org.aincraft.vecstore.api;

/**
 * The accelerated index could not be created or the extension is unavailable.
 * Storage code logs and absorbs this, continuing in brute-force mode.
 */
public class SchemaException extends VectorStoreException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
