package org.aincraft.vecstore.api;

/**
 * Rejected input: dimension mismatch, empty vector, malformed table identifier
 * or a missing key field. Always raised before any I/O happens.
 */
public class ValidationException extends VectorStoreException {

    public ValidationException(String message) {
        super(message);
    }
}
