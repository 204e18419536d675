package org.aincraft.vecstore.backend;

/**
 * Builds a backend for a logical index. Instances are not initialized yet.
 */
@FunctionalInterface
public interface BackendFactory {

    BackendStrategy create(IndexConfig config);
}
