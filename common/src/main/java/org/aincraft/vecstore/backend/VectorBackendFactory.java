package org.aincraft.vecstore.backend;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.logging.Logger;
import org.aincraft.vecstore.config.VectorStoreConfig;
import org.aincraft.vecstore.storage.SqliteDatabase;
import org.aincraft.vecstore.storage.catalog.IndexMetadata;
import org.aincraft.vecstore.storage.catalog.MetadataCatalog;
import org.aincraft.vecstore.storage.index.Capability;

public class VectorBackendFactory {
    private VectorBackendFactory() {
    }

    public static BackendFactory create(VectorStoreConfig config, Logger logger, Executor executor) {
        BackendType type = resolveType(config, logger);
        return switch (type) {
            case MEMORY -> indexConfig -> new InMemoryBackend(logger, executor, indexConfig);
            case SQLITE_VEC -> {
                String extensionPath = config.getSqliteExtensionPath();
                int busyTimeoutMs = config.getSqliteBusyTimeoutMs();
                yield indexConfig -> new SqliteVecBackend(logger, executor, indexConfig, extensionPath, busyTimeoutMs);
            }
        };
    }

    public static BackendType resolveType(VectorStoreConfig config, Logger logger) {
        String backend = config.getBackend();
        BackendType type = BackendType.fromId(backend);
        if (type == null) {
            logger.warning("Unknown storage backend: " + backend + ", using sqlite-vec");
            return BackendType.SQLITE_VEC;
        }
        return type;
    }

    /**
     * Reads the identity of an index file without keeping it open.
     * Used to find document indexes that exist only on disk.
     *
     * @return one identity per catalog row, empty if the file holds none
     */
    public static List<IndexConfig> describeIndexFile(Path file, Path basePath, Logger logger) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        String name = file.getFileName().toString();
        if (name.endsWith("." + InMemoryBackend.EXTENSION)) {
            return InMemoryBackend.describe(file, basePath).map(List::of).orElse(List.of());
        }
        if (name.endsWith("." + SqliteVecBackend.EXTENSION)) {
            try (SqliteDatabase database = SqliteDatabase.open(logger, file, Capability.BRUTE_FORCE, "", 5000)) {
                MetadataCatalog catalog = new MetadataCatalog(database, logger);
                catalog.initialize();
                List<IndexMetadata> rows = catalog.listAll();
                return rows.stream()
                    .map(row -> new IndexConfig(row.modelName(), row.dimension(), row.documentId(), basePath,
                        row.indexType()))
                    .toList();
            }
        }
        return List.of();
    }
}
