package org.aincraft.vecstore.storage.catalog;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.IntegrityException;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.api.VectorStoreException;
import org.aincraft.vecstore.storage.SqliteDatabase;
import org.jetbrains.annotations.Nullable;

/**
 * Registry of logical indexes stored in {@code vector_metadata}.
 * Synchronous API - wrap in CompletableFuture at call site if async needed.
 */
public class MetadataCatalog {
    private static final String COLUMNS =
        "id, document_id, model_name, dimension, table_name, index_type, total_vectors, created_at";

    private final SqliteDatabase database;
    private final Logger logger;
    private final Striped<Lock> creationLocks = Striped.lock(16);

    public MetadataCatalog(SqliteDatabase database, Logger logger) {
        this.database = database;
        this.logger = logger;
    }

    public void initialize() {
        try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS vector_metadata (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    document_id INTEGER,
                    model_name TEXT NOT NULL,
                    dimension INTEGER NOT NULL,
                    table_name TEXT NOT NULL UNIQUE,
                    index_type TEXT NOT NULL DEFAULT 'flat',
                    total_vectors INTEGER NOT NULL DEFAULT 0,
                    created_at INTEGER NOT NULL
                )
                """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_vm_model ON vector_metadata(model_name, dimension)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_vm_document ON vector_metadata(document_id)");
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to initialize vector metadata", e);
        }
    }

    /**
     * Returns the row for the key, creating it with zero vectors if absent.
     * Concurrent calls with the same key observe the same row.
     *
     * @throws IntegrityException if the identifier is already registered to a different key
     */
    public IndexMetadata getOrCreateMetadata(String modelName, int dimension, CatalogOptions options) {
        validateKey(modelName, dimension);
        Preconditions.checkNotNull(options, "options cannot be null");
        TableIdentifier table = options.resolveTable(modelName, dimension);

        Lock lock = creationLocks.get(table.name());
        lock.lock();
        try (Connection c = database.getConnection()) {
            IndexMetadata existing = selectByTable(c, table.name());
            if (existing == null) {
                try (PreparedStatement ps = c.prepareStatement("""
                    INSERT OR IGNORE INTO vector_metadata
                    (document_id, model_name, dimension, table_name, index_type, total_vectors, created_at)
                    VALUES (?, ?, ?, ?, ?, 0, ?)
                    """)) {
                    if (options.documentId() != null) {
                        ps.setLong(1, options.documentId());
                    } else {
                        ps.setNull(1, Types.INTEGER);
                    }
                    ps.setString(2, modelName);
                    ps.setInt(3, dimension);
                    ps.setString(4, table.name());
                    ps.setString(5, options.indexType());
                    ps.setLong(6, System.currentTimeMillis());
                    if (ps.executeUpdate() > 0) {
                        logger.fine("Registered index " + table + " for " + modelName + "/" + dimension);
                    }
                }
                existing = selectByTable(c, table.name());
                if (existing == null) {
                    throw new VectorStoreException("Metadata row for " + table + " vanished after insert");
                }
            }
            if (!existing.matches(options.documentId(), modelName, dimension)) {
                throw new IntegrityException("Table " + table + " is registered to "
                    + describe(existing.documentId(), existing.modelName(), existing.dimension())
                    + ", not " + describe(options.documentId(), modelName, dimension));
            }
            return existing;
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to get or create metadata for " + table, e);
        } finally {
            lock.unlock();
        }
    }

    public Optional<IndexMetadata> findByTableIdentifier(String tableName) {
        try (Connection c = database.getConnection()) {
            return Optional.ofNullable(selectByTable(c, tableName));
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to look up metadata for " + tableName, e);
        }
    }

    public Optional<IndexMetadata> findByModelAndDimension(String modelName, int dimension, @Nullable Long documentId) {
        String sql = "SELECT " + COLUMNS + " FROM vector_metadata WHERE model_name = ? AND dimension = ? AND "
            + (documentId == null ? "document_id IS NULL" : "document_id = ?")
            + " ORDER BY id LIMIT 1";
        try (Connection c = database.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, modelName);
            ps.setInt(2, dimension);
            if (documentId != null) {
                ps.setLong(3, documentId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to look up metadata for " + modelName + "/" + dimension, e);
        }
    }

    public List<IndexMetadata> listAll() {
        List<IndexMetadata> result = new ArrayList<>();
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM vector_metadata ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(read(rs));
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to list vector metadata", e);
        }
        return result;
    }

    public void incrementVectorCount(long id, long delta) {
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(
                 "UPDATE vector_metadata SET total_vectors = MAX(0, total_vectors + ?) WHERE id = ?")) {
            ps.setLong(1, delta);
            ps.setLong(2, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to update vector count for metadata " + id, e);
        }
    }

    /**
     * Removes the row. The physical table is left alone; callers drop it separately.
     */
    public boolean deleteMetadata(long id) {
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM vector_metadata WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to delete metadata " + id, e);
        }
    }

    private static void validateKey(String modelName, int dimension) {
        if (modelName == null || modelName.isBlank()) {
            throw new ValidationException("modelName is required");
        }
        if (dimension <= 0) {
            throw new ValidationException("dimension must be positive, got " + dimension);
        }
    }

    private IndexMetadata selectByTable(Connection c, String tableName) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
            "SELECT " + COLUMNS + " FROM vector_metadata WHERE table_name = ?")) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? read(rs) : null;
            }
        }
    }

    private static IndexMetadata read(ResultSet rs) throws SQLException {
        long documentId = rs.getLong("document_id");
        Long document = rs.wasNull() ? null : documentId;
        return new IndexMetadata(
            rs.getLong("id"),
            document,
            rs.getString("model_name"),
            rs.getInt("dimension"),
            TableIdentifier.of(rs.getString("table_name")),
            rs.getString("index_type"),
            rs.getLong("total_vectors"),
            rs.getLong("created_at"));
    }

    private static String describe(@Nullable Long documentId, String modelName, int dimension) {
        return (documentId == null ? "" : "document " + documentId + " ") + modelName + "/" + dimension;
    }
}
