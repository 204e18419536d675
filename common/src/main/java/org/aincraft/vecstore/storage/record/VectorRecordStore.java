package org.aincraft.vecstore.storage.record;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.IntegrityException;
import org.aincraft.vecstore.api.SchemaException;
import org.aincraft.vecstore.api.SearchHits;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.api.VectorStoreException;
import org.aincraft.vecstore.storage.SqliteDatabase;
import org.aincraft.vecstore.storage.catalog.TableIdentifier;
import org.aincraft.vecstore.storage.index.TableKind;
import org.aincraft.vecstore.storage.index.VirtualIndexManager;
import org.jetbrains.annotations.Nullable;

/**
 * Reads and writes (chunk id, embedding) rows of one vector table.
 * Missing tables read as empty: count is 0, search returns no hits and deletes are no-ops.
 * Synchronous API - wrap in CompletableFuture at call site if async needed.
 */
public class VectorRecordStore {
    private final SqliteDatabase database;
    private final Logger logger;

    public VectorRecordStore(SqliteDatabase database, Logger logger) {
        this.database = database;
        this.logger = logger;
    }

    public void addVector(TableIdentifier table, Number chunkId, float[] embedding, int dimension) {
        validateVector(embedding, dimension);
        long id = ChunkIds.toIntegral(chunkId, logger);
        try (Connection c = database.getConnection();
             PreparedStatement ps = c.prepareStatement(insertSql(table))) {
            ps.setLong(1, id);
            ps.setBytes(2, VectorCodec.encode(embedding));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to insert vector for chunk " + id + " into " + table, e);
        }
    }

    /**
     * Inserts all entries in one transaction. Every entry is validated before the first write.
     *
     * @return number of rows written
     */
    public int addVectors(TableIdentifier table, List<VectorEntry> entries, int dimension) {
        if (entries.isEmpty()) {
            return 0;
        }
        for (VectorEntry entry : entries) {
            validateVector(entry.embedding(), dimension);
        }

        try (Connection c = database.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(insertSql(table))) {
                for (VectorEntry entry : entries) {
                    ps.setLong(1, entry.chunkId());
                    ps.setBytes(2, VectorCodec.encode(entry.embedding()));
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to insert " + entries.size() + " vectors into " + table, e);
        }
        logger.fine("Inserted " + entries.size() + " vectors into " + table);
        return entries.size();
    }

    public int deleteByChunkId(TableIdentifier table, long chunkId) {
        return deleteByChunkIds(table, List.of(chunkId));
    }

    /**
     * @return number of rows removed
     */
    public int deleteByChunkIds(TableIdentifier table, Collection<Long> chunkIds) {
        if (chunkIds.isEmpty()) {
            return 0;
        }
        try (Connection c = database.getConnection()) {
            if (VirtualIndexManager.tableKind(c, table) == TableKind.MISSING) {
                return 0;
            }
            int removed = 0;
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM " + table.quoted() + " WHERE chunk_id = ?")) {
                for (Long chunkId : chunkIds) {
                    ps.setLong(1, chunkId);
                    removed += ps.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
            logger.fine("Removed " + removed + " vectors from " + table);
            return removed;
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to delete vectors from " + table, e);
        }
    }

    public long count(TableIdentifier table) {
        try (Connection c = database.getConnection()) {
            return count(c, table);
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to count vectors in " + table, e);
        }
    }

    public List<Long> listChunkIds(TableIdentifier table) {
        List<Long> ids = new ArrayList<>();
        try (Connection c = database.getConnection()) {
            if (VirtualIndexManager.tableKind(c, table) == TableKind.MISSING) {
                return ids;
            }
            try (PreparedStatement ps = c.prepareStatement(
                "SELECT DISTINCT chunk_id FROM " + table.quoted() + " ORDER BY chunk_id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to list chunk ids of " + table, e);
        }
        return ids;
    }

    /**
     * k-nearest-neighbour search by L2 distance.
     *
     * @param dimension expected query length, or null to skip the check
     * @param distanceThreshold only return hits with {@code distance <= threshold}, or null for no cutoff
     */
    public SearchHits search(TableIdentifier table, float[] query, int k,
                             @Nullable Integer dimension, @Nullable Double distanceThreshold) {
        if (query == null || query.length == 0) {
            throw new ValidationException("Query vector cannot be empty");
        }
        if (dimension != null && query.length != dimension) {
            throw new ValidationException("Query has " + query.length + " dimensions, expected " + dimension);
        }

        try (Connection c = database.getConnection()) {
            TableKind kind = VirtualIndexManager.tableKind(c, table);
            if (kind == TableKind.MISSING) {
                return SearchHits.empty();
            }
            if (kind == TableKind.ACCELERATED && !database.capability().isAccelerated()) {
                logger.log(Level.WARNING, "Cannot search " + table + ", returning no results",
                    new SchemaException("Table " + table + " is a vec0 table but sqlite-vec is not loaded"));
                return SearchHits.empty();
            }

            long total = count(c, table);
            if (total == 0) {
                return SearchHits.empty();
            }
            int limit = (int) Math.min(k, total);
            if (limit <= 0) {
                throw new ValidationException("k must be positive, got " + k);
            }
            int width = dimension != null ? dimension : storedDimension(c, table);
            if (query.length != width) {
                throw new ValidationException("Query has " + query.length + " dimensions, " + table
                    + " stores " + width);
            }

            boolean accelerated = kind == TableKind.ACCELERATED;
            String sql = accelerated
                ? knnSql(table, distanceThreshold != null)
                : bruteForceSql(table, distanceThreshold != null);
            try {
                return runSearch(c, sql, query, limit, distanceThreshold, accelerated);
            } catch (SQLException e) {
                if (!accelerated && countCorrupt(c, table, width) > 0) {
                    throw new IntegrityException("Table " + table + " holds vectors whose length is not "
                        + width * Float.BYTES + " bytes", e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Search failed on " + table, e);
        }
    }

    private static SearchHits runSearch(Connection c, String sql, float[] query, int limit,
                                        @Nullable Double distanceThreshold, boolean accelerated) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setBytes(i++, VectorCodec.encode(query));
            if (accelerated) {
                ps.setInt(i++, limit);
                if (distanceThreshold != null) {
                    ps.setDouble(i, distanceThreshold);
                }
            } else {
                if (distanceThreshold != null) {
                    ps.setDouble(i++, distanceThreshold);
                }
                ps.setInt(i, limit);
            }

            long[] chunkIds = new long[limit];
            double[] distances = new double[limit];
            int n = 0;
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next() && n < limit) {
                    chunkIds[n] = rs.getLong(1);
                    distances[n] = rs.getDouble(2);
                    n++;
                }
            }
            if (n < limit) {
                long[] ids = new long[n];
                double[] dist = new double[n];
                System.arraycopy(chunkIds, 0, ids, 0, n);
                System.arraycopy(distances, 0, dist, 0, n);
                return SearchHits.of(ids, dist);
            }
            return SearchHits.of(chunkIds, distances);
        }
    }

    private static long count(Connection c, TableIdentifier table) throws SQLException {
        if (VirtualIndexManager.tableKind(c, table) == TableKind.MISSING) {
            return 0;
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM " + table.quoted());
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    /**
     * Dimension held by most rows of the table. Rows of another length are corrupt.
     */
    private static int storedDimension(Connection c, TableIdentifier table) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
            "SELECT length(embedding) FROM " + table.quoted()
                + " GROUP BY length(embedding) ORDER BY COUNT(*) DESC LIMIT 1");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) / Float.BYTES : 0;
        }
    }

    private static long countCorrupt(Connection c, TableIdentifier table, int dimension) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
            "SELECT COUNT(*) FROM " + table.quoted() + " WHERE length(embedding) != ?")) {
            ps.setInt(1, dimension * Float.BYTES);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    static String insertSql(TableIdentifier table) {
        return "INSERT INTO " + table.quoted() + " (chunk_id, embedding) VALUES (CAST(? AS INTEGER), ?)";
    }

    static String knnSql(TableIdentifier table, boolean withThreshold) {
        String knn = "SELECT chunk_id, distance FROM " + table.quoted()
            + " WHERE embedding MATCH ? AND k = ? ORDER BY distance";
        if (!withThreshold) {
            return knn;
        }
        return "SELECT chunk_id, distance FROM (" + knn + ") WHERE distance <= ? ORDER BY distance";
    }

    static String bruteForceSql(TableIdentifier table, boolean withThreshold) {
        if (!withThreshold) {
            return "SELECT chunk_id, vec_distance_l2(embedding, ?) AS distance FROM " + table.quoted()
                + " ORDER BY distance ASC, chunk_id ASC LIMIT ?";
        }
        return "SELECT chunk_id, distance FROM (SELECT chunk_id, vec_distance_l2(embedding, ?) AS distance FROM "
            + table.quoted() + ") WHERE distance <= ? ORDER BY distance ASC, chunk_id ASC LIMIT ?";
    }

    private static void validateVector(float[] embedding, int dimension) {
        if (embedding == null || embedding.length == 0) {
            throw new ValidationException("Embedding cannot be empty");
        }
        if (embedding.length != dimension) {
            throw new ValidationException("Embedding has " + embedding.length + " dimensions, expected " + dimension);
        }
    }
}
