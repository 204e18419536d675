package org.aincraft.vecstore.storage.index;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.SchemaException;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.api.VectorStoreException;
import org.aincraft.vecstore.storage.SqliteDatabase;
import org.aincraft.vecstore.storage.catalog.TableIdentifier;

/**
 * Creates and inspects the physical vector tables of one database.
 * With sqlite-vec loaded a table is a {@code vec0} virtual table, otherwise a plain
 * table holding the same (chunk_id, embedding) pairs.
 */
public class VirtualIndexManager {
    private final SqliteDatabase database;
    private final Logger logger;

    public VirtualIndexManager(SqliteDatabase database, Logger logger) {
        this.database = database;
        this.logger = logger;
    }

    /**
     * Makes sure the table exists, creating it if needed.
     *
     * @return the kind of table now backing the identifier
     */
    public TableKind ensureTable(TableIdentifier table, int dimension) {
        validateDimension(dimension);
        TableKind kind = tableKind(table);
        if (kind != TableKind.MISSING) {
            return kind;
        }

        if (database.capability().isAccelerated()) {
            try {
                createAccelerated(table, dimension);
                logger.info("Created vec0 table " + table + " (dimension " + dimension + ")");
                return TableKind.ACCELERATED;
            } catch (SchemaException e) {
                logger.log(Level.WARNING, "Falling back to a plain table for " + table, e);
            }
        }

        try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
            st.execute(createBaseSql(table));
            st.execute(createChunkIndexSql(table));
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to create table " + table, e);
        }
        logger.info("Created plain vector table " + table + " (dimension " + dimension + ")");
        return TableKind.BASE;
    }

    public boolean tableExists(TableIdentifier table) {
        return tableKind(table) != TableKind.MISSING;
    }

    public TableKind tableKind(TableIdentifier table) {
        try (Connection c = database.getConnection()) {
            return tableKind(c, table);
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to inspect table " + table, e);
        }
    }

    public static TableKind tableKind(Connection c, TableIdentifier table) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
            "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return TableKind.MISSING;
                }
                String sql = rs.getString(1);
                return isVec0(sql) ? TableKind.ACCELERATED : TableKind.BASE;
            }
        }
    }

    /**
     * Rebuilds a plain table as a vec0 table once the extension is available.
     * Rows are copied in a single transaction.
     *
     * @return true if the table was migrated
     */
    public boolean migrate(TableIdentifier table, int dimension) {
        validateDimension(dimension);
        if (!database.capability().isAccelerated() || tableKind(table) != TableKind.BASE) {
            return false;
        }

        TableIdentifier legacy = TableIdentifier.of(table.name() + "_legacy");
        try (Connection c = database.getConnection()) {
            c.setAutoCommit(false);
            try (Statement st = c.createStatement()) {
                st.execute("ALTER TABLE " + table.quoted() + " RENAME TO " + legacy.quoted());
                st.execute(createAcceleratedSql(table, dimension));
                int copied = st.executeUpdate("INSERT INTO " + table.quoted() + " (chunk_id, embedding) "
                    + "SELECT chunk_id, embedding FROM " + legacy.quoted() + " ORDER BY id");
                st.execute("DROP TABLE " + legacy.quoted());
                c.commit();
                logger.info("Migrated " + copied + " vectors of " + table + " to vec0");
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to migrate table " + table, e);
        }
    }

    public void dropTable(TableIdentifier table) {
        try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + table.quoted());
            logger.fine("Dropped table " + table);
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to drop table " + table, e);
        }
    }

    private void createAccelerated(TableIdentifier table, int dimension) {
        try (Connection c = database.getConnection(); Statement st = c.createStatement()) {
            st.execute(createAcceleratedSql(table, dimension));
        } catch (SQLException e) {
            throw new SchemaException("Failed to create vec0 table " + table, e);
        }
    }

    static String createAcceleratedSql(TableIdentifier table, int dimension) {
        return "CREATE VIRTUAL TABLE " + table.quoted()
            + " USING vec0(chunk_id INTEGER, embedding FLOAT[" + dimension + "])";
    }

    static String createBaseSql(TableIdentifier table) {
        return """
            CREATE TABLE IF NOT EXISTS %s (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                chunk_id INTEGER NOT NULL,
                embedding BLOB NOT NULL
            )
            """.formatted(table.quoted());
    }

    static String createChunkIndexSql(TableIdentifier table) {
        return "CREATE INDEX IF NOT EXISTS \"idx_" + table.name() + "_chunk\" ON "
            + table.quoted() + "(chunk_id)";
    }

    private static boolean isVec0(String sql) {
        if (sql == null) {
            return false;
        }
        String normalized = sql.toLowerCase(Locale.ROOT);
        return normalized.startsWith("create virtual table") && normalized.contains("using vec0");
    }

    private static void validateDimension(int dimension) {
        if (dimension <= 0) {
            throw new ValidationException("dimension must be positive, got " + dimension);
        }
    }
}
