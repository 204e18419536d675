package org.aincraft.vecstore.storage;

import com.google.common.base.Preconditions;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.VectorStoreException;
import org.aincraft.vecstore.storage.index.Capability;
import org.aincraft.vecstore.storage.record.L2DistanceFunction;

/**
 * One SQLite index file behind a single-connection HikariCP pool.
 * Connections handed out either have sqlite-vec loaded or carry the Java
 * {@code vec_distance_l2} function, so callers can use the same SQL in both modes.
 */
public final class SqliteDatabase implements AutoCloseable {
    private final Logger logger;
    private final Path file;
    private final Capability capability;
    private final String extensionPath;
    private final int busyTimeoutMs;
    private HikariDataSource dataSource;

    private SqliteDatabase(Logger logger, Path file, Capability capability, String extensionPath, int busyTimeoutMs) {
        this.logger = logger;
        this.file = file;
        this.capability = capability;
        this.extensionPath = extensionPath;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public static SqliteDatabase open(Logger logger, Path file, Capability capability,
                                      String extensionPath, int busyTimeoutMs) {
        Preconditions.checkNotNull(file, "file cannot be null");
        Preconditions.checkNotNull(capability, "capability cannot be null");
        SqliteDatabase database = new SqliteDatabase(logger, file, capability,
            extensionPath == null ? "" : extensionPath, busyTimeoutMs);
        database.start();
        return database;
    }

    private void start() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new VectorStoreException("Failed to create directory for " + file, e);
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + file.toAbsolutePath());
        config.setDriverClassName("org.sqlite.JDBC");
        config.setMaximumPoolSize(1); // SQLite only supports one writer
        config.setMinimumIdle(0);
        config.setPoolName("vecstore-" + file.getFileName());
        config.setLeakDetectionThreshold(30000);
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMs));
        if (capability.isAccelerated()) {
            config.addDataSourceProperty("enable_load_extension", "true");
            config.setConnectionInitSql("SELECT load_extension('" + extensionPath.replace("'", "''") + "')");
        }
        dataSource = new HikariDataSource(config);
        logger.fine("Opened " + file.toAbsolutePath() + " (" + capability + ")");
    }

    public Connection getConnection() throws SQLException {
        if (dataSource == null || dataSource.isClosed()) {
            throw new SQLException("Database " + file + " is closed");
        }
        Connection connection = dataSource.getConnection();
        if (!capability.isAccelerated()) {
            try {
                L2DistanceFunction.register(connection);
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
        }
        return connection;
    }

    public Capability capability() {
        return capability;
    }

    public boolean isOpen() {
        return dataSource != null && !dataSource.isClosed();
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            logger.fine("Closed " + file.toAbsolutePath());
        }
    }
}
