package org.aincraft.vecstore.storage.index;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.SchemaException;
import org.jetbrains.annotations.Nullable;
import org.sqlite.SQLiteConfig;

/**
 * Detects whether the sqlite-vec extension can be loaded.
 * Runs against a throwaway in-memory database so no index file is touched.
 */
public final class ExtensionProbe {
    private ExtensionProbe() {
    }

    public static Capability probe(Logger logger, @Nullable String extensionPath) {
        if (extensionPath == null || extensionPath.isBlank()) {
            logger.fine("No sqlite-vec extension configured, using brute-force search");
            return Capability.BRUTE_FORCE;
        }
        try {
            String version = loadAndReadVersion(extensionPath);
            logger.info("sqlite-vec " + version + " loaded from " + extensionPath);
            return Capability.ACCELERATED;
        } catch (SchemaException e) {
            logger.log(Level.WARNING, "sqlite-vec unavailable, falling back to brute-force search", e);
            return Capability.BRUTE_FORCE;
        }
    }

    static String loadAndReadVersion(String extensionPath) {
        SQLiteConfig config = new SQLiteConfig();
        config.enableLoadExtension(true);
        try (Connection conn = config.createConnection("jdbc:sqlite::memory:")) {
            try (PreparedStatement ps = conn.prepareStatement("SELECT load_extension(?)")) {
                ps.setString(1, extensionPath);
                ps.executeQuery().close();
            }
            try (ResultSet rs = conn.createStatement().executeQuery("SELECT vec_version()")) {
                if (!rs.next()) {
                    throw new SchemaException("vec_version() returned no rows");
                }
                return rs.getString(1);
            }
        } catch (SQLException e) {
            throw new SchemaException("Failed to load sqlite-vec extension from " + extensionPath, e);
        }
    }
}
