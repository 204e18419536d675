package org.aincraft.vecstore.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Typed view over a {@link ConfigProvider}.
 */
public class VectorStoreConfig {
    public static final String DEFAULT_BASE_PATH = "data/vector_index";

    private final ConfigProvider config;

    public VectorStoreConfig(ConfigProvider config) {
        this.config = config;
    }

    // Storage settings
    public Path getBasePath() {
        return Paths.get(config.getString("storage.base-path", DEFAULT_BASE_PATH));
    }

    public String getBackend() {
        return config.getString("storage.backend", "sqlite-vec");
    }

    /**
     * Path of the loadable sqlite-vec extension. Blank disables the accelerated index.
     */
    public String getSqliteExtensionPath() {
        return config.getString("storage.sqlite.extension-path", "");
    }

    public int getSqliteBusyTimeoutMs() {
        return config.getInt("storage.sqlite.busy-timeout-ms", 5000);
    }

    public int getPoolMaxInstances() {
        return Math.max(1, config.getInt("pool.max-instances", 20));
    }

    // Index settings
    public String getDefaultIndexType() {
        return config.getString("index.default-type", "flat");
    }

    public boolean isCorpusMirrorEnabled() {
        return config.getBoolean("index.mirror-corpus", true);
    }

    // Search settings
    public int getDefaultSearchK() {
        return config.getInt("search.default-k", 10);
    }

    public int getMaxSearchK() {
        return config.getInt("search.max-k", 1000);
    }

    // Embedding settings
    public String getDefaultModel() {
        return config.getString("embedding.default-model", "");
    }

    public int getDefaultDimension() {
        return config.getInt("embedding.default-dimension", 0);
    }

    public int getExecutorThreads() {
        return Math.max(1, config.getInt("executor.threads", 4));
    }
}
