package org.aincraft.vecstore.config;

import com.google.common.base.Preconditions;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-based configuration provider.
 * Reads configuration from a JSON file with dot-notation path access, e.g. "storage.sqlite.extension-path".
 * A missing file is created with the defaults.
 */
public final class JsonConfigProvider implements ConfigProvider {
    public static final String FILENAME = "vecstore.json";
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Logger logger;
    private final Path configPath;
    private JsonObject config;

    public JsonConfigProvider(Logger logger, Path configDir) {
        this.logger = Preconditions.checkNotNull(logger, "logger cannot be null");
        Preconditions.checkNotNull(configDir, "configDir cannot be null");
        this.configPath = configDir.resolve(FILENAME);
        loadConfig();
    }

    private void loadConfig() {
        if (Files.exists(configPath)) {
            try (Reader reader = Files.newBufferedReader(configPath)) {
                config = JsonParser.parseReader(reader).getAsJsonObject();
            } catch (IOException | JsonParseException | IllegalStateException e) {
                logger.log(Level.WARNING, "Failed to load config from " + configPath + ", using defaults", e);
                config = createDefaultConfig();
            }
        } else {
            config = createDefaultConfig();
            saveConfig();
        }
    }

    static JsonObject createDefaultConfig() {
        JsonObject root = new JsonObject();

        JsonObject storage = new JsonObject();
        storage.addProperty("base-path", VectorStoreConfig.DEFAULT_BASE_PATH);
        storage.addProperty("backend", "sqlite-vec");
        JsonObject sqlite = new JsonObject();
        sqlite.addProperty("extension-path", "");
        sqlite.addProperty("busy-timeout-ms", 5000);
        storage.add("sqlite", sqlite);
        root.add("storage", storage);

        JsonObject pool = new JsonObject();
        pool.addProperty("max-instances", 20);
        root.add("pool", pool);

        JsonObject index = new JsonObject();
        index.addProperty("default-type", "flat");
        index.addProperty("mirror-corpus", true);
        root.add("index", index);

        JsonObject search = new JsonObject();
        search.addProperty("default-k", 10);
        search.addProperty("max-k", 1000);
        root.add("search", search);

        JsonObject embedding = new JsonObject();
        embedding.addProperty("default-model", "");
        embedding.addProperty("default-dimension", 0);
        root.add("embedding", embedding);

        JsonObject executor = new JsonObject();
        executor.addProperty("threads", 4);
        root.add("executor", executor);

        return root;
    }

    private void saveConfig() {
        try {
            Files.createDirectories(configPath.toAbsolutePath().getParent());
            try (Writer writer = Files.newBufferedWriter(configPath)) {
                GSON.toJson(config, writer);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to save config to " + configPath, e);
        }
    }

    /**
     * Navigate to a nested JSON element using dot notation.
     */
    private JsonElement navigate(String path) {
        String[] parts = path.split("\\.");
        JsonElement current = config;
        for (String part : parts) {
            if (current == null || !current.isJsonObject()) {
                return null;
            }
            current = current.getAsJsonObject().get(part);
        }
        return current;
    }

    @Override
    public String getString(String path, String defaultValue) {
        JsonElement element = navigate(path);
        if (element != null && element.isJsonPrimitive()) {
            return element.getAsString();
        }
        return defaultValue;
    }

    @Override
    public int getInt(String path, int defaultValue) {
        JsonElement element = navigate(path);
        if (element != null && element.isJsonPrimitive()) {
            try {
                return element.getAsInt();
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @Override
    public boolean getBoolean(String path, boolean defaultValue) {
        JsonElement element = navigate(path);
        if (element != null && element.isJsonPrimitive()) {
            return element.getAsBoolean();
        }
        return defaultValue;
    }

    public Path getConfigPath() {
        return configPath;
    }
}
