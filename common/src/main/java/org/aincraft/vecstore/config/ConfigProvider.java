package org.aincraft.vecstore.config;

/**
 * Configuration source addressed by dot-separated paths.
 * Returns primitive types and Strings only.
 */
public interface ConfigProvider {

    String getString(String path, String defaultValue);

    int getInt(String path, int defaultValue);

    boolean getBoolean(String path, boolean defaultValue);
}
