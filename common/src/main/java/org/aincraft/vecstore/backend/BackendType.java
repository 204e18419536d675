package org.aincraft.vecstore.backend;

import java.util.Locale;

public enum BackendType {
    SQLITE_VEC("sqlite-vec", "db"),
    MEMORY("memory", "bin");

    private final String id;
    private final String fileExtension;

    BackendType(String id, String fileExtension) {
        this.id = id;
        this.fileExtension = fileExtension;
    }

    public String id() {
        return id;
    }

    public String fileExtension() {
        return fileExtension;
    }

    /**
     * Resolves a configured backend name. Unknown names return null.
     */
    public static BackendType fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (BackendType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
