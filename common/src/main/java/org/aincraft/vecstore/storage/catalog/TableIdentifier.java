package org.aincraft.vecstore.storage.catalog;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import org.aincraft.vecstore.api.ValidationException;

/**
 * Validated name of a vector table. Instances can only be built through the
 * factories, so every identifier that reaches SQL matches {@code ^[A-Za-z0-9_-]+$}.
 */
public final class TableIdentifier {
    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");
    private static final int HASH_LENGTH = 12;

    private final String name;

    private TableIdentifier(String name) {
        this.name = name;
    }

    public static TableIdentifier of(String name) {
        if (name == null || !VALID.matcher(name).matches()) {
            throw new ValidationException("Invalid table identifier: " + name);
        }
        return new TableIdentifier(name);
    }

    public static TableIdentifier forModel(String modelName, int dimension) {
        String hash = hash("model|" + modelName + "|" + dimension);
        return of("vec_" + sanitize(modelName) + "_" + dimension + "_" + hash);
    }

    public static TableIdentifier forDocument(long documentId, String modelName, int dimension) {
        String hash = hash("doc|" + documentId + "|" + modelName + "|" + dimension);
        return of("vec_doc_" + documentId + "_" + sanitize(modelName) + "_" + dimension + "_" + hash);
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_-]} with an underscore.
     * Distinct model names can collide here; the hash suffix keeps identifiers apart.
     */
    public static String sanitize(String modelName) {
        return UNSAFE.matcher(modelName).replaceAll("_");
    }

    private static String hash(String key) {
        return Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString().substring(0, HASH_LENGTH);
    }

    public String name() {
        return name;
    }

    /**
     * Double-quoted form for use in SQL text.
     */
    public String quoted() {
        return "\"" + name + "\"";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableIdentifier that)) return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
