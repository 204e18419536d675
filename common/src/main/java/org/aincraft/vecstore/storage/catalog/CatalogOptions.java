package org.aincraft.vecstore.storage.catalog;

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.Nullable;

/**
 * Optional inputs to {@link MetadataCatalog#getOrCreateMetadata}.
 *
 * @param documentId scope the index to one document, or null for the corpus index
 * @param tableName explicit table name overriding the derived identifier
 * @param indexType index type tag, "flat" unless configured otherwise
 */
public record CatalogOptions(@Nullable Long documentId, @Nullable String tableName, String indexType) {
    public static final String DEFAULT_INDEX_TYPE = "flat";

    public CatalogOptions {
        Preconditions.checkNotNull(indexType, "indexType cannot be null");
    }

    public static CatalogOptions defaults() {
        return new CatalogOptions(null, null, DEFAULT_INDEX_TYPE);
    }

    public static CatalogOptions forDocument(long documentId) {
        return new CatalogOptions(documentId, null, DEFAULT_INDEX_TYPE);
    }

    public CatalogOptions withTableName(String tableName) {
        return new CatalogOptions(documentId, tableName, indexType);
    }

    public CatalogOptions withIndexType(String indexType) {
        return new CatalogOptions(documentId, tableName, indexType);
    }

    TableIdentifier resolveTable(String modelName, int dimension) {
        if (tableName != null) {
            return TableIdentifier.of(tableName);
        }
        return documentId != null
            ? TableIdentifier.forDocument(documentId, modelName, dimension)
            : TableIdentifier.forModel(modelName, dimension);
    }
}
