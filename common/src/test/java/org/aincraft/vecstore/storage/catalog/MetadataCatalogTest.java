package org.aincraft.vecstore.storage.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.IntegrityException;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.storage.SqliteDatabase;
import org.aincraft.vecstore.storage.index.Capability;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetadataCatalogTest {
    private static final Logger LOGGER = Logger.getLogger(MetadataCatalogTest.class.getName());

    @TempDir
    Path dir;

    private SqliteDatabase database;
    private MetadataCatalog catalog;

    @BeforeEach
    void setUp() {
        database = SqliteDatabase.open(LOGGER, dir.resolve("catalog.db"), Capability.BRUTE_FORCE, "", 5000);
        catalog = new MetadataCatalog(database, LOGGER);
        catalog.initialize();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void getOrCreateIsIdempotent() {
        IndexMetadata first = catalog.getOrCreateMetadata("m1", 4, CatalogOptions.defaults());
        IndexMetadata second = catalog.getOrCreateMetadata("m1", 4, CatalogOptions.defaults());

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(first.totalVectors()).isZero();
        assertThat(first.indexType()).isEqualTo("flat");
        assertThat(first.table()).isEqualTo(TableIdentifier.forModel("m1", 4));
        assertThat(catalog.listAll()).hasSize(1);
    }

    @Test
    void concurrentCallsCreateOneRow() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<IndexMetadata>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> catalog.getOrCreateMetadata("m1", 4, CatalogOptions.forDocument(9)));
            }
            List<Long> ids = new ArrayList<>();
            for (Future<IndexMetadata> future : pool.invokeAll(calls)) {
                ids.add(future.get().id());
            }

            assertThat(ids).containsOnly(ids.get(0));
            assertThat(catalog.listAll()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void documentAndCorpusRowsAreSeparate() {
        IndexMetadata corpus = catalog.getOrCreateMetadata("m1", 4, CatalogOptions.defaults());
        IndexMetadata document = catalog.getOrCreateMetadata("m1", 4, CatalogOptions.forDocument(3));

        assertThat(document.id()).isNotEqualTo(corpus.id());
        assertThat(document.documentId()).isEqualTo(3L);
        assertThat(catalog.findByModelAndDimension("m1", 4, null)).contains(corpus);
        assertThat(catalog.findByModelAndDimension("m1", 4, 3L)).contains(document);
        assertThat(catalog.findByModelAndDimension("m1", 8, null)).isEmpty();
    }

    @Test
    void explicitTableNameOwnedByAnotherKeyIsAnIntegrityError() {
        catalog.getOrCreateMetadata("m1", 4, CatalogOptions.defaults().withTableName("shared"));

        assertThatThrownBy(() -> catalog.getOrCreateMetadata("m2", 4, CatalogOptions.defaults().withTableName("shared")))
            .isInstanceOf(IntegrityException.class)
            .hasMessageContaining("shared");
    }

    @Test
    void malformedExplicitTableNameIsRejected() {
        assertThatThrownBy(() -> catalog.getOrCreateMetadata("m1", 4, CatalogOptions.defaults().withTableName("bad name")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> catalog.getOrCreateMetadata("m1", 0, CatalogOptions.defaults()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void vectorCountAndDeletion() {
        IndexMetadata row = catalog.getOrCreateMetadata("m1", 4, CatalogOptions.defaults());

        catalog.incrementVectorCount(row.id(), 5);
        catalog.incrementVectorCount(row.id(), -2);
        assertThat(catalog.findByTableIdentifier(row.table().name()))
            .hasValueSatisfying(found -> assertThat(found.totalVectors()).isEqualTo(3));

        assertThat(catalog.deleteMetadata(row.id())).isTrue();
        assertThat(catalog.findByTableIdentifier(row.table().name())).isEmpty();
        assertThat(catalog.deleteMetadata(row.id())).isFalse();
    }
}
