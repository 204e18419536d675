package org.aincraft.vecstore.storage.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.logging.Logger;
import org.aincraft.vecstore.api.ValidationException;
import org.aincraft.vecstore.storage.SqliteDatabase;
import org.aincraft.vecstore.storage.catalog.TableIdentifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VirtualIndexManagerTest {
    private static final Logger LOGGER = Logger.getLogger(VirtualIndexManagerTest.class.getName());

    @TempDir
    Path dir;

    private SqliteDatabase database;
    private VirtualIndexManager manager;

    @BeforeEach
    void setUp() {
        database = SqliteDatabase.open(LOGGER, dir.resolve("index.db"), Capability.BRUTE_FORCE, "", 5000);
        manager = new VirtualIndexManager(database, LOGGER);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void createsPlainTableWithoutExtension() {
        TableIdentifier table = TableIdentifier.forModel("m1", 4);

        assertThat(manager.tableExists(table)).isFalse();
        assertThat(manager.ensureTable(table, 4)).isEqualTo(TableKind.BASE);
        assertThat(manager.tableKind(table)).isEqualTo(TableKind.BASE);
        assertThat(manager.ensureTable(table, 4)).isEqualTo(TableKind.BASE);
    }

    @Test
    void hyphenatedIdentifiersWork() {
        TableIdentifier table = TableIdentifier.of("vec_all-MiniLM-L6-v2_384");

        manager.ensureTable(table, 384);

        assertThat(manager.tableExists(table)).isTrue();
    }

    @Test
    void dropTableRemovesIt() {
        TableIdentifier table = TableIdentifier.forModel("m1", 4);
        manager.ensureTable(table, 4);

        manager.dropTable(table);
        manager.dropTable(table);

        assertThat(manager.tableExists(table)).isFalse();
    }

    @Test
    void migrateIsANoOpWithoutExtension() {
        TableIdentifier table = TableIdentifier.forModel("m1", 4);
        manager.ensureTable(table, 4);

        assertThat(manager.migrate(table, 4)).isFalse();
        assertThat(manager.tableKind(table)).isEqualTo(TableKind.BASE);
    }

    @Test
    void rejectsNonPositiveDimension() {
        assertThatThrownBy(() -> manager.ensureTable(TableIdentifier.forModel("m1", 4), 0))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void acceleratedTableStatement() {
        String sql = VirtualIndexManager.createAcceleratedSql(TableIdentifier.of("vec_m1_4"), 4);

        assertThat(sql).isEqualTo("CREATE VIRTUAL TABLE \"vec_m1_4\" USING vec0(chunk_id INTEGER, embedding FLOAT[4])");
    }

    @Test
    void probeWithoutExtensionPathIsBruteForce() {
        assertThat(ExtensionProbe.probe(LOGGER, "")).isEqualTo(Capability.BRUTE_FORCE);
        assertThat(ExtensionProbe.probe(LOGGER, null)).isEqualTo(Capability.BRUTE_FORCE);
    }

    @Test
    void probeWithMissingLibraryDegrades() {
        String missing = dir.resolve("no-such-vec0").toString();

        assertThat(ExtensionProbe.probe(LOGGER, missing)).isEqualTo(Capability.BRUTE_FORCE);
    }
}
