package de.t14d3.clientdb.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.clientdb.cache.MemRecord;
import de.t14d3.clientdb.migration.SchemaMigrator;
import de.t14d3.clientdb.store.JdbcStoreAdapter;
import de.t14d3.clientdb.store.RecordTable;
import de.t14d3.clientdb.store.SettingsTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static de.t14d3.clientdb.test.TestSupport.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for store versioning on startup.
 */
public class SchemaMigratorTest {
    private JdbcStoreAdapter store;
    private SettingsTable settings;
    private RecordTable table;

    @BeforeEach
    void setUp() {
        store = JdbcStoreAdapter.open(TestSupport.uniqueH2Url());
        settings = new SettingsTable(store);
        table = new RecordTable(store, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private SchemaMigrator migrator(String dataStructureVersion) {
        return new SchemaMigrator(store, settings, table, dataStructureVersion);
    }

    private void insertRow(String collection, String id) {
        store.inTransaction(session -> {
            table.upsert(session, new MemRecord(0, collection, null, id, json("{\"id\":\"" + id + "\"}")));
            return null;
        });
    }

    @Test
    void testFreshStoreIsVersionedAndCommitted() {
        SchemaMigrator migrator = migrator("1");
        migrator.migrate();

        assertTrue(migrator.isCommitted());
        assertEquals(Optional.of(SchemaMigrator.SCHEMA_VERSION), settings.get(SchemaMigrator.DB_SCHEMA_VERSION));
        assertEquals(Optional.of("1"), settings.get(SchemaMigrator.DB_DATA_STRUCTURE));
        assertEquals(0, table.count());
    }

    @Test
    void testRerunKeepsRows() {
        migrator("1").migrate();
        insertRow("users", "1");

        migrator("1").migrate();

        assertEquals(1, table.count());
        assertTrue(table.find("users", "1").isPresent());
    }

    @Test
    void testDataStructureChangeWipesRows() {
        migrator("1").migrate();
        insertRow("users", "1");

        migrator("2").migrate();

        assertEquals(0, table.count());
        assertEquals(Optional.of("2"), settings.get(SchemaMigrator.DB_DATA_STRUCTURE));
    }

    @Test
    void testSchemaChangeRecreatesTable() {
        migrator("1").migrate();
        insertRow("users", "1");
        settings.set(SchemaMigrator.DB_SCHEMA_VERSION, "0");

        migrator("1").migrate();

        assertEquals(0, table.count());
        assertEquals(Optional.of(SchemaMigrator.SCHEMA_VERSION), settings.get(SchemaMigrator.DB_SCHEMA_VERSION));
        insertRow("users", "2");
        assertEquals(1, table.count());
    }

    @Test
    void testInterruptedUpgradeIsRepeated() {
        migrator("1").migrate();
        insertRow("users", "1");
        settings.set(SchemaMigrator.SETTINGS_COMMITTED, "0");

        SchemaMigrator migrator = migrator("1");
        migrator.migrate();

        assertTrue(migrator.isCommitted());
        assertEquals(Optional.of("1"), settings.get(SchemaMigrator.SETTINGS_COMMITTED));
        assertEquals(0, table.count());
        insertRow("users", "1");
        assertEquals(1, table.count());
    }

    @Test
    void testUniqueIndexHoldsAfterMigration() {
        migrator("1").migrate();
        insertRow("users", "1");
        insertRow("users", "1");
        insertRow("orders", "1");

        assertEquals(2, table.count());
        assertEquals(1L, table.countByCollection().get("users"));
    }
}
