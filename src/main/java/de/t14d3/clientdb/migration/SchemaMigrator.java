package de.t14d3.clientdb.migration;

import de.t14d3.clientdb.store.RecordTable;
import de.t14d3.clientdb.store.SettingsTable;
import de.t14d3.clientdb.store.StoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Brings the store in line with the current schema and payload versions on startup.
 *
 * Progress is tracked in the settings table: {@code settingsCommitted} is set to {@code "0"}
 * before any step and to {@code "1"} after all of them, and each version value is written only
 * once its step succeeded. A run that finds the flag at anything but {@code "1"} redoes both
 * steps. Every step can be repeated safely.
 */
public class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final String SCHEMA_VERSION = "1";

    public static final String DB_SCHEMA_VERSION = "dbSchemaVersion";
    public static final String DB_DATA_STRUCTURE = "dbDataStructure";
    public static final String SETTINGS_COMMITTED = "settingsCommitted";

    private final StoreAdapter store;
    private final SettingsTable settings;
    private final RecordTable table;
    private final String dataStructureVersion;

    public SchemaMigrator(StoreAdapter store, SettingsTable settings, RecordTable table, String dataStructureVersion) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.table = Objects.requireNonNull(table, "table");
        this.dataStructureVersion = Objects.requireNonNull(dataStructureVersion, "dataStructureVersion");
    }

    public void migrate() {
        settings.ensureTable();

        Optional<String> committed = settings.get(SETTINGS_COMMITTED);
        boolean interrupted = committed.isPresent() && !"1".equals(committed.get());
        if (interrupted) {
            log.warn("Previous store upgrade did not complete, repeating it");
        }

        settings.set(SETTINGS_COMMITTED, "0");

        boolean schemaChanged = interrupted || !settings.get(DB_SCHEMA_VERSION).filter(SCHEMA_VERSION::equals).isPresent();
        if (schemaChanged) {
            log.info("Recreating table {} for schema version {}", RecordTable.TABLE, SCHEMA_VERSION);
            store.execute(table.dropStatement());
        }
        store.executeAll(table.createStatements());
        settings.set(DB_SCHEMA_VERSION, SCHEMA_VERSION);

        boolean dataChanged = interrupted || !settings.get(DB_DATA_STRUCTURE).filter(dataStructureVersion::equals).isPresent();
        if (dataChanged) {
            log.info("Clearing cached rows for data structure version {}", dataStructureVersion);
            store.inTransaction(table::deleteAll);
            table.compact();
            settings.set(DB_DATA_STRUCTURE, dataStructureVersion);
        }

        settings.set(SETTINGS_COMMITTED, "1");
        log.debug("Store at schema {} / data structure {}", SCHEMA_VERSION, dataStructureVersion);
    }

    public boolean isCommitted() {
        return settings.get(SETTINGS_COMMITTED).filter("1"::equals).isPresent();
    }
}
