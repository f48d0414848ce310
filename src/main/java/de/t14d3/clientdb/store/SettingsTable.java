package de.t14d3.clientdb.store;

import de.t14d3.clientdb.query.Dialect;
import de.t14d3.clientdb.query.Query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Name/value pairs kept next to the cached rows, used for store versioning.
 */
public class SettingsTable {
    public static final String TABLE = "settings";

    private final StoreAdapter store;
    private final Dialect dialect;

    public SettingsTable(StoreAdapter store) {
        this.store = Objects.requireNonNull(store, "store");
        this.dialect = store.getDialect();
    }

    public void ensureTable() {
        store.execute(Query.of("CREATE TABLE IF NOT EXISTS " + dialect.quoteIdentifier(TABLE) + " (" +
                dialect.quoteIdentifier("name") + " VARCHAR(50) NOT NULL, " +
                dialect.quoteIdentifier("value") + " " + dialect.textType() + " NOT NULL" +
                ")"));
    }

    public Optional<String> get(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        Query q = Query.select(dialect, "value")
                .from(TABLE)
                .whereEquals("name", name)
                .build();
        List<String> values = store.query(q, rs -> rs.getString(1));
        return values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    public void set(String name, String value) {
        if (name == null || name.isEmpty()) {
            return;
        }
        store.inTransaction(session -> {
            Query exists = Query.select(dialect, "COUNT(*)")
                    .from(TABLE)
                    .whereEquals("name", name)
                    .build();
            long count = session.query(exists, rs -> rs.getLong(1)).get(0);
            if (count > 0) {
                session.execute(Query.update(dialect, TABLE)
                        .set("value", value)
                        .whereEquals("name", name)
                        .build());
            } else {
                session.execute(Query.insertInto(dialect, TABLE)
                        .columns("name", "value")
                        .values(name, value)
                        .build());
            }
            return null;
        });
    }
}
