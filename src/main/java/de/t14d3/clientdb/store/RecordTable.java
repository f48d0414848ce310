package de.t14d3.clientdb.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.clientdb.cache.MemRecord;
import de.t14d3.clientdb.exceptions.ClientDbException;
import de.t14d3.clientdb.query.Dialect;
import de.t14d3.clientdb.query.Query;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Row access for the {@code objs} table holding every cached object and relation snapshot.
 */
public class RecordTable {
    public static final String TABLE = "objs";
    public static final String INDEX = "objsIndex";

    public static final String EXPIRES = "expires";
    public static final String COLLECTION = "collection";
    public static final String REF_COLLECTION = "refCollection";
    public static final String OBJ_ID = "objId";
    public static final String OBJ = "obj";

    private final StoreAdapter store;
    private final Dialect dialect;
    private final ObjectMapper objectMapper;

    public RecordTable(StoreAdapter store, ObjectMapper objectMapper) {
        this.store = Objects.requireNonNull(store, "store");
        this.dialect = store.getDialect();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    // ---------------------------------------------------------------------
    // Schema
    // ---------------------------------------------------------------------

    public List<Query> createStatements() {
        String create = "CREATE TABLE IF NOT EXISTS " + dialect.quoteIdentifier(TABLE) + " (" +
                dialect.quoteIdentifier(EXPIRES) + " BIGINT NOT NULL, " +
                dialect.quoteIdentifier(COLLECTION) + " VARCHAR(150) NOT NULL, " +
                dialect.quoteIdentifier(REF_COLLECTION) + " VARCHAR(150), " +
                dialect.quoteIdentifier(OBJ_ID) + " VARCHAR(255) NOT NULL, " +
                dialect.quoteIdentifier(OBJ) + " " + dialect.textType() +
                ")";
        String index = "CREATE UNIQUE INDEX IF NOT EXISTS " + dialect.quoteIdentifier(INDEX) + " ON " +
                dialect.quoteIdentifier(TABLE) + " (" +
                dialect.quoteIdentifier(OBJ_ID) + ", " + dialect.quoteIdentifier(COLLECTION) + ")";
        return List.of(Query.of(create), Query.of(index));
    }

    public Query dropStatement() {
        return Query.of("DROP TABLE IF EXISTS " + dialect.quoteIdentifier(TABLE));
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    public Optional<MemRecord> find(String collection, String id) {
        Query q = Query.select(dialect, "*")
                .from(TABLE)
                .whereEquals(OBJ_ID, id)
                .whereEquals(COLLECTION, collection)
                .build();
        List<MemRecord> rows = store.query(q, this::mapRow);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Rows of {@code collection} whose payload field {@code foreignKey} equals {@code value},
     * skipping {@code excludedIds}.
     */
    public List<MemRecord> findByForeignKey(String collection, String foreignKey, String value,
                                            Collection<String> excludedIds) {
        Query.SelectBuilder select = Query.select(dialect, "*")
                .from(TABLE)
                .whereEquals(COLLECTION, collection)
                .whereNotIn(OBJ_ID, excludedIds);
        String jsonField = dialect.jsonFieldExpression(OBJ, foreignKey);
        if (jsonField != null) {
            select.where(jsonField + " = ?", value);
        }
        return store.query(select.build(), this::mapRow).stream()
                .filter(record -> matchesForeignKey(record.obj(), foreignKey, value))
                .collect(Collectors.toList());
    }

    /**
     * Row count per collection, pseudo-collections included.
     */
    public Map<String, Long> countByCollection() {
        Query q = Query.select(dialect, COLLECTION, "COUNT(*)")
                .from(TABLE)
                .groupBy(COLLECTION)
                .build();
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : store.query(q, rs -> Map.entry(rs.getString(1), rs.getLong(2)))) {
            counts.put(entry.getKey(), entry.getValue());
        }
        return counts;
    }

    public long count() {
        Query q = Query.select(dialect, "COUNT(*)").from(TABLE).build();
        return store.query(q, rs -> rs.getLong(1)).get(0);
    }

    // ---------------------------------------------------------------------
    // Writes, always inside the caller's transaction
    // ---------------------------------------------------------------------

    /**
     * Insert the row, or update it in place if (objId, collection) already exists.
     * An existing refCollection tag is kept when the new record carries none.
     */
    public void upsert(StoreSession session, MemRecord record) {
        Query exists = Query.select(dialect, "COUNT(*)")
                .from(TABLE)
                .whereEquals(OBJ_ID, record.objId())
                .whereEquals(COLLECTION, record.collection())
                .build();
        long count = session.query(exists, rs -> rs.getLong(1)).get(0);

        if (count > 0) {
            Query.UpdateBuilder update = Query.update(dialect, TABLE)
                    .set(EXPIRES, record.expires())
                    .set(OBJ, serialize(record.obj()));
            if (record.refCollection() != null) {
                update.set(REF_COLLECTION, record.refCollection());
            }
            session.execute(update
                    .whereEquals(OBJ_ID, record.objId())
                    .whereEquals(COLLECTION, record.collection())
                    .build());
        } else {
            session.execute(Query.insertInto(dialect, TABLE)
                    .columns(EXPIRES, COLLECTION, REF_COLLECTION, OBJ_ID, OBJ)
                    .values(record.expires(), record.collection(), record.refCollection(), record.objId(),
                            serialize(record.obj()))
                    .build());
        }
    }

    public int delete(StoreSession session, String collection, String id) {
        return session.execute(Query.deleteFrom(dialect, TABLE)
                .whereEquals(OBJ_ID, id)
                .whereEquals(COLLECTION, collection)
                .build());
    }

    /**
     * Delete the row and every row with the same id tagged {@code refCollection = collection}.
     */
    public int deleteWithRefs(StoreSession session, String collection, String id) {
        return session.execute(Query.deleteFrom(dialect, TABLE)
                .whereEquals(OBJ_ID, id)
                .where(ownedByOrTagged(), collection, collection)
                .build());
    }

    /**
     * Delete every row owned by or tagged with {@code collection}.
     */
    public int deleteCollection(StoreSession session, String collection) {
        return session.execute(Query.deleteFrom(dialect, TABLE)
                .where(ownedByOrTagged(), collection, collection)
                .build());
    }

    public int deleteAll(StoreSession session) {
        return session.execute(Query.deleteFrom(dialect, TABLE).build());
    }

    /**
     * Give freed pages back after a wipe. Runs outside of any transaction.
     */
    public void compact() {
        String sql = dialect.compactStatement(TABLE);
        if (sql != null) {
            store.executeNonTransactional(Query.of(sql));
        }
    }

    // ---------------------------------------------------------------------
    // Mapping
    // ---------------------------------------------------------------------

    public String serialize(JsonNode obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ClientDbException("Failed to serialize cached object", e);
        }
    }

    private MemRecord mapRow(ResultSet rs) throws SQLException {
        String raw = rs.getString(OBJ);
        JsonNode obj;
        try {
            obj = raw == null ? null : objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ClientDbException("Corrupt payload in " + rs.getString(COLLECTION) + ":" + rs.getString(OBJ_ID), e);
        }
        return new MemRecord(
                rs.getLong(EXPIRES),
                rs.getString(COLLECTION),
                rs.getString(REF_COLLECTION),
                rs.getString(OBJ_ID),
                obj);
    }

    private String ownedByOrTagged() {
        return "(" + dialect.quoteIdentifier(COLLECTION) + " = ? OR " + dialect.quoteIdentifier(REF_COLLECTION) + " = ?)";
    }

    /**
     * Foreign keys match when the payload field is a string or number whose text equals {@code value}.
     */
    public static boolean matchesForeignKey(JsonNode obj, String foreignKey, String value) {
        if (obj == null || !obj.isObject()) {
            return false;
        }
        JsonNode field = obj.get(foreignKey);
        if (field == null || !(field.isTextual() || field.isNumber())) {
            return false;
        }
        return field.asText().equals(value);
    }
}
