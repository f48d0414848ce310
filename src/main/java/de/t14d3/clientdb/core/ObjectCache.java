package de.t14d3.clientdb.core;

import com.fasterxml.jackson.databind.JsonNode;
import de.t14d3.clientdb.cache.LoadedRefs;
import de.t14d3.clientdb.cache.MemCache;
import de.t14d3.clientdb.cache.MemRecord;
import de.t14d3.clientdb.cache.RecordKey;
import de.t14d3.clientdb.config.PrimaryKeys;
import de.t14d3.clientdb.event.NotificationBus;
import de.t14d3.clientdb.event.ObjEvent;
import de.t14d3.clientdb.event.ObjEventType;
import de.t14d3.clientdb.exceptions.ConfigurationException;
import de.t14d3.clientdb.remote.RemoteDataSource;
import de.t14d3.clientdb.store.RecordTable;
import de.t14d3.clientdb.store.StoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The two storage tiers and the read-through fetch on top of them.
 *
 * Reads look in memory, then in the store, and never take the write lock. Every mutation runs
 * under the {@link WriteLock}, writes the store inside one transaction and then memory, and
 * publishes its event after the lock is released.
 */
public class ObjectCache {
    private static final Logger log = LoggerFactory.getLogger(ObjectCache.class);

    private final StoreAdapter store;
    private final RecordTable table;
    private final MemCache memCache;
    private final LoadedRefs loadedRefs;
    private final WriteLock writeLock;
    private final NotificationBus bus;
    private final RemoteDataSource remote;
    private final RequestDeduplicator deduplicator;
    private final Endpoints endpoints;
    private final PrimaryKeys primaryKeys;
    private final Clock clock;
    private final Duration defaultTtl;

    ObjectCache(StoreAdapter store, RecordTable table, MemCache memCache, LoadedRefs loadedRefs,
                WriteLock writeLock, NotificationBus bus, RemoteDataSource remote,
                RequestDeduplicator deduplicator, Endpoints endpoints, PrimaryKeys primaryKeys,
                Clock clock, Duration defaultTtl) {
        this.store = store;
        this.table = table;
        this.memCache = memCache;
        this.loadedRefs = loadedRefs;
        this.writeLock = writeLock;
        this.bus = bus;
        this.remote = remote;
        this.deduplicator = deduplicator;
        this.endpoints = endpoints;
        this.primaryKeys = primaryKeys;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    // ---------------------------------------------------------------------
    // Read-through
    // ---------------------------------------------------------------------

    /**
     * Cached object, or the remote one if missing or expired.
     *
     * @param endpointOverride path to fetch instead of the collection's endpoint, may be {@code null}
     * @return the object, or {@code null} if the source has none
     */
    public JsonNode get(String collection, Object id, String endpointOverride) {
        if (id == null) {
            return null;
        }
        String objId = String.valueOf(id);
        return deduplicator.dedupe(RequestDeduplicator.key("getObj", collection, objId), () -> {
            Optional<MemRecord> cached = findLocal(collection, objId);
            if (cached.isPresent() && !cached.get().isExpired(now())) {
                log.debug("Cache hit {}:{}", collection, objId);
                return cached.get().value();
            }

            String endpoint = endpointOverride != null ? endpointOverride : endpoints.forObject(collection, objId);
            log.debug("Cache miss {}:{}, fetching {}", collection, objId, endpoint);
            JsonNode obj = remote.get(endpoint);

            setRecords(List.of(new MemRecord(expiresAt(), collection, null, objId, obj)));
            return obj == null || obj.isNull() ? null : obj;
        });
    }

    /**
     * Row from memory, falling back to the store and restoring it into memory.
     * Expiry is not checked.
     */
    public Optional<MemRecord> findLocal(String collection, String id) {
        if (id == null) {
            return Optional.empty();
        }
        RecordKey key = new RecordKey(collection, id);
        Optional<MemRecord> mem = memCache.get(key);
        if (mem.isPresent()) {
            return mem;
        }
        long generation = memCache.generation();
        return table.find(collection, id).map(record -> memCache.restore(record, generation));
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    /**
     * Explicit write of an object keyed by its primary key; never expires.
     */
    public void set(String collection, JsonNode obj) {
        String id = primaryKeys.extract(collection, obj)
                .orElseThrow(() -> new ConfigurationException("Cannot determine the primary key of an object of " + collection));
        setRecords(List.of(new MemRecord(0, collection, null, id, obj)));
    }

    /**
     * Insert or update every record in both tiers, then publish a {@link ObjEventType#SET} per record.
     */
    public void setRecords(List<MemRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        try (WriteLock.Permit permit = writeLock.acquire()) {
            store.inTransaction(session -> {
                for (MemRecord record : records) {
                    table.upsert(session, record);
                }
                return null;
            });

            Set<String> collections = new HashSet<>();
            for (MemRecord record : records) {
                memCache.put(keepRefTag(record));
                collections.add(record.collection());
            }
            collections.forEach(loadedRefs::dropForCollection);
        }
        for (MemRecord record : records) {
            bus.publish(new ObjEvent(ObjEventType.SET, record.collection(), record.objId(), record.value(), false));
        }
    }

    /**
     * Replace a cached, unexpired object with {@code transform(object)}, keeping its expiry and tag.
     *
     * @return whether the object was cached and transformed, {@code false} as well if the row was
     *         written or removed while the transform ran
     * @throws IllegalStateException if {@code transform} returns its argument or {@code null}
     */
    public boolean updateInPlace(String collection, Object id, UnaryOperator<JsonNode> transform) {
        if (id == null) {
            return false;
        }
        Optional<MemRecord> cached = findLocal(collection, String.valueOf(id));
        if (cached.isEmpty() || cached.get().isExpired(now()) || cached.get().isAbsent()) {
            return false;
        }
        MemRecord current = cached.get();
        JsonNode updated = transform.apply(current.obj());
        if (updated == current.obj()) {
            throw new IllegalStateException("updateInPlace transform must return a new object, not mutate its input");
        }
        if (updated == null) {
            throw new IllegalStateException("updateInPlace transform returned null for " + current.key());
        }
        MemRecord record = current.withObj(updated);

        try (WriteLock.Permit permit = writeLock.acquire()) {
            // the transform ran unlocked; the row must still be the one it was given
            Optional<MemRecord> latest = memCache.get(current.key());
            if (latest.isEmpty() || latest.get() != current) {
                log.debug("Skipping update of {}, changed while transforming", current.key());
                return false;
            }
            store.inTransaction(session -> {
                table.upsert(session, record);
                return null;
            });
            memCache.put(record);
            loadedRefs.dropForCollection(collection);
        }
        bus.publish(new ObjEvent(ObjEventType.UPDATE, collection, record.objId(), updated, false));
        return true;
    }

    /**
     * Remove a row, and with {@code includeRefs} every row of the same id tagged with the collection.
     */
    public void removeRecord(String collection, Object id, boolean includeRefs, ObjEventType type) {
        if (id == null) {
            return;
        }
        String objId = String.valueOf(id);
        try (WriteLock.Permit permit = writeLock.acquire()) {
            store.inTransaction(session -> includeRefs
                    ? table.deleteWithRefs(session, collection, objId)
                    : table.delete(session, collection, objId));

            memCache.invalidate(new RecordKey(collection, objId));
            loadedRefs.dropForCollection(collection);
            if (includeRefs) {
                memCache.invalidateIf(r -> collection.equals(r.refCollection()) && r.objId().equals(objId));
                loadedRefs.dropForBase(collection, objId);
            }
        }
        bus.publish(new ObjEvent(type, collection, objId, null, includeRefs));
    }

    /**
     * Remove every row owned by or tagged with {@code collection} and publish
     * {@link ObjEventType#RESET_COLLECTION}.
     */
    public void resetCollection(String collection) {
        int removed;
        try (WriteLock.Permit permit = writeLock.acquire()) {
            removed = store.inTransaction(session -> table.deleteCollection(session, collection));
            memCache.invalidateIf(r -> r.collection().equals(collection) || collection.equals(r.refCollection()));
            loadedRefs.dropInvolving(collection);
        }
        log.debug("Reset collection {} ({} stored rows)", collection, removed);
        bus.publish(ObjEvent.forCollection(ObjEventType.RESET_COLLECTION, collection));
    }

    /**
     * Wipe both tiers, compact the store and publish one store-wide event.
     */
    public void clear(ObjEventType type) {
        try (WriteLock.Permit permit = writeLock.acquire()) {
            store.inTransaction(table::deleteAll);
            table.compact();
            loadedRefs.clear();
            memCache.clear();
        }
        log.info("Cleared client cache ({})", type.wireName());
        bus.publish(ObjEvent.storeWide(type));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    long now() {
        return clock.millis();
    }

    /**
     * Expiry for a record written now with the default TTL; 0 if the TTL is zero.
     */
    long expiresAt() {
        return defaultTtl.isZero() ? 0 : now() + defaultTtl.toMillis();
    }

    private MemRecord keepRefTag(MemRecord record) {
        if (record.refCollection() != null) {
            return record;
        }
        Optional<MemRecord> existing = memCache.get(record.key());
        if (existing.isPresent() && existing.get().refCollection() != null) {
            return new MemRecord(record.expires(), record.collection(), existing.get().refCollection(),
                    record.objId(), record.obj());
        }
        return record;
    }
}
