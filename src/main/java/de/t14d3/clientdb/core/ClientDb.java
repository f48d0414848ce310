package de.t14d3.clientdb.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.clientdb.cache.LoadedRefs;
import de.t14d3.clientdb.cache.MemCache;
import de.t14d3.clientdb.cache.MemRecord;
import de.t14d3.clientdb.config.ClientDbConfig;
import de.t14d3.clientdb.config.PrimaryKeys;
import de.t14d3.clientdb.event.CascadeInvalidator;
import de.t14d3.clientdb.event.InvalidationQueue;
import de.t14d3.clientdb.event.NotificationBus;
import de.t14d3.clientdb.event.ObjEventType;
import de.t14d3.clientdb.event.ObjListener;
import de.t14d3.clientdb.exceptions.ClientDbException;
import de.t14d3.clientdb.exceptions.ConfigurationException;
import de.t14d3.clientdb.migration.SchemaMigrator;
import de.t14d3.clientdb.remote.RemoteDataSource;
import de.t14d3.clientdb.store.JdbcStoreAdapter;
import de.t14d3.clientdb.store.RecordTable;
import de.t14d3.clientdb.store.SettingsTable;
import de.t14d3.clientdb.store.StoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.UnaryOperator;

/**
 * Offline-first cache in front of a {@link RemoteDataSource}.
 *
 * Objects are addressed by collection and id and live in two tiers: an in-memory map and a
 * persistent row store. Reads are served locally while fresh and fetched otherwise; every
 * mutation is published to registered {@link ObjListener}s.
 *
 * <pre>
 * try (ClientDb db = ClientDb.create(remote, config)) {
 *     db.init();
 *     JsonNode user = db.getObj("users", 42);
 * }
 * </pre>
 *
 * All state is owned by the instance; several isolated instances can share a JVM.
 */
public class ClientDb implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ClientDb.class);

    private final ClientDbConfig config;
    private final StoreAdapter store;
    private final RemoteDataSource remote;
    private final ObjectMapper objectMapper;
    private final RecordTable table;
    private final SettingsTable settings;
    private final MemCache memCache;
    private final LoadedRefs loadedRefs;
    private final NotificationBus bus;
    private final WriteLock writeLock;
    private final RequestDeduplicator deduplicator;
    private final PrimaryKeys primaryKeys;
    private final Endpoints endpoints;
    private final ObjectCache objectCache;
    private final ReferenceResolver referenceResolver;
    private final MappedQueryCache mappedQueryCache;
    private final InvalidationQueue invalidationQueue;
    private final ExecutorService ownedExecutor;
    private volatile boolean initialized;

    public ClientDb(RemoteDataSource remote, StoreAdapter store, ClientDbConfig config) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.objectMapper = config.getObjectMapper();
        this.table = new RecordTable(store, objectMapper);
        this.settings = new SettingsTable(store);
        this.memCache = new MemCache();
        this.loadedRefs = new LoadedRefs();
        this.bus = new NotificationBus();
        this.writeLock = new WriteLock();
        this.deduplicator = new RequestDeduplicator();
        this.primaryKeys = new PrimaryKeys(config);
        this.endpoints = new Endpoints(config);
        this.objectCache = new ObjectCache(store, table, memCache, loadedRefs, writeLock, bus, remote,
                deduplicator, endpoints, primaryKeys, config.getClock(), config.getDefaultTtl());
        this.referenceResolver = new ReferenceResolver(objectCache, memCache, loadedRefs, table, remote,
                deduplicator, endpoints, primaryKeys, objectMapper);
        this.mappedQueryCache = new MappedQueryCache(objectCache, remote, deduplicator, primaryKeys, objectMapper);

        Executor executor = config.getInvalidationExecutor();
        if (executor == null) {
            this.ownedExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "clientdb-invalidation");
                thread.setDaemon(true);
                return thread;
            });
            executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }
        this.invalidationQueue = new InvalidationQueue(executor, objectCache::resetCollection);
        bus.addListener(new CascadeInvalidator(config.getRelations(), invalidationQueue));
    }

    /**
     * Open the store named by {@link ClientDbConfig#getJdbcUrl()}. The store is closed with this instance.
     */
    public static ClientDb create(RemoteDataSource remote, ClientDbConfig config) {
        return new ClientDb(remote, JdbcStoreAdapter.open(config), config);
    }

    /**
     * Prepare the store. Must be called once before any other operation.
     */
    public synchronized void init() {
        if (initialized) {
            return;
        }
        new SchemaMigrator(store, settings, table, config.getDataStructureVersion()).migrate();
        initialized = true;
        log.info("ClientDb ready ({})", store.getDialect());
    }

    public boolean isInitialized() {
        return initialized;
    }

    // ---------------------------------------------------------------------
    // Objects
    // ---------------------------------------------------------------------

    public JsonNode getObj(String collection, Object id) {
        return getObj(collection, id, (String) null);
    }

    /**
     * @param endpointOverride remote path used instead of the collection's endpoint
     */
    public JsonNode getObj(String collection, Object id, String endpointOverride) {
        checkInit();
        return objectCache.get(collection, id, endpointOverride);
    }

    public <T> T getObj(String collection, Object id, Class<T> type) {
        return convert(getObj(collection, id), type);
    }

    /**
     * Local record without contacting the remote source. An empty result means not loaded; a
     * record whose {@link MemRecord#isAbsent()} holds means the source confirmed there is none.
     */
    public Optional<MemRecord> peek(String collection, Object id) {
        checkInit();
        return id == null ? Optional.empty() : objectCache.findLocal(collection, String.valueOf(id));
    }

    /**
     * @return the object's primary key, or {@code ""} if it has none
     */
    public String getPrimaryKey(String collection, JsonNode obj) {
        return primaryKeys.extract(collection, obj).orElse("");
    }

    public void set(String collection, JsonNode obj) {
        checkInit();
        objectCache.set(collection, obj);
    }

    public boolean updateInPlace(String collection, Object id, UnaryOperator<JsonNode> transform) {
        checkInit();
        return objectCache.updateInPlace(collection, id, transform);
    }

    public void reset(String collection, Object id) {
        reset(collection, id, false);
    }

    /**
     * Drop a cached object so the next read refetches it.
     *
     * @param includeRefs also drop the relation snapshots taken from this object
     */
    public void reset(String collection, Object id, boolean includeRefs) {
        checkInit();
        objectCache.removeRecord(collection, id, includeRefs, ObjEventType.RESET);
    }

    public void delete(String collection, Object id) {
        checkInit();
        objectCache.removeRecord(collection, id, false, ObjEventType.DELETE);
    }

    public void resetCollection(String collection) {
        checkInit();
        objectCache.resetCollection(collection);
    }

    public void resetAll() {
        checkInit();
        objectCache.clear(ObjEventType.RESET_ALL);
    }

    public void clearAll() {
        checkInit();
        objectCache.clear(ObjEventType.CLEAR_ALL);
    }

    // ---------------------------------------------------------------------
    // Relations and mapped queries
    // ---------------------------------------------------------------------

    /**
     * The object of {@code refCollection} the base object points to with {@code foreignKey}.
     *
     * @param property relation path segment; inferred from {@code foreignKey} ({@code customerId}
     *                 becomes {@code customer}) when {@code null}
     */
    public JsonNode getObjRefSingle(String collection, Object id, String refCollection, String property,
                                    String foreignKey) {
        checkInit();
        return referenceResolver.resolveSingle(collection, id, refCollection, property, foreignKey);
    }

    /**
     * The objects of {@code refCollection} whose {@code foreignKey} is the base object's id.
     */
    public List<JsonNode> getObjRefCollection(String collection, Object id, String refCollection, String property,
                                              String foreignKey) {
        checkInit();
        return referenceResolver.resolveCollection(collection, id, refCollection, property, foreignKey);
    }

    /**
     * @return a {@code List<JsonNode>} when {@code isCollection}, otherwise a {@code JsonNode};
     * {@code null} if the endpoint has nothing
     * @see MappedQueryCache#get
     */
    public Object getMapped(String endpoint, boolean isCollection, String cacheKey, String cacheId,
                            String targetCollection, boolean bypass) {
        checkInit();
        String key = cacheKey != null ? cacheKey : MappedQueryCache.defaultCacheKey(endpoint);
        String id = cacheId != null ? cacheId : MappedQueryCache.DEFAULT_CACHE_ID;
        return mappedQueryCache.get(endpoint, isCollection, key, id, targetCollection, bypass);
    }

    public Object getMapped(String endpoint, boolean isCollection, String targetCollection) {
        return getMapped(endpoint, isCollection, null, null, targetCollection, false);
    }

    @SuppressWarnings("unchecked")
    public List<JsonNode> getMappedCollection(String endpoint, String targetCollection) {
        return (List<JsonNode>) getMapped(endpoint, true, targetCollection);
    }

    public JsonNode getMappedObject(String endpoint, String targetCollection) {
        return (JsonNode) getMapped(endpoint, false, targetCollection);
    }

    // ---------------------------------------------------------------------
    // Write-through
    // ---------------------------------------------------------------------

    /**
     * POST {@code body} to the collection endpoint and cache the created object.
     */
    public JsonNode create(String collection, JsonNode body) {
        checkInit();
        JsonNode created = remote.post(endpoints.forCollection(collection), body);
        if (created == null || created.isNull()) {
            return null;
        }
        String id = primaryKeys.extract(collection, created)
                .orElseThrow(() -> new ConfigurationException("Cannot determine the primary key of an object of " + collection));
        cacheFetched(collection, id, created);
        return created;
    }

    /**
     * PUT {@code body} to the object endpoint and cache the result.
     */
    public JsonNode replace(String collection, Object id, JsonNode body) {
        checkInit();
        String objId = String.valueOf(Objects.requireNonNull(id, "id"));
        return writeThrough(collection, objId, remote.put(endpoints.forObject(collection, objId), body));
    }

    /**
     * PATCH the object with {@code body} and cache the result.
     */
    public JsonNode patch(String collection, Object id, JsonNode body) {
        checkInit();
        String objId = String.valueOf(Objects.requireNonNull(id, "id"));
        return writeThrough(collection, objId, remote.patch(endpoints.forObject(collection, objId), body));
    }

    /**
     * DELETE the object remotely, then locally.
     */
    public void remove(String collection, Object id) {
        checkInit();
        String objId = String.valueOf(Objects.requireNonNull(id, "id"));
        remote.delete(endpoints.forObject(collection, objId));
        objectCache.removeRecord(collection, objId, false, ObjEventType.DELETE);
    }

    private JsonNode writeThrough(String collection, String id, JsonNode result) {
        if (result == null || result.isNull()) {
            objectCache.removeRecord(collection, id, false, ObjEventType.RESET);
            return null;
        }
        cacheFetched(collection, primaryKeys.extract(collection, result).orElse(id), result);
        return result;
    }

    private void cacheFetched(String collection, String id, JsonNode obj) {
        objectCache.setRecords(List.of(new MemRecord(objectCache.expiresAt(), collection, null, id, obj)));
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    public void addListener(ObjListener listener) {
        bus.addListener(listener);
    }

    public void removeListener(ObjListener listener) {
        bus.removeListener(listener);
    }

    /**
     * Run queued cascade resets on the calling thread.
     *
     * @return the number of collections reset
     */
    public int runPendingInvalidations() {
        checkInit();
        return invalidationQueue.drain();
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    /**
     * Stored row count per collection, relation and mapped snapshots included.
     */
    public Map<String, Long> countByCollection() {
        checkInit();
        return table.countByCollection();
    }

    public int memCacheSize() {
        return memCache.size();
    }

    /**
     * Relations whose stored rows were already scanned into memory.
     */
    public int loadedRefCount() {
        return loadedRefs.size();
    }

    public ClientDbConfig getConfig() {
        return config;
    }

    public StoreAdapter getStore() {
        return store;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        store.close();
    }

    private void checkInit() {
        if (!initialized) {
            throw new IllegalStateException("ClientDb not initialized");
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        if (node == null) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ClientDbException("Cannot convert cached object to " + type.getName(), e);
        }
    }
}
