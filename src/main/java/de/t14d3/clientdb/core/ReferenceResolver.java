package de.t14d3.clientdb.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.clientdb.cache.LoadedRefs;
import de.t14d3.clientdb.cache.MemCache;
import de.t14d3.clientdb.cache.MemRecord;
import de.t14d3.clientdb.cache.RecordRef;
import de.t14d3.clientdb.config.PrimaryKeys;
import de.t14d3.clientdb.event.ObjEventType;
import de.t14d3.clientdb.exceptions.ClientDbException;
import de.t14d3.clientdb.exceptions.ConfigurationException;
import de.t14d3.clientdb.exceptions.IntegrityException;
import de.t14d3.clientdb.remote.RemoteDataSource;
import de.t14d3.clientdb.store.RecordTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves foreign-key relations between cached collections.
 *
 * A resolved relation is remembered as a {@link RecordRef} snapshot stored in the pseudo-collection
 * {@code {baseCollection}:REF:{property}} under the base object's id. While the snapshot is fresh
 * and every referenced row is resident, the relation is materialized locally; otherwise it is
 * fetched again from {@code {baseEndpoint}/{property}}.
 */
public class ReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ObjectCache objectCache;
    private final MemCache memCache;
    private final LoadedRefs loadedRefs;
    private final RecordTable table;
    private final RemoteDataSource remote;
    private final RequestDeduplicator deduplicator;
    private final Endpoints endpoints;
    private final PrimaryKeys primaryKeys;
    private final ObjectMapper objectMapper;

    ReferenceResolver(ObjectCache objectCache, MemCache memCache, LoadedRefs loadedRefs, RecordTable table,
                      RemoteDataSource remote, RequestDeduplicator deduplicator, Endpoints endpoints,
                      PrimaryKeys primaryKeys, ObjectMapper objectMapper) {
        this.objectCache = objectCache;
        this.memCache = memCache;
        this.loadedRefs = loadedRefs;
        this.table = table;
        this.remote = remote;
        this.deduplicator = deduplicator;
        this.endpoints = endpoints;
        this.primaryKeys = primaryKeys;
        this.objectMapper = objectMapper;
    }

    /**
     * Name of the pseudo-collection holding the snapshots of one relation property.
     */
    public static String refFlag(String collection, String property) {
        return collection + ":REF:" + property;
    }

    /**
     * {@code customerId} names the relation property {@code customer}.
     */
    public static String inferProperty(String collection, String foreignKey) {
        if (foreignKey != null && foreignKey.endsWith("Id") && foreignKey.length() > 2) {
            return foreignKey.substring(0, foreignKey.length() - 2);
        }
        throw new ConfigurationException("Unable to determine the property of collection " + collection +
                " based on foreignKey " + foreignKey);
    }

    /**
     * The object of {@code refCollection} referenced by {@code foreignKey} of the base object.
     *
     * @param property relation property, inferred from {@code foreignKey} when {@code null}
     */
    public JsonNode resolveSingle(String collection, Object id, String refCollection, String property,
                                  String foreignKey) {
        String prop = property == null || property.isEmpty() ? inferProperty(collection, foreignKey) : property;
        Object result = resolve(collection, id, refCollection, prop, foreignKey, false);
        return (JsonNode) result;
    }

    /**
     * The objects of {@code refCollection} whose {@code foreignKey} is the base object's id,
     * in the order the remote source returned them.
     */
    @SuppressWarnings("unchecked")
    public List<JsonNode> resolveCollection(String collection, Object id, String refCollection, String property,
                                            String foreignKey) {
        if (property == null || property.isEmpty()) {
            throw new ConfigurationException("A collection relation of " + collection + " requires a property");
        }
        return (List<JsonNode>) resolve(collection, id, refCollection, property, foreignKey, true);
    }

    private Object resolve(String collection, Object id, String refCollection, String property,
                           String foreignKey, boolean isCollection) {
        if (id == null) {
            return null;
        }
        String baseId = String.valueOf(id);
        String key = RequestDeduplicator.key("getObjRef", collection, baseId, refCollection, property, foreignKey, isCollection);
        return deduplicator.dedupe(key, () -> {
            String refFlag = refFlag(collection, property);

            Optional<MemRecord> cached = objectCache.findLocal(refFlag, baseId);
            if (cached.isPresent() && !cached.get().isExpired(objectCache.now()) && !cached.get().isAbsent()) {
                RecordRef ref = toRecordRef(cached.get());
                Object local = isCollection
                        ? findLocalCollection(refCollection, collection, foreignKey, baseId, ref)
                        : findLocalSingle(collection, refCollection, foreignKey, baseId, ref);
                if (local != null) {
                    log.debug("Relation {}:{} resolved locally", refFlag, baseId);
                    return local;
                }
                // snapshot no longer matches the resident rows
                objectCache.removeRecord(refFlag, baseId, false, ObjEventType.DELETE);
            }

            return fetchRelation(collection, baseId, refCollection, property, refFlag, isCollection);
        });
    }

    private Object fetchRelation(String collection, String baseId, String refCollection, String property,
                                 String refFlag, boolean isCollection) {
        String endpoint = endpoints.forRelation(collection, baseId, property);
        log.debug("Fetching relation {}:{} from {}", refFlag, baseId, endpoint);
        JsonNode result = remote.get(endpoint);
        if (result == null || result.isNull()) {
            return null;
        }

        boolean isArray = result.isArray();
        if (isArray != isCollection) {
            throw new ConfigurationException("Mismatch isCollection: relation " + refFlag + " expects " +
                    (isCollection ? "an array" : "a single object") + " from " + endpoint);
        }

        long expires = objectCache.expiresAt();
        List<MemRecord> records = new ArrayList<>();
        List<JsonNode> items = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        if (isArray) {
            result.forEach(items::add);
        } else {
            items.add(result);
        }
        for (JsonNode item : items) {
            String itemId = requirePrimaryKey(refCollection, item);
            ids.add(itemId);
            records.add(new MemRecord(expires, refCollection, collection, itemId, item));
        }

        RecordRef ref = isArray ? RecordRef.collection(ids) : RecordRef.single(ids.get(0));
        records.add(new MemRecord(expires, refFlag, collection, baseId, objectMapper.valueToTree(ref)));
        objectCache.setRecords(records);

        return isArray ? items : result;
    }

    /**
     * Materialize a collection relation from resident rows, or {@code null} if the snapshot
     * cannot be fully satisfied.
     */
    private List<JsonNode> findLocalCollection(String collection, String refCollection, String foreignKey,
                                               String baseId, RecordRef ref) {
        if (!ref.isCollection()) {
            throw new ConfigurationException("Relation snapshot of " + refCollection + ":" + baseId + " holds no id list");
        }
        boolean loaded = loadedRefs.isLoaded(collection, foreignKey, baseId);

        // memory is keyed by (collection, id), so its matches are distinct
        Map<String, JsonNode> matches = new LinkedHashMap<>();
        for (MemRecord record : memCache.scan(r -> r.collection().equals(collection)
                && RecordTable.matchesForeignKey(r.obj(), foreignKey, baseId))) {
            matches.put(record.objId(), record.obj());
        }

        if (!loaded) {
            if (matches.size() != ref.ids().size()) {
                long generation = memCache.generation();
                List<MemRecord> stored = table.findByForeignKey(collection, foreignKey, baseId, matches.keySet());
                for (MemRecord record : stored) {
                    // only a store created without the unique objsIndex can repeat an id
                    if (matches.containsKey(record.objId())) {
                        throw new IntegrityException("Duplicate stored key " + collection + ":" + record.objId());
                    }
                    matches.put(record.objId(), memCache.restore(record, generation).obj());
                }
            }
            loadedRefs.mark(new LoadedRefs.LoadedRef(collection, refCollection, foreignKey, baseId));
        }

        if (matches.size() != ref.ids().size()) {
            loadedRefs.drop(collection, foreignKey, baseId);
            return null;
        }

        List<JsonNode> objs = new ArrayList<>(ref.ids().size());
        for (String refId : ref.ids()) {
            JsonNode obj = matches.get(refId);
            if (obj == null) {
                return null;
            }
            objs.add(obj);
        }
        return objs;
    }

    /**
     * Follow the base object's foreign key to a resident target, or {@code null}.
     */
    private JsonNode findLocalSingle(String collection, String refCollection, String foreignKey, String baseId,
                                     RecordRef ref) {
        if (ref.id() == null) {
            throw new ConfigurationException("Relation snapshot of " + collection + ":" + baseId + " holds no id");
        }
        Optional<MemRecord> parent = objectCache.findLocal(collection, baseId);
        if (parent.isEmpty() || parent.get().isAbsent()) {
            return null;
        }

        JsonNode fKey = parent.get().obj().get(foreignKey);
        if (fKey == null || !(fKey.isTextual() || fKey.isNumber())) {
            return null;
        }

        return objectCache.findLocal(refCollection, fKey.asText())
                .map(MemRecord::value)
                .orElse(null);
    }

    private RecordRef toRecordRef(MemRecord record) {
        try {
            return objectMapper.treeToValue(record.obj(), RecordRef.class);
        } catch (JsonProcessingException e) {
            throw new ClientDbException("Corrupt relation snapshot " + record.key(), e);
        }
    }

    private String requirePrimaryKey(String collection, JsonNode item) {
        return primaryKeys.extract(collection, item)
                .orElseThrow(() -> new ConfigurationException(
                        "Cannot determine the primary key of an object of " + collection));
    }
}
