package de.t14d3.clientdb.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.clientdb.cache.MemRecord;
import de.t14d3.clientdb.cache.RecordRef;
import de.t14d3.clientdb.config.PrimaryKeys;
import de.t14d3.clientdb.exceptions.ClientDbException;
import de.t14d3.clientdb.exceptions.ConfigurationException;
import de.t14d3.clientdb.remote.RemoteDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Caches the result of an arbitrary endpoint as an id list over a target collection, so the
 * objects themselves are shared with plain {@code getObj} lookups.
 */
public class MappedQueryCache {
    private static final Logger log = LoggerFactory.getLogger(MappedQueryCache.class);

    public static final String DEFAULT_CACHE_ID = "-1";

    private final ObjectCache objectCache;
    private final RemoteDataSource remote;
    private final RequestDeduplicator deduplicator;
    private final PrimaryKeys primaryKeys;
    private final ObjectMapper objectMapper;

    MappedQueryCache(ObjectCache objectCache, RemoteDataSource remote, RequestDeduplicator deduplicator,
                     PrimaryKeys primaryKeys, ObjectMapper objectMapper) {
        this.objectCache = objectCache;
        this.remote = remote;
        this.deduplicator = deduplicator;
        this.primaryKeys = primaryKeys;
        this.objectMapper = objectMapper;
    }

    public static String defaultCacheKey(String endpoint) {
        return "MAPPED:" + endpoint;
    }

    /**
     * @param isCollection whether the endpoint returns an array
     * @param cacheKey     pseudo-collection holding the id snapshot
     * @param cacheId      id of the snapshot within {@code cacheKey}
     * @param bypass       ignore a cached snapshot and always fetch
     * @return a {@code List<JsonNode>} for collections, a {@code JsonNode} otherwise, or {@code null}
     */
    public Object get(String endpoint, boolean isCollection, String cacheKey, String cacheId,
                      String targetCollection, boolean bypass) {
        String key = RequestDeduplicator.key("getMapped", endpoint, isCollection, cacheKey, cacheId, targetCollection);
        return deduplicator.dedupe(key, () -> {
            if (!bypass) {
                Object cached = findCached(cacheKey, cacheId, targetCollection, isCollection);
                if (cached != null) {
                    log.debug("Mapped hit {}:{}", cacheKey, cacheId);
                    return cached;
                }
            }
            return fetch(endpoint, isCollection, cacheKey, cacheId, targetCollection);
        });
    }

    private Object findCached(String cacheKey, String cacheId, String targetCollection, boolean isCollection) {
        Optional<MemRecord> snapshot = objectCache.findLocal(cacheKey, cacheId);
        if (snapshot.isEmpty() || snapshot.get().isExpired(objectCache.now()) || snapshot.get().isAbsent()) {
            return null;
        }
        RecordRef ref = toRecordRef(snapshot.get());
        if (!ref.isCollection()) {
            return null;
        }

        List<JsonNode> objs = new ArrayList<>(ref.ids().size());
        for (String id : ref.ids()) {
            Optional<MemRecord> record = objectCache.findLocal(targetCollection, id);
            if (record.isEmpty() || record.get().isAbsent()) {
                return null;
            }
            objs.add(record.get().obj());
        }

        if (isCollection) {
            return objs;
        }
        return objs.isEmpty() ? null : objs.get(0);
    }

    private Object fetch(String endpoint, boolean isCollection, String cacheKey, String cacheId,
                         String targetCollection) {
        log.debug("Mapped miss {}:{}, fetching {}", cacheKey, cacheId, endpoint);
        JsonNode result = remote.get(endpoint);
        if (result == null || result.isNull()) {
            return null;
        }
        if (result.isArray() != isCollection) {
            throw new ConfigurationException("Mismatch isCollection: " + endpoint + " returned " +
                    (result.isArray() ? "an array" : "a single object"));
        }

        List<JsonNode> items = new ArrayList<>();
        if (result.isArray()) {
            result.forEach(items::add);
        } else {
            items.add(result);
        }

        long expires = objectCache.expiresAt();
        List<MemRecord> records = new ArrayList<>(items.size() + 1);
        List<String> ids = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            String id = primaryKeys.extract(targetCollection, item)
                    .orElseThrow(() -> new ConfigurationException(
                            "Cannot determine the primary key of an object of " + targetCollection));
            ids.add(id);
            records.add(new MemRecord(expires, targetCollection, null, id, item));
        }
        records.add(new MemRecord(expires, cacheKey, targetCollection, cacheId,
                objectMapper.valueToTree(RecordRef.collection(ids))));
        objectCache.setRecords(records);

        return isCollection ? items : result;
    }

    private RecordRef toRecordRef(MemRecord record) {
        try {
            return objectMapper.treeToValue(record.obj(), RecordRef.class);
        } catch (JsonProcessingException e) {
            throw new ClientDbException("Corrupt mapped snapshot " + record.key(), e);
        }
    }
}
