package de.t14d3.clientdb.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * A cached row with its payload parsed.
 *
 * A confirmed-absent object is held as JSON null, never as a Java {@code null}.
 */
public final class MemRecord {
    private final long expires; // epoch millis, 0 means no expiry
    private final String collection;
    private final String refCollection;
    private final String objId;
    private final JsonNode obj;

    public MemRecord(long expires, String collection, String refCollection, String objId, JsonNode obj) {
        this.expires = expires;
        this.collection = Objects.requireNonNull(collection, "collection");
        this.refCollection = refCollection == null || refCollection.isEmpty() ? null : refCollection;
        this.objId = Objects.requireNonNull(objId, "objId");
        this.obj = obj == null || obj.isMissingNode() ? NullNode.getInstance() : obj;
    }

    public long expires() {
        return expires;
    }

    public String collection() {
        return collection;
    }

    public String refCollection() {
        return refCollection;
    }

    public String objId() {
        return objId;
    }

    public JsonNode obj() {
        return obj;
    }

    public RecordKey key() {
        return new RecordKey(collection, objId);
    }

    /**
     * The remote source confirmed there is no such object.
     */
    public boolean isAbsent() {
        return obj.isNull();
    }

    /**
     * Payload as returned to callers: {@code null} for a confirmed-absent object.
     */
    public JsonNode value() {
        return isAbsent() ? null : obj;
    }

    public boolean isExpired(long nowMillis) {
        return expires > 0 && nowMillis >= expires;
    }

    public MemRecord withObj(JsonNode newObj) {
        return new MemRecord(expires, collection, refCollection, objId, newObj);
    }

    @Override
    public String toString() {
        return key() + (refCollection == null ? "" : " (ref " + refCollection + ")");
    }
}
