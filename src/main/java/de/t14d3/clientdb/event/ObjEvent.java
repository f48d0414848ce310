package de.t14d3.clientdb.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A change to the cache. Store-wide events carry an empty collection and id.
 *
 * @param payload the new object for {@link ObjEventType#SET} and {@link ObjEventType#UPDATE}, else {@code null}
 */
public record ObjEvent(ObjEventType type, String collection, String id, JsonNode payload, boolean includeRefs) {

    public ObjEvent {
        Objects.requireNonNull(type, "type");
        collection = collection == null ? "" : collection;
        id = id == null ? "" : id;
    }

    public static ObjEvent storeWide(ObjEventType type) {
        return new ObjEvent(type, "", "", null, false);
    }

    public static ObjEvent forCollection(ObjEventType type, String collection) {
        return new ObjEvent(type, collection, "", null, false);
    }

    public boolean concerns(String collection, String id) {
        return this.collection.equals(collection) && this.id.equals(id);
    }
}
