package de.t14d3.clientdb.cache;

import java.util.Objects;

/**
 * Identity of a cached row: collection plus stringified object id.
 */
public final class RecordKey {
    private final String collection;
    private final String id;

    public RecordKey(String collection, String id) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.id = Objects.requireNonNull(id, "id");
    }

    public static RecordKey of(String collection, Object id) {
        if (collection == null) {
            throw new IllegalArgumentException("collection must not be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        return new RecordKey(collection, String.valueOf(id));
    }

    public String collection() {
        return collection;
    }

    public String id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordKey recordKey)) return false;
        return collection.equals(recordKey.collection) && id.equals(recordKey.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, id);
    }

    @Override
    public String toString() {
        return collection + ":" + id;
    }
}
