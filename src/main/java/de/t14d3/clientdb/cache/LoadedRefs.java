package de.t14d3.clientdb.cache;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Memory-only markers recording that a relation's rows were already scanned out of the store.
 *
 * A marker for (collection, foreignKey, baseId) means every persisted row of {@code collection}
 * whose {@code foreignKey} equals {@code baseId} is resident in memory.
 */
public final class LoadedRefs {

    public record LoadedRef(String collection, String refCollection, String foreignKey, String baseId) {
        String key() {
            return keyOf(collection, foreignKey, baseId);
        }
    }

    private final ConcurrentHashMap<String, LoadedRef> markers = new ConcurrentHashMap<>();

    public boolean isLoaded(String collection, String foreignKey, String baseId) {
        return markers.containsKey(keyOf(collection, foreignKey, baseId));
    }

    public void mark(LoadedRef ref) {
        markers.put(ref.key(), ref);
    }

    public void drop(String collection, String foreignKey, String baseId) {
        markers.remove(keyOf(collection, foreignKey, baseId));
    }

    /**
     * A row of {@code collection} was written or removed.
     */
    public void dropForCollection(String collection) {
        markers.values().removeIf(ref -> ref.collection().equals(collection));
    }

    /**
     * The base object {@code baseId} of {@code refCollection} was reset along with its relations.
     */
    public void dropForBase(String refCollection, String baseId) {
        markers.values().removeIf(ref -> ref.refCollection().equals(refCollection) && ref.baseId().equals(baseId));
    }

    /**
     * Every marker touching {@code collection} on either side of the relation.
     */
    public void dropInvolving(String collection) {
        markers.values().removeIf(ref -> ref.collection().equals(collection) || ref.refCollection().equals(collection));
    }

    public int size() {
        return markers.size();
    }

    public void clear() {
        markers.clear();
    }

    private static String keyOf(String collection, String foreignKey, String baseId) {
        return collection + ":" + foreignKey + ":" + baseId;
    }
}
