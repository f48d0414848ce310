package de.t14d3.clientdb.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory tier. Mirrors a subset of the persisted rows and is filled lazily.
 *
 * Expiry is not enforced here; callers decide what a stale record means.
 *
 * Every removal advances a generation. A row read from the store is only restored if no removal
 * happened since the caller took {@link #generation()} before reading it.
 */
public final class MemCache {

    private final ConcurrentHashMap<RecordKey, MemRecord> map = new ConcurrentHashMap<>();
    private final Object removals = new Object();
    private long generation;

    public Optional<MemRecord> get(RecordKey key) {
        return Optional.ofNullable(map.get(key));
    }

    public void put(MemRecord record) {
        map.put(record.key(), record);
    }

    /**
     * Take before reading rows from the store that may be passed to {@link #restore}.
     */
    public long generation() {
        synchronized (removals) {
            return generation;
        }
    }

    /**
     * Restore a row read from the store unless a newer write already landed in memory.
     * If anything was removed since {@code readGeneration} the row is returned but not cached,
     * as the store read may predate that removal.
     */
    public MemRecord restore(MemRecord record, long readGeneration) {
        synchronized (removals) {
            if (generation != readGeneration) {
                return map.getOrDefault(record.key(), record);
            }
            MemRecord existing = map.putIfAbsent(record.key(), record);
            return existing != null ? existing : record;
        }
    }

    public void invalidate(RecordKey key) {
        synchronized (removals) {
            generation++;
            map.remove(key);
        }
    }

    public int invalidateIf(Predicate<MemRecord> predicate) {
        synchronized (removals) {
            generation++;
            int removed = 0;
            for (MemRecord record : map.values()) {
                if (predicate.test(record) && map.remove(record.key(), record)) {
                    removed++;
                }
            }
            return removed;
        }
    }

    /**
     * Point-in-time copy of the records matching {@code predicate}.
     */
    public List<MemRecord> scan(Predicate<MemRecord> predicate) {
        List<MemRecord> result = new ArrayList<>();
        for (MemRecord record : map.values()) {
            if (predicate.test(record)) {
                result.add(record);
            }
        }
        return result;
    }

    public int size() {
        return map.size();
    }

    public void clear() {
        synchronized (removals) {
            generation++;
            map.clear();
        }
    }
}
