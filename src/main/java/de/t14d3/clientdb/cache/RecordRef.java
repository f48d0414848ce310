package de.t14d3.clientdb.cache;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Snapshot of a resolved relation: the single related id or the ordered id list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordRef(String id, List<String> ids) {

    public static RecordRef single(String id) {
        return new RecordRef(id, null);
    }

    public static RecordRef collection(List<String> ids) {
        return new RecordRef(null, List.copyOf(ids));
    }

    public boolean isCollection() {
        return ids != null;
    }

    /**
     * The single id, or the first entry of an id list.
     */
    public String firstId() {
        if (id != null) {
            return id;
        }
        return ids == null || ids.isEmpty() ? null : ids.get(0);
    }
}
