package de.t14d3.clientdb.core;

import de.t14d3.clientdb.config.ClientDbConfig;
import de.t14d3.clientdb.config.EndpointResolver;

/**
 * Remote paths: {@code crudPrefix + collection [+ '/' + id] [+ '/' + property]}, unless the
 * collection has an endpoint override, to which only {@code '/' + property} is appended.
 */
final class Endpoints {
    private final ClientDbConfig config;

    Endpoints(ClientDbConfig config) {
        this.config = config;
    }

    String forCollection(String collection) {
        return build(collection, null, null);
    }

    String forObject(String collection, String id) {
        return build(collection, id, null);
    }

    String forRelation(String collection, String id, String property) {
        return build(collection, id, property);
    }

    private String build(String collection, String id, String property) {
        EndpointResolver custom = config.getEndpointMap().get(collection);
        String base = custom != null ? custom.resolve(collection, id) : null;
        if (base == null || base.isEmpty()) {
            base = config.getCrudPrefix() + collection + (id == null ? "" : "/" + id);
        }
        return property == null || property.isEmpty() ? base : base + "/" + property;
    }
}
