package de.t14d3.clientdb.remote;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The source of truth behind the cache, addressed by verb and path.
 *
 * A {@code null} result means the source has no such object. Failures are thrown as unchecked
 * exceptions and are never retried by the cache.
 */
public interface RemoteDataSource {

    /**
     * @param body request payload, {@code null} for none
     */
    JsonNode request(RemoteMethod method, String path, JsonNode body);

    default JsonNode get(String path) {
        return request(RemoteMethod.GET, path, null);
    }

    default JsonNode post(String path, JsonNode body) {
        return request(RemoteMethod.POST, path, body);
    }

    default JsonNode put(String path, JsonNode body) {
        return request(RemoteMethod.PUT, path, body);
    }

    default JsonNode patch(String path, JsonNode body) {
        return request(RemoteMethod.PATCH, path, body);
    }

    default JsonNode delete(String path) {
        return request(RemoteMethod.DELETE, path, null);
    }
}
