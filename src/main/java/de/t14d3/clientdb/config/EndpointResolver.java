package de.t14d3.clientdb.config;

/**
 * Per-collection override of the remote path for an object.
 */
@FunctionalInterface
public interface EndpointResolver {

    /**
     * @param id the object id, or {@code null} for the collection endpoint
     */
    String resolve(String collection, String id);

    static EndpointResolver fixed(String path) {
        return (collection, id) -> path;
    }
}
