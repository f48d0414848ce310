package de.t14d3.clientdb.exceptions;

/**
 * Raised when a call cannot be served because of how the cache or the remote endpoints are set up,
 * for example a relation property that cannot be inferred or a payload whose arity does not match
 * the requested relation shape. Never retried.
 */
public class ConfigurationException extends ClientDbException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
