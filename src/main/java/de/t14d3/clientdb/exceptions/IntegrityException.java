package de.t14d3.clientdb.exceptions;

/**
 * A cached row set violates the (objId, collection) uniqueness the cache relies on.
 */
public class IntegrityException extends ClientDbException {
    public IntegrityException(String message) {
        super(message);
    }
}
