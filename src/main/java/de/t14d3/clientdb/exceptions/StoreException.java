package de.t14d3.clientdb.exceptions;

public class StoreException extends ClientDbException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
