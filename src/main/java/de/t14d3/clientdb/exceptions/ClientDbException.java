package de.t14d3.clientdb.exceptions;

public class ClientDbException extends RuntimeException {
    public ClientDbException(String message) {
        super(message);
    }

    public ClientDbException(Throwable cause) {
        super(cause);
    }

    public ClientDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
