package de.t14d3.clientdb.exceptions;

public class RemoteException extends ClientDbException {
    private final int statusCode;

    public RemoteException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed exchange, or -1 when the request never completed.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
