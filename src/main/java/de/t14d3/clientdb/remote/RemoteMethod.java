package de.t14d3.clientdb.remote;

public enum RemoteMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
