package com.dbbridge.api.exception;

import lombok.Getter;

/**
 * Unified exception for every connection, catalog and query failure.
 */
@Getter
public class ConnectionException extends RuntimeException {

    private final ErrorType errorType;
    private final String backend;
    private final String connectionId;

    // ============================================================
    // ENUM DEFINITIONS
    // ============================================================
    public enum ErrorType {
        UNSUPPORTED_BACKEND,
        CONNECT_FAILED,
        CONNECTION_NOT_FOUND,
        BACKEND_ERROR,
        QUERY_FAILED
    }

    // ============================================================
    // CONSTRUCTORS
    // ============================================================
    public ConnectionException(String message, String backend, ErrorType errorType) {
        this(message, backend, null, errorType, null);
    }

    public ConnectionException(String message, String backend, ErrorType errorType, Throwable cause) {
        this(message, backend, null, errorType, cause);
    }

    public ConnectionException(String message, String backend, String connectionId, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.connectionId = connectionId;
        this.errorType = errorType;
    }

    public static ConnectionException notFound(String connectionId) {
        return new ConnectionException(
                "Database connection not found: " + connectionId,
                null,
                connectionId,
                ErrorType.CONNECTION_NOT_FOUND,
                null
        );
    }
}
