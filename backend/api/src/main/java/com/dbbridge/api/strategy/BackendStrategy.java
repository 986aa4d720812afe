package com.dbbridge.api.strategy;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ConnectionParams;

/**
 * Knows how to open a connection to one kind of backend. Implementations are
 * registered as Spring beans named after {@link BackendKind#getId()}.
 */
public interface BackendStrategy {

    BackendKind getBackendKind();

    /**
     * Opens a live connection.
     *
     * @throws com.dbbridge.api.exception.ConnectionException with {@code CONNECT_FAILED}
     *         carrying the driver's message when the backend cannot be reached or rejects us
     */
    BackendAdapter connect(ConnectionParams params);

    /**
     * JDBC driver class, used for availability checks.
     */
    String getDriverClassName();
}
