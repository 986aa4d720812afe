package com.dbbridge.api.registry;

import java.time.Instant;

public record ConnectionSummary(String connectionId, String backend, String host, String activeDatabase, Instant openedAt) {

    static ConnectionSummary of(ConnectionHandle handle) {
        return new ConnectionSummary(
                handle.getId(),
                handle.getBackendKind().getId(),
                handle.getParams().getHost(),
                handle.getActiveDatabase(),
                handle.getOpenedAt()
        );
    }
}
