package com.dbbridge.api.service;

import com.dbbridge.api.model.ColumnDescriptor;
import com.dbbridge.api.model.ConnectionParams;
import com.dbbridge.api.registry.ConnectionRegistry;
import com.dbbridge.api.registry.ConnectionSummary;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Connection lifecycle and catalog browsing, dispatched through the registry by connection id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionService {

    private final ConnectionRegistry connectionRegistry;

    public String open(String backend, ConnectionParams params) {
        log.info("Opening {} connection with {}", backend, params);
        return connectionRegistry.open(backend, params);
    }

    public List<String> listDatabases(String connectionId) {
        return connectionRegistry.withAdapter(connectionId, adapter -> adapter.listDatabases());
    }

    public void useDatabase(String connectionId, String database) {
        log.info("Switching connection {} to database {}", connectionId, database);
        connectionRegistry.useDatabase(connectionId, database);
    }

    public List<String> listTables(String connectionId) {
        return connectionRegistry.withAdapter(connectionId, adapter -> adapter.listTables());
    }

    public List<ColumnDescriptor> describeTable(String connectionId, String table) {
        return connectionRegistry.withAdapter(connectionId, adapter -> adapter.describeTable(table));
    }

    public void close(String connectionId) {
        connectionRegistry.close(connectionId);
    }

    public List<ConnectionSummary> listConnections() {
        return connectionRegistry.listConnections();
    }

    public List<String> getSupportedBackends() {
        return connectionRegistry.getSupportedBackends();
    }
}
