package com.dbbridge.api.registry;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.config.BackendConfiguration;
import com.dbbridge.api.exception.ConnectionException;
import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ConnectionParams;
import com.dbbridge.api.strategy.BackendStrategy;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns every open connection, addressed by an opaque id.
 *
 * <p>Operations against one id are serialized on that handle's lock; operations against
 * different ids share nothing but the map itself. Shutting the application context down
 * closes whatever is still open.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionRegistry {

    private final Map<String, BackendStrategy> strategies;   // Spring injects all strategies by bean name
    private final BackendConfiguration backendConfiguration;

    private final Map<String, ConnectionHandle> connections = new ConcurrentHashMap<>();

    // ============================================================
    // 1️⃣ OPEN
    // ============================================================
    public String open(String backend, ConnectionParams params) {
        BackendKind kind = BackendKind.fromId(backend);
        BackendStrategy strategy = resolveStrategy(kind);

        BackendAdapter adapter = strategy.connect(params);

        String id = UUID.randomUUID().toString();
        connections.put(id, new ConnectionHandle(id, kind, params, adapter));
        log.info("Opened {} connection {} ({} open)", kind.getId(), id, connections.size());
        return id;
    }

    private BackendStrategy resolveStrategy(BackendKind kind) {
        if (!backendConfiguration.isBackendEnabled(kind.getId())) {
            throw new ConnectionException(
                    "Database type is disabled: " + kind.getId(),
                    kind.getId(),
                    ConnectionException.ErrorType.UNSUPPORTED_BACKEND
            );
        }
        BackendStrategy strategy = strategies.get(kind.getId());
        if (strategy == null) {
            throw new ConnectionException(
                    "Unsupported database type: " + kind.getId(),
                    kind.getId(),
                    ConnectionException.ErrorType.UNSUPPORTED_BACKEND
            );
        }
        return strategy;
    }

    // ============================================================
    // 2️⃣ LOOKUP AND SERIALIZED ACCESS
    // ============================================================
    public ConnectionHandle get(String id) {
        ConnectionHandle handle = id != null ? connections.get(id) : null;
        if (handle == null || handle.isClosed()) {
            throw ConnectionException.notFound(id);
        }
        return handle;
    }

    /**
     * Runs {@code operation} while holding the handle's lock. A handle closed while the
     * caller was waiting is reported as not found.
     */
    public <T> T withHandle(String id, Function<ConnectionHandle, T> operation) {
        ConnectionHandle handle = get(id);
        handle.lock();
        try {
            if (handle.isClosed()) {
                throw ConnectionException.notFound(id);
            }
            return operation.apply(handle);
        } finally {
            handle.unlock();
        }
    }

    public <T> T withAdapter(String id, Function<BackendAdapter, T> operation) {
        return withHandle(id, handle -> operation.apply(handle.getAdapter()));
    }

    // ============================================================
    // 3️⃣ DATABASE SWITCH
    // ============================================================
    public void useDatabase(String id, String database) {
        withHandle(id, handle -> {
            BackendAdapter current = handle.getAdapter();
            if (!current.requiresSessionReplacement()) {
                current.useDatabase(database);
                handle.setActiveDatabase(current.getActiveDatabase());
                return null;
            }
            replaceSession(handle, database);
            return null;
        });
    }

    /**
     * Connects anew bound to {@code database}, then releases the old connection and installs
     * the new one. A failed connect leaves the handle exactly as it was.
     */
    private void replaceSession(ConnectionHandle handle, String database) {
        BackendKind kind = handle.getBackendKind();
        ConnectionParams replacementParams = handle.getParams().withDatabase(database);

        BackendAdapter replacement;
        try {
            replacement = resolveStrategy(kind).connect(replacementParams);
        } catch (ConnectionException e) {
            log.warn("Switching connection {} to database {} failed, keeping {}: {}",
                    handle.getId(), database, handle.getActiveDatabase(), e.getMessage());
            throw new ConnectionException(e.getMessage(), kind.getId(), handle.getId(),
                    ConnectionException.ErrorType.BACKEND_ERROR, e);
        }

        handle.getAdapter().close();
        handle.install(replacement, replacementParams);
        log.info("Connection {} now bound to database {}", handle.getId(), handle.getActiveDatabase());
    }

    // ============================================================
    // 4️⃣ CLOSE
    // ============================================================
    public void close(String id) {
        ConnectionHandle handle = id != null ? connections.get(id) : null;
        if (handle == null) {
            log.debug("Close requested for unknown connection {}", id);
            return;
        }
        handle.lock();
        try {
            if (!handle.isClosed()) {
                handle.getAdapter().close();
                handle.markClosed();
                log.info("Closed {} connection {}", handle.getBackendKind().getId(), id);
            }
            connections.remove(id, handle);
        } finally {
            handle.unlock();
        }
    }

    @PreDestroy
    public void closeAll() {
        if (connections.isEmpty()) return;
        log.info("Closing {} open connections", connections.size());
        new ArrayList<>(connections.keySet()).forEach(this::close);
    }

    // ============================================================
    // 5️⃣ INTROSPECTION
    // ============================================================
    public List<ConnectionSummary> listConnections() {
        return connections.values().stream()
                .filter(handle -> !handle.isClosed())
                .map(ConnectionSummary::of)
                .sorted(Comparator.comparing(ConnectionSummary::openedAt))
                .collect(Collectors.toList());
    }

    public int size() {
        return connections.size();
    }

    public List<String> getSupportedBackends() {
        return BackendKind.ids().stream()
                .filter(strategies::containsKey)
                .filter(backendConfiguration::isBackendEnabled)
                .collect(Collectors.toList());
    }
}
