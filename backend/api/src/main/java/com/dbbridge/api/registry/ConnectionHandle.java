package com.dbbridge.api.registry;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ConnectionParams;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Registry record for one open connection. The adapter is owned exclusively by this
 * handle; mutation happens only through {@link ConnectionRegistry} while the handle lock is held.
 */
@Getter
public class ConnectionHandle {

    private final String id;
    private final BackendKind backendKind;
    private final Instant openedAt = Instant.now();

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    private volatile ConnectionParams params;
    @Getter(AccessLevel.PACKAGE)
    private volatile BackendAdapter adapter;
    private volatile String activeDatabase;
    private volatile boolean closed;

    ConnectionHandle(String id, BackendKind backendKind, ConnectionParams params, BackendAdapter adapter) {
        this.id = id;
        this.backendKind = backendKind;
        this.params = params;
        this.adapter = adapter;
        this.activeDatabase = adapter.getActiveDatabase();
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    void setActiveDatabase(String activeDatabase) {
        this.activeDatabase = activeDatabase;
    }

    void install(BackendAdapter replacement, ConnectionParams replacementParams) {
        this.adapter = replacement;
        this.params = replacementParams;
        this.activeDatabase = replacement.getActiveDatabase();
    }

    void markClosed() {
        this.closed = true;
    }
}
