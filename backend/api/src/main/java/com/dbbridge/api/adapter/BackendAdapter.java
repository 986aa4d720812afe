package com.dbbridge.api.adapter;

import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ColumnDescriptor;
import com.dbbridge.api.model.QueryResult;
import java.util.List;

/**
 * One live connection to a backend. Instances are owned by a single registry entry
 * and are not safe for concurrent use; callers serialize access per connection.
 */
public interface BackendAdapter extends AutoCloseable {

    BackendKind getBackendKind();

    List<String> listDatabases();

    /**
     * Rebinds the session to another database. Adapters that report
     * {@link #requiresSessionReplacement()} cannot do this and must be reconnected instead.
     */
    void useDatabase(String database);

    default boolean requiresSessionReplacement() {
        return false;
    }

    /**
     * @return the database currently bound, or {@code null} if none was selected yet
     */
    String getActiveDatabase();

    /**
     * Base tables of the active database, in catalog order, without system tables.
     */
    List<String> listTables();

    List<ColumnDescriptor> describeTable(String table);

    /**
     * Runs the statement verbatim. Failures carry the backend's own error text.
     */
    QueryResult executeQuery(String sql);

    boolean isClosed();

    /**
     * Releases the native connection. Calling it again is a no-op.
     */
    @Override
    void close();
}
