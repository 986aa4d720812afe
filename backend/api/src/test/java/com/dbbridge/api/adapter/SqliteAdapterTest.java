package com.dbbridge.api.adapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dbbridge.api.config.BackendConfiguration;
import com.dbbridge.api.config.DbBridgeConfiguration;
import com.dbbridge.api.exception.ConnectionException;
import com.dbbridge.api.model.ColumnDescriptor;
import com.dbbridge.api.model.ConnectionParams;
import com.dbbridge.api.model.QueryResult;
import com.dbbridge.api.strategy.SqliteStrategy;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

class SqliteAdapterTest {

    @TempDir
    Path tempDir;

    private BackendAdapter adapter;

    @BeforeEach
    void setUp() {
        Path file = tempDir.resolve("fixture.db");
        SingleConnectionDataSource seed = new SingleConnectionDataSource("jdbc:sqlite:" + file, true);
        try {
            JdbcTemplate jdbc = new JdbcTemplate(seed);
            jdbc.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT)");
            jdbc.execute("INSERT INTO users (id, name) VALUES (1, 'Alice'), (2, 'Bob')");
            jdbc.execute("CREATE TABLE orders ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "user_id INTEGER NOT NULL, "
                    + "code TEXT UNIQUE, "
                    + "status TEXT DEFAULT 'new')");
            jdbc.execute("CREATE INDEX idx_orders_user ON orders (user_id)");
            jdbc.execute("INSERT INTO orders (user_id, code) VALUES (1, 'A-1')");
        } finally {
            seed.destroy();
        }

        SqliteStrategy strategy = new SqliteStrategy(new DbBridgeConfiguration(), new BackendConfiguration());
        adapter = strategy.connect(ConnectionParams.builder().host(file.toString()).build());
    }

    @AfterEach
    void tearDown() {
        adapter.close();
    }

    @Test
    void listDatabases_shouldReturnMainOnly() {
        assertEquals(List.of("main"), adapter.listDatabases());
        assertEquals("main", adapter.getActiveDatabase());
    }

    @Test
    void useDatabase_shouldBeNoOp() {
        adapter.useDatabase("anything");

        assertEquals("main", adapter.getActiveDatabase());
        assertEquals(List.of("users", "orders"), adapter.listTables());
    }

    @Test
    void listTables_shouldExcludeInternalTables() {
        QueryResult internal = adapter.executeQuery(
                "SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'sqlite_sequence'");
        assertEquals(1, internal.getRowCount());

        List<String> tables = adapter.listTables();

        assertEquals(List.of("users", "orders"), tables);
    }

    @Test
    void listTables_shouldKeepUserTablesNamedLikeInternalOnes() {
        adapter.executeQuery("CREATE TABLE sqlitestats (id INTEGER)");
        adapter.executeQuery("CREATE TABLE SQLiteVersions (id INTEGER)");
        adapter.executeQuery("CREATE TABLE sqlite3_cache (id INTEGER)");

        assertEquals(List.of("users", "orders", "sqlitestats", "SQLiteVersions", "sqlite3_cache"), adapter.listTables());
    }

    @Test
    void describeTable_shouldFlagSingleColumnPrimaryKeyOnly() {
        List<ColumnDescriptor> columns = adapter.describeTable("users");

        assertEquals(2, columns.size());
        assertEquals("id", columns.get(0).getName());
        assertEquals("INTEGER", columns.get(0).getType());
        assertTrue(columns.get(0).isPrimaryKey());
        assertEquals("name", columns.get(1).getName());
        assertTrue(columns.get(1).isNullable());
        assertFalse(columns.get(1).isPrimaryKey());
        assertNull(columns.get(1).getExtra());
    }

    @Test
    void describeTable_shouldResolveUniqueIndexAndAutoIncrement() {
        List<ColumnDescriptor> columns = adapter.describeTable("orders");

        ColumnDescriptor id = columns.get(0);
        ColumnDescriptor userId = columns.get(1);
        ColumnDescriptor code = columns.get(2);
        ColumnDescriptor status = columns.get(3);

        assertTrue(id.isPrimaryKey());
        assertEquals("auto_increment", id.getExtra());
        assertFalse(userId.isNullable());
        assertTrue(userId.isIndexed());
        assertFalse(userId.isUnique());
        assertTrue(code.isUnique());
        assertFalse(code.isIndexed());
        assertEquals("'new'", status.getDefaultValue());
        assertFalse(status.isPrimaryKey());
    }

    @Test
    void describeTable_shouldFailForUnknownTable() {
        ConnectionException ex = assertThrows(ConnectionException.class, () -> adapter.describeTable("missing"));

        assertEquals(ConnectionException.ErrorType.BACKEND_ERROR, ex.getErrorType());
        assertTrue(ex.getMessage().contains("missing"));
    }

    @Test
    void executeQuery_shouldReturnSeededRowsInColumnOrder() {
        QueryResult result = adapter.executeQuery("SELECT * FROM users ORDER BY id");

        assertEquals(List.of("id", "name"), result.getColumns());
        assertEquals(2, result.getRowCount());
        Map<String, Object> first = result.getRows().get(0);
        assertEquals(1, ((Number) first.get("id")).intValue());
        assertEquals("Alice", first.get("name"));
        assertEquals("Bob", result.getRows().get(1).get("name"));
    }

    @Test
    void executeQuery_shouldReturnEmptyResultForNoRows() {
        QueryResult result = adapter.executeQuery("SELECT * FROM users WHERE id = 99");

        assertTrue(result.isEmpty());
        assertTrue(result.getColumns().isEmpty());
    }

    @Test
    void executeQuery_shouldReportAffectedRowsForUpdates() {
        QueryResult result = adapter.executeQuery("UPDATE users SET name = 'Carol' WHERE id = 2");

        assertEquals(1, ((Number) result.getRows().get(0).get(AbstractJdbcAdapter.ROWS_AFFECTED)).intValue());
        assertEquals("Carol", adapter.executeQuery("SELECT name FROM users WHERE id = 2").getRows().get(0).get("name"));
    }

    @Test
    void executeQuery_shouldPreserveDriverErrorText() {
        ConnectionException ex = assertThrows(ConnectionException.class,
                () -> adapter.executeQuery("SELECT * FROM nowhere"));

        assertEquals(ConnectionException.ErrorType.QUERY_FAILED, ex.getErrorType());
        assertTrue(ex.getMessage().contains("no such table: nowhere"), ex.getMessage());
        assertFalse(ex.getMessage().contains("StatementCallback"));
    }

    @Test
    void close_shouldBeIdempotentAndBlockFurtherUse() {
        adapter.close();
        adapter.close();

        assertTrue(adapter.isClosed());
        ConnectionException ex = assertThrows(ConnectionException.class, () -> adapter.listTables());
        assertEquals(ConnectionException.ErrorType.CONNECTION_NOT_FOUND, ex.getErrorType());
    }
}
