package com.dbbridge.api.adapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dbbridge.api.exception.ConnectionException;
import com.dbbridge.api.model.ColumnDescriptor;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.StatementCallback;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

@ExtendWith(MockitoExtension.class)
class MySqlAdapterTest {

    @Mock
    private JdbcTemplate jdbcTemplate;
    @Mock
    private SingleConnectionDataSource dataSource;

    private MySqlAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new MySqlAdapter(jdbcTemplate, dataSource, "shop");
    }

    @Test
    void describeTable_shouldMapShowColumnsOutput() {
        when(jdbcTemplate.queryForList("SHOW COLUMNS FROM `users`")).thenReturn(List.of(
                column("id", "int", "NO", "PRI", null, "auto_increment"),
                column("email", "varchar(255)", "NO", "UNI", null, ""),
                column("team_id", "int", "YES", "MUL", null, ""),
                column("name", "varchar(100)", "YES", "", "anon", "")
        ));

        List<ColumnDescriptor> columns = adapter.describeTable("users");

        assertEquals(4, columns.size());
        assertTrue(columns.get(0).isPrimaryKey());
        assertFalse(columns.get(0).isNullable());
        assertEquals("auto_increment", columns.get(0).getExtra());
        assertTrue(columns.get(1).isUnique());
        assertFalse(columns.get(1).isPrimaryKey());
        assertTrue(columns.get(2).isIndexed());
        assertTrue(columns.get(2).isNullable());
        assertEquals("anon", columns.get(3).getDefaultValue());
        assertNull(columns.get(3).getExtra());
        assertEquals(1, columns.stream().filter(ColumnDescriptor::isPrimaryKey).count());
    }

    @Test
    void describeTable_shouldDecodeBinaryTypeColumn() {
        Map<String, Object> row = column("payload", null, "YES", "", null, "");
        row.put("Type", "json".getBytes(StandardCharsets.UTF_8));
        when(jdbcTemplate.queryForList("SHOW COLUMNS FROM `events`")).thenReturn(List.of(row));

        assertEquals("json", adapter.describeTable("events").get(0).getType());
    }

    @Test
    void listTables_shouldAskForBaseTablesOnly() {
        when(jdbcTemplate.query(eq("SHOW FULL TABLES WHERE Table_type = 'BASE TABLE'"), any(RowMapper.class)))
                .thenReturn(List.of("users", "orders"));

        assertEquals(List.of("users", "orders"), adapter.listTables());

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sql.capture(), any(RowMapper.class));
        assertEquals("SHOW FULL TABLES WHERE Table_type = 'BASE TABLE'", sql.getValue());
    }

    @Test
    void useDatabase_shouldRebindSessionWithQuotedName() {
        adapter.useDatabase("odd`name");

        verify(jdbcTemplate).execute("USE `odd``name`");
        assertEquals("odd`name", adapter.getActiveDatabase());
    }

    @Test
    void useDatabase_shouldKeepActiveDatabaseOnFailure() {
        doThrow(new BadSqlGrammarException("StatementCallback", "USE `nope`",
                new SQLException("Unknown database 'nope'", "42000", 1049)))
                .when(jdbcTemplate).execute("USE `nope`");

        ConnectionException ex = assertThrows(ConnectionException.class, () -> adapter.useDatabase("nope"));

        assertEquals(ConnectionException.ErrorType.BACKEND_ERROR, ex.getErrorType());
        assertEquals("Unknown database 'nope'", ex.getMessage());
        assertEquals("shop", adapter.getActiveDatabase());
    }

    @Test
    void executeQuery_shouldSurfaceServerMessageVerbatim() {
        when(jdbcTemplate.execute(any(StatementCallback.class))).thenThrow(new BadSqlGrammarException(
                "StatementCallback", "SELECT * FROM nope",
                new SQLException("Table 'shop.nope' doesn't exist", "42S02", 1146)));

        ConnectionException ex = assertThrows(ConnectionException.class, () -> adapter.executeQuery("SELECT * FROM nope"));

        assertEquals(ConnectionException.ErrorType.QUERY_FAILED, ex.getErrorType());
        assertEquals("Table 'shop.nope' doesn't exist", ex.getMessage());
        assertEquals("mysql", ex.getBackend());
    }

    @Test
    void close_shouldReleaseSessionOnce() {
        adapter.close();
        adapter.close();

        verify(dataSource, times(1)).destroy();
        assertTrue(adapter.isClosed());
    }

    private static Map<String, Object> column(String field, String type, String nullable, String key, Object defaultValue, String extra) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Field", field);
        row.put("Type", type);
        row.put("Null", nullable);
        row.put("Key", key);
        row.put("Default", defaultValue);
        row.put("Extra", extra);
        return row;
    }
}
