package com.dbbridge.api.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.config.BackendConfiguration;
import com.dbbridge.api.exception.ConnectionException;
import com.dbbridge.api.model.ConnectionParams;
import com.dbbridge.api.model.QueryResult;
import com.dbbridge.api.registry.ConnectionRegistry;
import com.dbbridge.api.strategy.BackendStrategy;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryExecutionServiceTest {

    @Mock
    private BackendStrategy strategy;
    @Mock
    private BackendAdapter adapter;

    private ConnectionRegistry registry;
    private QueryExecutionService service;
    private String connectionId;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(Map.of("postgresql", strategy), new BackendConfiguration());
        when(strategy.connect(any())).thenReturn(adapter);
        connectionId = registry.open("postgresql", ConnectionParams.builder().host("localhost").build());
        service = new QueryExecutionService(registry);
    }

    @Test
    void execute_shouldPassDriverValuesThroughUnchanged() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("total", new BigDecimal("12.50"));
        row.put("count", 3L);
        row.put("label", "paid");
        row.put("note", null);
        row.put("flag", Boolean.TRUE);
        when(adapter.executeQuery("SELECT * FROM totals")).thenReturn(new QueryResult(List.of(row)));

        QueryResult result = service.execute(connectionId, "SELECT * FROM totals");

        assertEquals(List.of("total", "count", "label", "note", "flag"), result.getColumns());
        Map<String, Object> first = result.getRows().get(0);
        assertEquals(new BigDecimal("12.50"), first.get("total"));
        assertEquals(3L, first.get("count"));
        assertNull(first.get("note"));
        assertEquals(Boolean.TRUE, first.get("flag"));
    }

    @Test
    void execute_shouldTreatZeroRowsAsSuccess() {
        when(adapter.executeQuery("SELECT * FROM users WHERE 1 = 0")).thenReturn(QueryResult.empty());

        QueryResult result = service.execute(connectionId, "SELECT * FROM users WHERE 1 = 0");

        assertTrue(result.isEmpty());
        assertEquals(0, result.getRowCount());
    }

    @Test
    void execute_shouldKeepBackendErrorText() {
        when(adapter.executeQuery("SELEC 1")).thenThrow(new ConnectionException(
                "ERROR: syntax error at or near \"SELEC\"", "postgresql", ConnectionException.ErrorType.QUERY_FAILED));

        ConnectionException ex = assertThrows(ConnectionException.class, () -> service.execute(connectionId, "SELEC 1"));

        assertEquals(ConnectionException.ErrorType.QUERY_FAILED, ex.getErrorType());
        assertEquals("ERROR: syntax error at or near \"SELEC\"", ex.getMessage());
    }

    @Test
    void execute_shouldFailAfterClose() {
        registry.close(connectionId);

        ConnectionException ex = assertThrows(ConnectionException.class, () -> service.execute(connectionId, "SELECT 1"));

        assertEquals(ConnectionException.ErrorType.CONNECTION_NOT_FOUND, ex.getErrorType());
    }
}
