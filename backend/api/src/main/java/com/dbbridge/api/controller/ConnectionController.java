package com.dbbridge.api.controller;

import com.dbbridge.api.dto.OpenConnectionRequest;
import com.dbbridge.api.dto.QueryRequest;
import com.dbbridge.api.dto.UseDatabaseRequest;
import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ColumnDescriptor;
import com.dbbridge.api.model.QueryResult;
import com.dbbridge.api.model.SchemaDescription;
import com.dbbridge.api.service.ConnectionService;
import com.dbbridge.api.service.QueryExecutionService;
import com.dbbridge.api.service.SchemaIntrospectionService;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/connections")
@RequiredArgsConstructor
@Slf4j
public class ConnectionController {

    private final ConnectionService connectionService;
    private final QueryExecutionService queryExecutionService;
    private final SchemaIntrospectionService schemaIntrospectionService;

    // ============================================================
    // 1️⃣ CONNECTION LIFECYCLE
    // ============================================================
    @PostMapping
    public ResponseEntity<Map<String, Object>> open(@Valid @RequestBody OpenConnectionRequest request) {
        String connectionId = connectionService.open(request.getBackend(), request.toParams());
        return ResponseEntity.ok(success(Map.of(
                "connectionId", connectionId,
                "backend", BackendKind.fromId(request.getBackend()).getId()
        )));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listConnections() {
        return ResponseEntity.ok(success(Map.of("connections", connectionService.listConnections())));
    }

    @DeleteMapping("/{connectionId}")
    public ResponseEntity<Map<String, Object>> close(@PathVariable String connectionId) {
        connectionService.close(connectionId);
        return ResponseEntity.ok(success(Map.of()));
    }

    @GetMapping("/backends")
    public ResponseEntity<Map<String, Object>> getSupportedBackends() {
        return ResponseEntity.ok(success(Map.of("backends", connectionService.getSupportedBackends())));
    }

    // ============================================================
    // 2️⃣ CATALOG
    // ============================================================
    @GetMapping("/{connectionId}/databases")
    public ResponseEntity<Map<String, Object>> listDatabases(@PathVariable String connectionId) {
        List<String> databases = connectionService.listDatabases(connectionId);
        return ResponseEntity.ok(success(Map.of("databases", databases)));
    }

    @PutMapping("/{connectionId}/database")
    public ResponseEntity<Map<String, Object>> useDatabase(
            @PathVariable String connectionId,
            @Valid @RequestBody UseDatabaseRequest request
    ) {
        connectionService.useDatabase(connectionId, request.getDatabase());
        return ResponseEntity.ok(success(Map.of("database", request.getDatabase())));
    }

    @GetMapping("/{connectionId}/tables")
    public ResponseEntity<Map<String, Object>> listTables(@PathVariable String connectionId) {
        List<String> tables = connectionService.listTables(connectionId);
        return ResponseEntity.ok(success(Map.of("tables", tables)));
    }

    @GetMapping("/{connectionId}/tables/{table}/columns")
    public ResponseEntity<Map<String, Object>> describeTable(
            @PathVariable String connectionId,
            @PathVariable String table
    ) {
        List<ColumnDescriptor> columns = connectionService.describeTable(connectionId, table);
        return ResponseEntity.ok(success(Map.of("table", table, "columns", columns)));
    }

    @GetMapping("/{connectionId}/schema")
    public ResponseEntity<Map<String, Object>> describeSchema(@PathVariable String connectionId) {
        SchemaDescription description = schemaIntrospectionService.describeSchemaWithBackend(connectionId);
        return ResponseEntity.ok(success(Map.of(
                "schema", description.schema(),
                "backend", description.backend()
        )));
    }

    // ============================================================
    // 3️⃣ QUERY
    // ============================================================
    @PostMapping("/{connectionId}/query")
    public ResponseEntity<Map<String, Object>> executeQuery(
            @PathVariable String connectionId,
            @Valid @RequestBody QueryRequest request
    ) {
        QueryResult result = queryExecutionService.execute(connectionId, request.getSql());
        return ResponseEntity.ok(success(Map.of(
                "columns", result.getColumns(),
                "rows", result.getRows(),
                "rowCount", result.getRowCount()
        )));
    }

    private static Map<String, Object> success(Map<String, Object> payload) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.putAll(payload);
        response.put("timestamp", Instant.now().toString());
        return response;
    }
}
