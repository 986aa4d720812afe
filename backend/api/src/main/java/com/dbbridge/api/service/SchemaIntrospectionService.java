package com.dbbridge.api.service;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.model.ColumnDescriptor;
import com.dbbridge.api.model.SchemaDescription;
import com.dbbridge.api.registry.ConnectionRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a plain-text description of every table in the active database, e.g.
 *
 * <pre>
 * Table: users
 * Columns:
 *   - id (INTEGER) PRIMARY KEY NOT NULL
 *   - name (TEXT)
 * </pre>
 *
 * Tables appear in catalog order, each followed by a blank line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SchemaIntrospectionService {

    private final ConnectionRegistry connectionRegistry;

    public String describeSchema(String connectionId) {
        return describeSchemaWithBackend(connectionId).schema();
    }

    public SchemaDescription describeSchemaWithBackend(String connectionId) {
        // the handle lock is reentrant, so the nested withAdapter runs in the same hold
        return connectionRegistry.withHandle(connectionId, handle -> {
            String schema = connectionRegistry.withAdapter(connectionId, SchemaIntrospectionService::describe);
            log.info("Built schema description for connection {} ({} chars)", connectionId, schema.length());
            return new SchemaDescription(handle.getBackendKind().getId(), schema);
        });
    }

    static String describe(BackendAdapter adapter) {
        List<String> tables = adapter.listTables();
        StringBuilder schema = new StringBuilder();
        for (String table : tables) {
            // one failed table fails the whole schema
            appendTable(schema, table, adapter.describeTable(table));
        }
        return schema.toString();
    }

    static void appendTable(StringBuilder schema, String table, List<ColumnDescriptor> columns) {
        schema.append("Table: ").append(table).append('\n');
        schema.append("Columns:\n");
        for (ColumnDescriptor column : columns) {
            schema.append(formatColumn(column)).append('\n');
        }
        schema.append('\n');
    }

    static String formatColumn(ColumnDescriptor column) {
        StringBuilder line = new StringBuilder("  - ")
                .append(column.getName())
                .append(" (").append(column.getType()).append(")");
        if (column.isPrimaryKey()) line.append(" PRIMARY KEY");
        if (column.isUnique()) line.append(" UNIQUE");
        if (column.isIndexed()) line.append(" INDEX");
        if (isAutoIncrement(column)) line.append(" AUTO_INCREMENT");
        if (!column.isNullable()) line.append(" NOT NULL");
        if (column.getDefaultValue() != null) line.append(" DEFAULT ").append(column.getDefaultValue());
        return line.toString();
    }

    private static boolean isAutoIncrement(ColumnDescriptor column) {
        return column.getExtra() != null
                && column.getExtra().toLowerCase(Locale.ROOT).contains("auto_increment");
    }
}
