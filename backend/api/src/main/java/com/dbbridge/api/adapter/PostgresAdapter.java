package com.dbbridge.api.adapter;

import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ColumnDescriptor;
import com.zaxxer.hikari.HikariDataSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * PostgreSQL adapter. A pool is bound to exactly one database for its whole life,
 * so switching databases means replacing the adapter.
 */
public class PostgresAdapter extends AbstractJdbcAdapter {

    private static final String LIST_DATABASES_SQL =
            "SELECT datname FROM pg_database WHERE datistemplate = false";

    private static final String LIST_TABLES_SQL = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = ? AND table_type = 'BASE TABLE'
            """;

    private static final String COLUMNS_SQL = """
            SELECT column_name, data_type, is_nullable, column_default,
                   character_maximum_length, is_identity
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
            ORDER BY ordinal_position
            """;

    private static final String KEY_CONSTRAINTS_SQL = """
            SELECT tc.constraint_name, tc.constraint_type, kcu.column_name
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
             AND tc.table_name = kcu.table_name
            WHERE tc.table_schema = ? AND tc.table_name = ?
              AND tc.constraint_type IN ('PRIMARY KEY', 'UNIQUE')
            """;

    // plain (non-unique, non-primary) indexes only
    private static final String INDEXED_COLUMNS_SQL = """
            SELECT DISTINCT a.attname
            FROM pg_index ix
            JOIN pg_class t ON t.oid = ix.indrelid
            JOIN pg_namespace n ON n.oid = t.relnamespace
            JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = ANY(ix.indkey)
            WHERE n.nspname = ? AND t.relname = ?
              AND NOT ix.indisprimary AND NOT ix.indisunique
            """;

    private final HikariDataSource dataSource;
    private final String database;
    private final String schema;

    public PostgresAdapter(JdbcTemplate jdbcTemplate, HikariDataSource dataSource, String database, String schema) {
        super(jdbcTemplate);
        this.dataSource = dataSource;
        this.database = database;
        this.schema = schema;
    }

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.POSTGRESQL;
    }

    @Override
    public List<String> listDatabases() {
        return catalog("list databases", () -> jdbcTemplate.queryForList(LIST_DATABASES_SQL, String.class));
    }

    @Override
    public boolean requiresSessionReplacement() {
        return true;
    }

    @Override
    public void useDatabase(String database) {
        throw new UnsupportedOperationException(
                "PostgreSQL connections cannot switch database in place; reconnect to " + database);
    }

    @Override
    public String getActiveDatabase() {
        return database;
    }

    @Override
    public List<String> listTables() {
        return catalog("list tables", () -> jdbcTemplate.queryForList(LIST_TABLES_SQL, String.class, schema));
    }

    @Override
    public List<ColumnDescriptor> describeTable(String table) {
        return catalog("describe table", () -> {
            List<Map<String, Object>> columns = jdbcTemplate.queryForList(COLUMNS_SQL, schema, table);
            if (columns.isEmpty()) {
                throw backendError("relation \"" + table + "\" does not exist in schema " + schema, null);
            }

            Set<String> primaryKeys = new HashSet<>();
            Map<String, List<String>> uniqueConstraints = new HashMap<>();
            for (Map<String, Object> row : jdbcTemplate.queryForList(KEY_CONSTRAINTS_SQL, schema, table)) {
                String column = asString(row.get("column_name"));
                if ("PRIMARY KEY".equals(asString(row.get("constraint_type")))) {
                    primaryKeys.add(column);
                } else {
                    uniqueConstraints
                            .computeIfAbsent(asString(row.get("constraint_name")), k -> new ArrayList<>())
                            .add(column);
                }
            }
            Set<String> uniqueColumns = new HashSet<>();
            uniqueConstraints.values().stream()
                    .filter(cols -> cols.size() == 1)
                    .forEach(cols -> uniqueColumns.add(cols.get(0)));

            Set<String> indexed = new HashSet<>(jdbcTemplate.queryForList(INDEXED_COLUMNS_SQL, String.class, schema, table));

            List<ColumnDescriptor> result = new ArrayList<>(columns.size());
            for (Map<String, Object> row : columns) {
                String name = asString(row.get("column_name"));
                result.add(ColumnDescriptor.builder()
                        .name(name)
                        .type(typeOf(row))
                        .nullable("YES".equals(asString(row.get("is_nullable"))))
                        .primaryKey(primaryKeys.contains(name))
                        .unique(uniqueColumns.contains(name))
                        .indexed(indexed.contains(name))
                        .defaultValue(asString(row.get("column_default")))
                        .extra(isAutoIncrement(row) ? "auto_increment" : null)
                        .build());
            }
            return result;
        });
    }

    private static String typeOf(Map<String, Object> row) {
        String type = asString(row.get("data_type"));
        Object length = row.get("character_maximum_length");
        return length != null ? type + "(" + length + ")" : type;
    }

    private static boolean isAutoIncrement(Map<String, Object> row) {
        String identity = asString(row.get("is_identity"));
        String defaultValue = asString(row.get("column_default"));
        return "YES".equals(identity)
                || (defaultValue != null && defaultValue.toLowerCase(Locale.ROOT).startsWith("nextval("));
    }

    @Override
    protected void releaseConnection() {
        dataSource.close();
    }
}
