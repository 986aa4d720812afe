package com.dbbridge.api.adapter;

import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ColumnDescriptor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * SQLite adapter over a single file. There is only ever one database, {@value #MAIN_DATABASE}.
 */
public class SqliteAdapter extends AbstractJdbcAdapter {

    public static final String MAIN_DATABASE = "main";

    private static final String LIST_TABLES_SQL =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND substr(name, 1, 7) <> 'sqlite_'";

    private static final String TABLE_SQL =
            "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?";

    private final SingleConnectionDataSource dataSource;

    public SqliteAdapter(JdbcTemplate jdbcTemplate, SingleConnectionDataSource dataSource) {
        super(jdbcTemplate);
        this.dataSource = dataSource;
    }

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.SQLITE;
    }

    @Override
    public List<String> listDatabases() {
        ensureOpen();
        return List.of(MAIN_DATABASE);
    }

    @Override
    public void useDatabase(String database) {
        ensureOpen();
    }

    @Override
    public String getActiveDatabase() {
        return MAIN_DATABASE;
    }

    @Override
    public List<String> listTables() {
        return catalog("list tables", () -> jdbcTemplate.queryForList(LIST_TABLES_SQL, String.class));
    }

    @Override
    public List<ColumnDescriptor> describeTable(String table) {
        return catalog("describe table", () -> {
            String quoted = quote(table, '"');
            List<Map<String, Object>> columns = jdbcTemplate.queryForList("PRAGMA table_info(" + quoted + ")");
            if (columns.isEmpty()) {
                throw backendError("no such table: " + table, null);
            }

            Set<String> uniqueColumns = new HashSet<>();
            Set<String> indexedColumns = new HashSet<>();
            for (Map<String, Object> index : jdbcTemplate.queryForList("PRAGMA index_list(" + quoted + ")")) {
                if ("pk".equals(asString(index.get("origin")))) {
                    continue;
                }
                List<String> indexColumns = jdbcTemplate.query(
                        "PRAGMA index_info(" + quote(asString(index.get("name")), '"') + ")",
                        (rs, rowNum) -> rs.getString("name"));
                if (asInt(index.get("unique")) == 1) {
                    if (indexColumns.size() == 1) {
                        uniqueColumns.add(indexColumns.get(0));
                    }
                } else {
                    indexedColumns.addAll(indexColumns);
                }
            }

            boolean autoIncrement = isAutoIncrementTable(table);

            List<ColumnDescriptor> result = new ArrayList<>(columns.size());
            for (Map<String, Object> row : columns) {
                String name = asString(row.get("name"));
                boolean primaryKey = asInt(row.get("pk")) > 0;
                result.add(ColumnDescriptor.builder()
                        .name(name)
                        .type(asString(row.get("type")))
                        .nullable(asInt(row.get("notnull")) == 0)
                        .primaryKey(primaryKey)
                        .unique(uniqueColumns.contains(name))
                        .indexed(indexedColumns.contains(name))
                        .defaultValue(asString(row.get("dflt_value")))
                        .extra(primaryKey && autoIncrement ? "auto_increment" : null)
                        .build());
            }
            return result;
        });
    }

    private boolean isAutoIncrementTable(String table) {
        List<String> ddl = jdbcTemplate.queryForList(TABLE_SQL, String.class, table);
        return !ddl.isEmpty() && ddl.get(0) != null
                && ddl.get(0).toUpperCase(Locale.ROOT).contains("AUTOINCREMENT");
    }

    @Override
    protected void releaseConnection() {
        dataSource.destroy();
    }
}
