package com.dbbridge.api.adapter;

import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ColumnDescriptor;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * MySQL-family adapter. Holds a single dedicated session so that {@code USE} sticks.
 */
@Slf4j
public class MySqlAdapter extends AbstractJdbcAdapter {

    private final SingleConnectionDataSource dataSource;
    private volatile String activeDatabase;

    public MySqlAdapter(JdbcTemplate jdbcTemplate, SingleConnectionDataSource dataSource, String database) {
        super(jdbcTemplate);
        this.dataSource = dataSource;
        this.activeDatabase = database;
    }

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.MYSQL;
    }

    @Override
    public List<String> listDatabases() {
        return catalog("list databases", () -> jdbcTemplate.queryForList("SHOW DATABASES", String.class));
    }

    @Override
    public void useDatabase(String database) {
        catalog("use database", () -> {
            jdbcTemplate.execute("USE " + quote(database, '`'));
            return null;
        });
        activeDatabase = database;
        log.info("MySQL session switched to database {}", database);
    }

    @Override
    public String getActiveDatabase() {
        return activeDatabase;
    }

    @Override
    public List<String> listTables() {
        return catalog("list tables", () -> jdbcTemplate.query(
                "SHOW FULL TABLES WHERE Table_type = 'BASE TABLE'",
                (rs, rowNum) -> rs.getString(1)
        ));
    }

    @Override
    public List<ColumnDescriptor> describeTable(String table) {
        List<Map<String, Object>> rows = catalog("describe table",
                () -> jdbcTemplate.queryForList("SHOW COLUMNS FROM " + quote(table, '`')));

        return rows.stream().map(MySqlAdapter::toColumn).collect(Collectors.toList());
    }

    static ColumnDescriptor toColumn(Map<String, Object> row) {
        String key = asString(row.get("Key"));
        return ColumnDescriptor.builder()
                .name(asString(row.get("Field")))
                .type(asString(row.get("Type")))
                .nullable("YES".equalsIgnoreCase(asString(row.get("Null"))))
                .primaryKey("PRI".equals(key))
                .unique("UNI".equals(key))
                .indexed("MUL".equals(key))
                .defaultValue(asString(row.get("Default")))
                .extra(blankToNull(asString(row.get("Extra"))))
                .build();
    }

    @Override
    protected void releaseConnection() {
        dataSource.destroy();
    }
}
