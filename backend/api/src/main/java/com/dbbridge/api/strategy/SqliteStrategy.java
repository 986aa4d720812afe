package com.dbbridge.api.strategy;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.adapter.SqliteAdapter;
import com.dbbridge.api.config.BackendConfiguration;
import com.dbbridge.api.config.DbBridgeConfiguration;
import com.dbbridge.api.exception.ConnectionException;
import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ConnectionParams;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

/**
 * Opens SQLite files. The connection's host is the file path; port and credentials are ignored.
 */
@Component("sqlite")
@Slf4j
public class SqliteStrategy extends AbstractJdbcStrategy {

    public SqliteStrategy(DbBridgeConfiguration dbBridgeConfiguration, BackendConfiguration backendConfiguration) {
        super(dbBridgeConfiguration, backendConfiguration);
    }

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.SQLITE;
    }

    @Override
    public String getDriverClassName() {
        return "org.sqlite.JDBC";
    }

    @Override
    public BackendAdapter connect(ConnectionParams params) {
        String path = params.getHost();
        if (path == null || path.isBlank()) {
            throw new ConnectionException(
                    "SQLite database file path is required",
                    getBackendKind().getId(),
                    ConnectionException.ErrorType.CONNECT_FAILED
            );
        }
        log.info("Opening SQLite database {}", path);

        SingleConnectionDataSource dataSource = new SingleConnectionDataSource();
        dataSource.setUrl("jdbc:sqlite:" + path);
        dataSource.setConnectionProperties(settings().toDriverProperties());
        dataSource.setSuppressClose(true);

        try {
            dataSource.initConnection();
            JdbcTemplate jdbcTemplate = createJdbcTemplate(dataSource);
            // fails with SQLITE_NOTADB when the file is not a database
            jdbcTemplate.queryForObject("SELECT count(*) FROM sqlite_master", Integer.class);
            return new SqliteAdapter(jdbcTemplate, dataSource);
        } catch (SQLException | RuntimeException e) {
            dataSource.destroy();
            log.warn("Opening SQLite database {} failed: {}", path, e.getMessage());
            throw connectFailed(e);
        }
    }
}
