package com.dbbridge.api.strategy;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.adapter.MySqlAdapter;
import com.dbbridge.api.config.BackendConfiguration;
import com.dbbridge.api.config.DbBridgeConfiguration;
import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ConnectionParams;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

@Component("mysql")
@Slf4j
public class MySqlStrategy extends AbstractJdbcStrategy {

    public static final int DEFAULT_PORT = 3306;

    public MySqlStrategy(DbBridgeConfiguration dbBridgeConfiguration, BackendConfiguration backendConfiguration) {
        super(dbBridgeConfiguration, backendConfiguration);
    }

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.MYSQL;
    }

    @Override
    public String getDriverClassName() {
        return "com.mysql.cj.jdbc.Driver";
    }

    @Override
    public BackendAdapter connect(ConnectionParams params) {
        String url = buildUrl(params);
        log.info("Connecting to MySQL at {}", url);

        SingleConnectionDataSource dataSource = new SingleConnectionDataSource();
        dataSource.setUrl(url);
        dataSource.setUsername(params.getUser());
        dataSource.setPassword(nullToEmpty(params.getPassword()));
        dataSource.setConnectionProperties(settings().toDriverProperties());
        dataSource.setSuppressClose(true);

        try {
            dataSource.initConnection();
        } catch (SQLException | RuntimeException e) {
            dataSource.destroy();
            log.warn("MySQL connection to {} failed: {}", url, e.getMessage());
            throw connectFailed(e);
        }
        return new MySqlAdapter(createJdbcTemplate(dataSource), dataSource, params.getDatabase());
    }

    String buildUrl(ConnectionParams params) {
        String database = params.getDatabase() != null ? params.getDatabase() : "";
        return "jdbc:mysql://" + params.getHost() + ":" + resolvePort(params.getPort(), DEFAULT_PORT) + "/" + database;
    }
}
