package com.dbbridge.api.strategy;

import com.dbbridge.api.adapter.BackendAdapter;
import com.dbbridge.api.adapter.PostgresAdapter;
import com.dbbridge.api.config.BackendConfiguration;
import com.dbbridge.api.config.DbBridgeConfiguration;
import com.dbbridge.api.model.BackendKind;
import com.dbbridge.api.model.ConnectionParams;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component("postgresql")
@Slf4j
public class PostgresStrategy extends AbstractJdbcStrategy {

    public static final int DEFAULT_PORT = 5432;

    private final AtomicInteger poolCounter = new AtomicInteger();

    public PostgresStrategy(DbBridgeConfiguration dbBridgeConfiguration, BackendConfiguration backendConfiguration) {
        super(dbBridgeConfiguration, backendConfiguration);
    }

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.POSTGRESQL;
    }

    @Override
    public String getDriverClassName() {
        return "org.postgresql.Driver";
    }

    @Override
    public BackendAdapter connect(ConnectionParams params) {
        HikariConfig config = buildPoolConfig(params);
        log.info("Connecting to PostgreSQL at {}", config.getJdbcUrl());

        HikariDataSource dataSource = null;
        try {
            dataSource = new HikariDataSource(config);
            JdbcTemplate jdbcTemplate = createJdbcTemplate(dataSource);
            // the server picks a default database when none was requested
            String database = jdbcTemplate.queryForObject("SELECT current_database()", String.class);
            return new PostgresAdapter(jdbcTemplate, dataSource, database, dbBridgeConfiguration.getPostgresSchema());
        } catch (RuntimeException e) {
            if (dataSource != null) {
                dataSource.close();
            }
            log.warn("PostgreSQL connection to {} failed: {}", config.getJdbcUrl(), e.getMessage());
            throw connectFailed(e);
        }
    }

    HikariConfig buildPoolConfig(ConnectionParams params) {
        DbBridgeConfiguration.PoolConfig pool = dbBridgeConfiguration.getPool();
        String database = params.getDatabase() != null ? params.getDatabase() : "";

        HikariConfig config = new HikariConfig();
        config.setPoolName("dbbridge-postgresql-" + poolCounter.incrementAndGet());
        config.setJdbcUrl("jdbc:postgresql://" + params.getHost() + ":"
                + resolvePort(params.getPort(), DEFAULT_PORT) + "/" + database);
        config.setUsername(params.getUser());
        config.setPassword(nullToEmpty(params.getPassword()));
        config.setMaximumPoolSize(pool.getMaximumPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(pool.getConnectionTimeoutMs());
        config.setDataSourceProperties(settings().toDriverProperties());
        return config;
    }
}
