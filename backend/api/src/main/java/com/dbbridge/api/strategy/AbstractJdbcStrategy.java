package com.dbbridge.api.strategy;

import com.dbbridge.api.adapter.AbstractJdbcAdapter;
import com.dbbridge.api.config.BackendConfiguration;
import com.dbbridge.api.config.DbBridgeConfiguration;
import com.dbbridge.api.exception.ConnectionException;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

@RequiredArgsConstructor
public abstract class AbstractJdbcStrategy implements BackendStrategy {

    protected final DbBridgeConfiguration dbBridgeConfiguration;
    protected final BackendConfiguration backendConfiguration;

    protected JdbcTemplate createJdbcTemplate(DataSource dataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        DbBridgeConfiguration.QueryConfig query = dbBridgeConfiguration.getQuery();
        if (query.getTimeoutSeconds() > 0) {
            jdbcTemplate.setQueryTimeout(query.getTimeoutSeconds());
        }
        if (query.getMaxResultSize() > 0) {
            jdbcTemplate.setMaxRows(query.getMaxResultSize());
        }
        return jdbcTemplate;
    }

    protected BackendConfiguration.BackendConfig settings() {
        return backendConfiguration.getBackend(getBackendKind().getId());
    }

    protected int resolvePort(Integer requested, int fallback) {
        if (requested != null && requested > 0) return requested;
        Integer configured = settings().getDefaultPort();
        return configured != null ? configured : fallback;
    }

    protected ConnectionException connectFailed(Throwable e) {
        return new ConnectionException(
                AbstractJdbcAdapter.nativeMessage(e),
                getBackendKind().getId(),
                ConnectionException.ErrorType.CONNECT_FAILED,
                e
        );
    }

    protected static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
