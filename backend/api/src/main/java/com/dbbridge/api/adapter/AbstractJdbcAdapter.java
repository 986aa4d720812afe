package com.dbbridge.api.adapter;

import com.dbbridge.api.exception.ConnectionException;
import com.dbbridge.api.model.QueryResult;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.core.StatementCallback;

/**
 * Shared plumbing for adapters backed by a {@link JdbcTemplate}: verbatim statement
 * execution, error translation and idempotent close.
 */
@Slf4j
public abstract class AbstractJdbcAdapter implements BackendAdapter {

    public static final String ROWS_AFFECTED = "rows_affected";

    protected final JdbcTemplate jdbcTemplate;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    protected AbstractJdbcAdapter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    // ============================================================
    // 1️⃣ QUERY EXECUTION
    // ============================================================
    @Override
    public QueryResult executeQuery(String sql) {
        ensureOpen();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.execute((StatementCallback<List<Map<String, Object>>>) statement -> {
                if (statement.execute(sql)) {
                    try (ResultSet resultSet = statement.getResultSet()) {
                        return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(resultSet);
                    }
                }
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put(ROWS_AFFECTED, statement.getUpdateCount());
                return List.of(summary);
            });
            return new QueryResult(rows);
        } catch (DataAccessException e) {
            String message = nativeMessage(e);
            log.debug("{} query failed: {}", getBackendKind().getId(), message);
            throw new ConnectionException(message, getBackendKind().getId(), ConnectionException.ErrorType.QUERY_FAILED, e);
        }
    }

    // ============================================================
    // 2️⃣ CATALOG ACCESS
    // ============================================================
    /**
     * Runs a catalog lookup, reporting any driver failure as a backend error.
     */
    protected <T> T catalog(String operation, Supplier<T> lookup) {
        ensureOpen();
        try {
            return lookup.get();
        } catch (DataAccessException e) {
            String message = nativeMessage(e);
            log.debug("{} {} failed: {}", getBackendKind().getId(), operation, message);
            throw backendError(message, e);
        }
    }

    protected ConnectionException backendError(String message, Throwable cause) {
        return new ConnectionException(message, getBackendKind().getId(), ConnectionException.ErrorType.BACKEND_ERROR, cause);
    }

    protected void ensureOpen() {
        if (closed.get()) {
            throw new ConnectionException(
                    "Connection already closed",
                    getBackendKind().getId(),
                    ConnectionException.ErrorType.CONNECTION_NOT_FOUND
            );
        }
    }

    // ============================================================
    // 3️⃣ LIFECYCLE
    // ============================================================
    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            releaseConnection();
            log.debug("Released {} connection", getBackendKind().getId());
        } catch (RuntimeException e) {
            log.warn("Error releasing {} connection: {}", getBackendKind().getId(), e.getMessage(), e);
        }
    }

    protected abstract void releaseConnection();

    // ============================================================
    // 4️⃣ HELPERS
    // ============================================================
    /**
     * The driver's own message, without the Spring wrapper text.
     */
    public static String nativeMessage(Throwable e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    protected static String asString(Object value) {
        if (value == null) return null;
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value.toString();
    }

    protected static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    protected static int asInt(Object value) {
        if (value instanceof Number number) return number.intValue();
        if (value == null) return 0;
        return Integer.parseInt(value.toString().trim());
    }

    protected static String quote(String identifier, char quoteChar) {
        String q = String.valueOf(quoteChar);
        return q + identifier.replace(q, q + q) + q;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(database=" + getActiveDatabase() + ", closed=" + isClosed() + ")";
    }
}
