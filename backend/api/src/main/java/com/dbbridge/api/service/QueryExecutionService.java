package com.dbbridge.api.service;

import com.dbbridge.api.model.QueryResult;
import com.dbbridge.api.registry.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Forwards raw SQL to a connection. No validation or rewriting happens here; callers
 * are trusted to send complete statements.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryExecutionService {

    private final ConnectionRegistry connectionRegistry;

    public QueryResult execute(String connectionId, String sql) {
        log.debug("Executing on connection {}: {}", connectionId, sql);
        QueryResult result = connectionRegistry.withAdapter(connectionId, adapter -> adapter.executeQuery(sql));
        log.info("Query on connection {} returned {} rows", connectionId, result.getRowCount());
        return result;
    }
}
