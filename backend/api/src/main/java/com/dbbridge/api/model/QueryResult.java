package com.dbbridge.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Rows returned by a query, each row keyed by the column name the backend reported.
 */
@Getter
public class QueryResult {

    private final List<Map<String, Object>> rows;

    public QueryResult(List<Map<String, Object>> rows) {
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
    }

    public static QueryResult empty() {
        return new QueryResult(Collections.emptyList());
    }

    /**
     * Display column order, taken from the key order of the first row.
     */
    public List<String> getColumns() {
        if (rows.isEmpty()) return Collections.emptyList();
        return new ArrayList<>(rows.get(0).keySet());
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
