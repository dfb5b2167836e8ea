package com.vedant.analyticsbot.dto;

import java.util.List;
import java.util.Map;

/**
 * Rows come back as ordered column-to-value maps; values are already
 * JSON-friendly (numbers, strings, booleans or null).
 */
public record SqlExecutionResult(
        boolean success,
        List<Map<String, Object>> rows,
        List<String> columns,
        Map<String, String> dataTypes,
        int rowCount,
        boolean truncated,
        double executionTimeMs,
        String queryExecuted,
        String error
) {

    public SqlExecutionResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        columns = columns == null ? List.of() : List.copyOf(columns);
        dataTypes = dataTypes == null ? Map.of() : dataTypes;
    }

    public static SqlExecutionResult failed(String sql, String error, double timeMs) {
        return new SqlExecutionResult(false, List.of(), List.of(), Map.of(), 0, false, timeMs, sql, error);
    }
}
