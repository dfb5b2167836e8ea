package com.vedant.analyticsbot.dto;

public record SqlGenerationResult(
        boolean success,
        String sqlQuery,
        QueryType queryType,
        String error,
        double generationTimeMs,
        int promptTokens,
        int completionTokens
) {

    public static SqlGenerationResult ok(String sql, QueryType type, double timeMs, int promptTokens, int completionTokens) {
        return new SqlGenerationResult(true, sql, type, null, timeMs, promptTokens, completionTokens);
    }

    public static SqlGenerationResult failed(String error, double timeMs) {
        return new SqlGenerationResult(false, null, null, error, timeMs, 0, 0);
    }
}
