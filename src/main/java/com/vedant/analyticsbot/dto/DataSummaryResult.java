package com.vedant.analyticsbot.dto;

import java.util.List;

/**
 * @param summary        plain text answer
 * @param htmlSummary    short HTML answer limited to p/strong/em/span
 * @param markdownData   the rows rendered as a markdown table
 * @param keyInsights    at most ten derived observations
 */
public record DataSummaryResult(
        boolean success,
        String summary,
        String htmlSummary,
        String markdownData,
        List<String> keyInsights,
        String error,
        int dataPointsAnalyzed,
        double summaryTimeMs,
        int promptTokens,
        int completionTokens
) {

    public DataSummaryResult {
        keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
    }

    public static DataSummaryResult failed(String error, double timeMs) {
        return new DataSummaryResult(false, null, null, null, List.of(), error, 0, timeMs, 0, 0);
    }
}
