package com.vedant.analyticsbot.dto;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one pipeline run. Stage results that never ran are null.
 *
 * {@code finalResponse} is always renderable: on failure it holds an error
 * summary, so callers never have to special-case a missing answer.
 * {@code responseType} is "summary", "data" or one of the
 * {@link PipelineErrorType} tags.
 */
public record PipelineResult(
        boolean success,
        DataSummaryResult finalResponse,
        String responseType,
        String error,
        SqlGenerationResult sqlGeneration,
        ValidationOutcome sqlValidation,
        SqlExecutionResult sqlExecution,
        DataSummaryResult dataSummary,
        double totalProcessingTimeMs,
        Instant timestamp,
        String userQuery,
        String sessionId,
        int totalPromptTokens,
        int totalCompletionTokens
) {

    public static final String RESPONSE_SUMMARY = "summary";
    public static final String RESPONSE_DATA = "data";

    public static PipelineResult completed(String responseType, DataSummaryResult finalResponse,
                                           SqlGenerationResult generation, ValidationOutcome validation,
                                           SqlExecutionResult execution, DataSummaryResult summary,
                                           double totalMs, String userQuery, String sessionId) {
        return new PipelineResult(true, finalResponse, responseType, null,
                generation, validation, execution, summary,
                totalMs, Instant.now(), userQuery, sessionId,
                promptTokens(generation, summary), completionTokens(generation, summary));
    }

    public static PipelineResult failed(PipelineErrorType type, String error,
                                        SqlGenerationResult generation, ValidationOutcome validation,
                                        SqlExecutionResult execution, DataSummaryResult summary,
                                        double totalMs, String userQuery, String sessionId) {
        return new PipelineResult(false, errorSummary(type, error), type.tag(), error,
                generation, validation, execution, summary,
                totalMs, Instant.now(), userQuery, sessionId,
                promptTokens(generation, summary), completionTokens(generation, summary));
    }

    /** Failure with no stage results, e.g. a defect inside the orchestrator. */
    public static PipelineResult failed(PipelineErrorType type, String error, double totalMs,
                                        String userQuery, String sessionId) {
        return failed(type, error, null, null, null, null, totalMs, userQuery, sessionId);
    }

    public PipelineErrorType errorType() {
        return PipelineErrorType.fromTag(responseType);
    }

    static DataSummaryResult errorSummary(PipelineErrorType type, String error) {
        String message = error == null ? "Unknown error" : error;
        return new DataSummaryResult(false,
                "Error: " + message,
                "<p><strong>Error:</strong> " + escapeHtml(message) + "</p>",
                "No data available due to error",
                List.of("Error occurred: " + type.tag()),
                message, 0, 0.0, 0, 0);
    }

    private static String escapeHtml(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static int promptTokens(SqlGenerationResult generation, DataSummaryResult summary) {
        return (generation == null ? 0 : generation.promptTokens()) + (summary == null ? 0 : summary.promptTokens());
    }

    private static int completionTokens(SqlGenerationResult generation, DataSummaryResult summary) {
        return (generation == null ? 0 : generation.completionTokens()) + (summary == null ? 0 : summary.completionTokens());
    }
}
