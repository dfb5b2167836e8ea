package com.vedant.analyticsbot.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Response-type tags of a failed pipeline run. Validation and execution
 * failures are deterministic for a given query, so retrying them is pointless.
 */
public enum PipelineErrorType {
    SQL_GENERATION_ERROR("sql_generation_error", true),
    SQL_VALIDATION_ERROR("sql_validation_error", false),
    SQL_EXECUTION_ERROR("sql_execution_error", false),
    DATA_SUMMARIZATION_ERROR("data_summarization_error", true),
    CHAIN_ERROR("chain_error", true),
    RETRY_EXHAUSTED("retry_exhausted", false),
    UNKNOWN_ERROR("unknown_error", false);

    private final String tag;
    private final boolean retryable;

    PipelineErrorType(String tag, boolean retryable) {
        this.tag = tag;
        this.retryable = retryable;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static PipelineErrorType fromTag(String tag) {
        for (PipelineErrorType t : values()) {
            if (t.tag.equals(tag)) return t;
        }
        return null;
    }
}
