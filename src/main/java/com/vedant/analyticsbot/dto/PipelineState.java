package com.vedant.analyticsbot.dto;

public enum PipelineState {
    GENERATING,
    VALIDATING,
    EXECUTING,
    SUMMARIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
