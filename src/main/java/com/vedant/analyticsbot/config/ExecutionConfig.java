package com.vedant.analyticsbot.config;

/**
 * @param maxRows        rows beyond this are dropped and the result is marked truncated
 * @param timeoutSeconds statement timeout handed to the JDBC driver
 */
public record ExecutionConfig(int maxRows, int timeoutSeconds) {

    public ExecutionConfig {
        if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be positive");
        if (timeoutSeconds <= 0) throw new IllegalArgumentException("timeoutSeconds must be positive");
    }

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(1000, 30);
    }
}
