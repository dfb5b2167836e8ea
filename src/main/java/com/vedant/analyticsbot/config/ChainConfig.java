package com.vedant.analyticsbot.config;

/**
 * Orchestrator behaviour.
 *
 * @param enableFallback when summarization fails, answer with a table built from the raw rows
 * @param enableRetry    re-run the whole pipeline on transient failures
 * @param maxRetries     extra attempts after the first one
 */
public record ChainConfig(boolean enableFallback, boolean enableRetry, int maxRetries) {

    public ChainConfig {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must not be negative");
    }

    public static ChainConfig defaults() {
        return new ChainConfig(true, false, 1);
    }
}
