package com.vedant.analyticsbot.config;

import java.util.List;

/**
 * Validator settings. Immutable; replaced as a whole on update.
 *
 * @param allowedTables         tables a generated query may read
 * @param maxQueryLength        statements longer than this are rejected outright
 * @param enableSecurityChecks  run the injection-pattern stage
 * @param enableTableAuthorization run the allow-list stage
 */
public record ValidationConfig(
        List<String> allowedTables,
        int maxQueryLength,
        boolean enableSecurityChecks,
        boolean enableTableAuthorization
) {

    public static final List<String> DEFAULT_TABLES = List.of("payment_intent", "payment_attempt", "customers", "address");

    public ValidationConfig {
        allowedTables = allowedTables == null ? List.of() : List.copyOf(allowedTables);
        if (maxQueryLength <= 0) {
            throw new IllegalArgumentException("maxQueryLength must be positive");
        }
    }

    public static ValidationConfig defaults() {
        return new ValidationConfig(DEFAULT_TABLES, 10_000, true, true);
    }
}
