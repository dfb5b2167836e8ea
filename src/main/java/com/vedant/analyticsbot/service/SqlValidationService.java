package com.vedant.analyticsbot.service;

import com.vedant.analyticsbot.config.ValidationConfig;
import com.vedant.analyticsbot.dto.ValidationOutcome;
import com.vedant.analyticsbot.util.SQLValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validation stage. Holds the current {@link ValidationConfig} snapshot and
 * delegates to {@link SQLValidator}.
 */
@Service
public class SqlValidationService {

    private static final Logger log = LoggerFactory.getLogger(SqlValidationService.class);

    static final String SELF_TEST_QUERY = "SELECT 1 FROM payment_intent LIMIT 1";

    private volatile ValidationConfig config;

    public SqlValidationService(ValidationConfig config) {
        this.config = config;
    }

    public ValidationOutcome validate(String sql, String actorId) {
        ValidationConfig snapshot = this.config;
        long start = System.nanoTime();
        ValidationOutcome outcome = SQLValidator.validate(sql, actorId, snapshot);
        double ms = (System.nanoTime() - start) / 1_000_000.0;

        if (outcome.valid()) {
            log.info("SQL validated for actor {}: tables={}", actorId, outcome.validatedTables());
        } else {
            log.warn("SQL rejected for actor {}: {}", actorId, outcome.error());
        }
        return outcome.withValidationTimeMs(ms);
    }

    /** Validates each statement on its own; the i-th runs as actor {@code <actorId>_batch_<i>}. */
    public List<ValidationOutcome> validateBatch(List<String> statements, String actorId) {
        List<ValidationOutcome> out = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            out.add(validate(statements.get(i), actorId + "_batch_" + i));
        }
        return out;
    }

    /** True when the validator accepts a known-good query under the current config. */
    public boolean selfTest() {
        ValidationConfig snapshot = this.config;
        String healthCheckSql = snapshot.allowedTables().isEmpty()
                ? SELF_TEST_QUERY
                : "SELECT 1 FROM " + snapshot.allowedTables().get(0) + " LIMIT 1";
        return SQLValidator.validate(healthCheckSql, "health_check", snapshot).valid();
    }

    public ValidationConfig getConfig() {
        return config;
    }

    public void updateConfig(ValidationConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig);
        log.info("Validation config updated: {} allowed tables, max length {}",
                newConfig.allowedTables().size(), newConfig.maxQueryLength());
    }
}
