package com.vedant.analyticsbot.service;

import com.vedant.analyticsbot.config.ValidationConfig;
import com.vedant.analyticsbot.dto.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlValidationServiceTest {

    private final SqlValidationService service = new SqlValidationService(ValidationConfig.defaults());

    @Test
    void recordsTiming() {
        ValidationOutcome r = service.validate("SELECT * FROM customers", "u1");
        assertTrue(r.valid());
        assertTrue(r.validationTimeMs() >= 0.0);
    }

    @Test
    void batchValidatesEachStatementIndependently() {
        List<ValidationOutcome> out = service.validateBatch(List.of(
                "SELECT * FROM customers",
                "SELECT * FROM secret_table",
                "SELECT * FROM address"), "u1");

        assertEquals(3, out.size());
        assertTrue(out.get(0).valid());
        assertFalse(out.get(1).valid());
        assertTrue(out.get(2).valid());
    }

    @Test
    void updatedConfigAppliesToLaterCalls() {
        assertFalse(service.validate("SELECT * FROM ledger", "u1").valid());

        service.updateConfig(new ValidationConfig(List.of("ledger"), 10_000, true, true));

        assertTrue(service.validate("SELECT * FROM ledger", "u1").valid());
        assertFalse(service.validate("SELECT * FROM customers", "u1").valid());
    }

    @Test
    void selfTestPassesWithDefaultConfig() {
        assertTrue(service.selfTest());
    }
}
