package com.vedant.analyticsbot.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TableAuthorizerTest {

    private final TableAuthorizer authorizer = new TableAuthorizer(List.of("payment_intent", "Customers"));

    @Test
    void allowedTablesPassCaseInsensitively() {
        assertTrue(authorizer.authorize(Set.of("PAYMENT_INTENT", "customers")).ok());
    }

    @Test
    void unknownTableIsNamed() {
        CheckResult r = authorizer.authorize(List.of("payment_intent", "secret_table"));
        assertFalse(r.ok());
        assertEquals("Unauthorized table access: secret_table", r.error());
    }

    @Test
    void emptyInputIsAuthorized() {
        assertTrue(authorizer.authorize(Set.of()).ok());
        assertTrue(new TableAuthorizer(List.of()).authorize(Set.of()).ok());
    }
}
