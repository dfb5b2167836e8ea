package com.vedant.analyticsbot.util;

import com.vedant.analyticsbot.config.ValidationConfig;
import com.vedant.analyticsbot.dto.PolicyMode;
import com.vedant.analyticsbot.dto.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SQLValidatorTest {

    private final ValidationConfig config = ValidationConfig.defaults();

    private ValidationOutcome validate(String sql) {
        return SQLValidator.validate(sql, "u1", config);
    }

    @Test
    void simpleSelectIsValid() {
        ValidationOutcome r = validate("SELECT * FROM payment_intent");
        assertTrue(r.valid());
        assertNull(r.error());
        assertEquals(Set.of("payment_intent"), r.validatedTables());
        assertEquals(PolicyMode.GENERAL_PURPOSE, r.policyMode());
    }

    @Test
    void tautologyIsRejected() {
        ValidationOutcome r = validate("SELECT a FROM payment_intent WHERE 1=1 OR 1=1");
        assertFalse(r.valid());
        assertTrue(r.error().contains("Suspicious OR condition"), r.error());
    }

    @Test
    void secondStatementIsRejected() {
        ValidationOutcome r = validate("SELECT * FROM payment_intent; SELECT * FROM customers");
        assertFalse(r.valid());
        assertTrue(r.error().contains("Multiple semicolons"), r.error());
    }

    @Test
    void unknownTableIsRejected() {
        ValidationOutcome r = validate("SELECT * FROM secret_table");
        assertFalse(r.valid());
        assertTrue(r.error().contains("Unauthorized table access: secret_table"), r.error());
    }

    @Test
    void cteAliasIsNotReportedAsTable() {
        ValidationOutcome r = validate("WITH recent AS (SELECT * FROM payment_attempt) SELECT * FROM recent");
        assertTrue(r.valid(), r.error());
        assertTrue(r.validatedTables().contains("payment_attempt"));
        assertFalse(r.validatedTables().contains("recent"));
    }

    @Test
    void cteFailuresCarryTheCteName() {
        assertEquals("CTE x: Unauthorized table access: secret",
                validate("WITH x AS (SELECT * FROM secret) SELECT * FROM x").error());
        assertEquals("CTE x: Suspicious OR condition detected",
                validate("WITH x AS (SELECT * FROM customers WHERE 1=1 OR 1=1) SELECT * FROM x").error());
    }

    @Test
    void firstViolationInSourceOrderWins() {
        ValidationOutcome r = validate("WITH a AS (SELECT * FROM payment_intent), b AS (SELECT * FROM secret_b) "
                + "SELECT * FROM secret_main");
        assertEquals("CTE b: Unauthorized table access: secret_b", r.error());
    }

    @Test
    void mainQueryContextAfterCtes() {
        ValidationOutcome r = validate("WITH a AS (SELECT * FROM customers) SELECT * FROM a UNION SELECT * FROM a");
        assertEquals("Main query: UNION clauses not allowed", r.error());
    }

    @Test
    void tablesOfEveryFragmentAreCollected() {
        ValidationOutcome r = validate("WITH c AS (SELECT id FROM customers) "
                + "SELECT p.id FROM payment_intent p JOIN c ON c.id = p.customer_id "
                + "LEFT JOIN LATERAL (SELECT * FROM payment_attempt a WHERE a.payment_id = p.id LIMIT 1) la ON true "
                + "WHERE p.customer_id IN (SELECT customer_id FROM address)");
        assertTrue(r.valid(), r.error());
        assertEquals(Set.of("address", "customers", "payment_attempt", "payment_intent"), r.validatedTables());
    }

    @Test
    void nonSelectStatementsAreRejected() {
        assertEquals("Only SELECT statements are allowed", validate("DELETE FROM payment_intent").error());
        assertEquals("Only SELECT statements are allowed", validate("SELECT 1 FROM customers WHERE 1 = 1; DROP TABLE customers").error());
    }

    @Test
    void keywordsInLiteralsAndReplaceFunctionAreFine() {
        assertTrue(validate("SELECT * FROM payment_intent WHERE status = 'update pending'").valid());
        assertTrue(validate("SELECT REPLACE(status, '_', ' ') FROM payment_intent").valid());
        assertTrue(validate("SELECT created_at, updated_at FROM payment_intent").valid());
    }

    @Test
    void functionFromDoesNotTriggerAuthorization() {
        ValidationOutcome r = validate("SELECT EXTRACT(YEAR FROM created_at) AS y, COUNT(*) FROM payment_intent GROUP BY 1");
        assertTrue(r.valid(), r.error());
        assertEquals(Set.of("payment_intent"), r.validatedTables());
    }

    @Test
    void topLevelChecks() {
        assertEquals("Empty query", validate("  ").error());
        assertEquals("Empty query", SQLValidator.validate(null, "u1", config).error());
        assertEquals("Empty actor id", SQLValidator.validate("SELECT 1", " ", config).error());

        ValidationConfig tight = new ValidationConfig(ValidationConfig.DEFAULT_TABLES, 20, true, true);
        assertEquals("Query too long (max 20 characters)",
                SQLValidator.validate("SELECT * FROM payment_intent", "u1", tight).error());
    }

    @Test
    void unbalancedParenthesesFail() {
        assertEquals("Unbalanced parentheses in query", validate("SELECT COUNT(* FROM payment_intent").error());
    }

    @Test
    void malformedWithClauseFails() {
        ValidationOutcome r = validate("WITH x AS (SELECT 1) garbage SELECT 1");
        assertFalse(r.valid());
        assertTrue(r.error().startsWith("Malformed WITH clause"), r.error());
    }

    @Test
    void disabledStagesAreSkipped() {
        ValidationConfig noPatterns = new ValidationConfig(ValidationConfig.DEFAULT_TABLES, 10_000, false, true);
        assertTrue(SQLValidator.validate("SELECT a FROM payment_intent WHERE 1=1 OR 1=1", "u1", noPatterns).valid());

        ValidationConfig noAuth = new ValidationConfig(ValidationConfig.DEFAULT_TABLES, 10_000, true, false);
        ValidationOutcome r = SQLValidator.validate("SELECT * FROM secret_table", "u1", noAuth);
        assertTrue(r.valid());
        assertEquals(Set.of("secret_table"), r.validatedTables());
    }

    @Test
    void sameInputSameOutcome() {
        String sql = "WITH recent AS (SELECT * FROM payment_attempt) SELECT * FROM recent";
        assertEquals(validate(sql), validate(sql));
    }

    @Test
    void isSelectOnlyGate() {
        assertTrue(SQLValidator.isSelectOnly("select 1"));
        assertTrue(SQLValidator.isSelectOnly("(SELECT 1)"));
        assertTrue(SQLValidator.isSelectOnly("WITH x AS (SELECT 1) SELECT * FROM x"));
        assertFalse(SQLValidator.isSelectOnly("UPDATE customers SET name = 'x'"));
        assertFalse(SQLValidator.isSelectOnly(null));
    }

    @Test
    void commentBeforeTableDoesNotHideIt() {
        assertEquals("Unauthorized table access: secret_table", validate("SELECT * FROM/**/secret_table").error());
        assertEquals("Unauthorized table access: secret_table", validate("SELECT * FROM -- c\n secret_table").error());
        assertEquals("Unauthorized table access: secret_table",
                validate("SELECT * FROM payment_intent p JOIN/* x */secret_table s ON true").error());
    }

    @Test
    void quotedTableWithoutSpaceIsAuthorized() {
        assertEquals("Unauthorized table access: secret_table", validate("SELECT * FROM\"secret_table\"").error());
    }

    @Test
    void parenthesizedJoinIsAuthorized() {
        ValidationOutcome r = validate("SELECT * FROM (payment_intent p CROSS JOIN secret_table s)");
        assertFalse(r.valid());
        assertEquals("Unauthorized table access: secret_table", r.error());

        ValidationOutcome ok = validate("SELECT * FROM (payment_intent p JOIN customers c ON c.id = p.customer_id)");
        assertTrue(ok.valid(), ok.error());
        assertEquals(Set.of("customers", "payment_intent"), ok.validatedTables());
    }

    @Test
    void tableShorthandIsAuthorized() {
        assertEquals("Unauthorized table access: secret_table",
                validate("SELECT * FROM payment_intent WHERE id IN (TABLE secret_table)").error());
        assertEquals("Unauthorized table access: secret_table", validate("(TABLE secret_table)").error());
        assertTrue(validate("(TABLE customers)").valid());
    }

    @Test
    void fromListItemsAfterDerivedTablesAreAuthorized() {
        assertEquals("Unauthorized table access: secret_table",
                validate("SELECT * FROM (SELECT 1 AS n) x, secret_table").error());
    }

    @Test
    void literalsThatLookLikeCodeDoNotHideTables() {
        assertEquals("Unauthorized table access: secret_table",
                validate("SELECT \"it's\" FROM secret_table WHERE status = 'x'").error());
        assertEquals("Unauthorized table access: secret_table",
                validate("SELECT $$'$$ AS q FROM secret_table WHERE status = 'x'").error());
    }

    @Test
    void commentedOutTablesAreNotReferences() {
        ValidationOutcome r = validate("SELECT * FROM payment_intent -- JOIN secret_table\n WHERE amount > 0");
        assertTrue(r.valid(), r.error());
        assertEquals(Set.of("payment_intent"), r.validatedTables());
    }
}
