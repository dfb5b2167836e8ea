package com.vedant.analyticsbot.util;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TableReferenceExtractorTest {

    private static Set<String> tables(String sql) {
        return TableReferenceExtractor.extractTables(sql, Set.of());
    }

    @Test
    void singleTable() {
        assertEquals(Set.of("payment_intent"), tables("SELECT * FROM payment_intent"));
    }

    @Test
    void qualifiedJoinsWithAliases() {
        Set<String> found = tables("SELECT p.id FROM payment_intent p "
                + "INNER JOIN payment_attempt AS a ON a.payment_id = p.id "
                + "LEFT OUTER JOIN customers c ON c.id = p.customer_id WHERE p.amount > 0");
        assertEquals(Set.of("customers", "payment_attempt", "payment_intent"), found);
    }

    @Test
    void schemaQualifiedAndQuotedNames() {
        assertEquals(Set.of("payment_intent"), tables("SELECT * FROM public.payment_intent"));
        assertEquals(Set.of("customers"), tables("SELECT * FROM \"customers\" c"));
    }

    @Test
    void commaSeparatedFromList() {
        assertEquals(Set.of("customers", "payment_intent"),
                tables("SELECT * FROM payment_intent p, customers c WHERE c.id = p.customer_id"));
    }

    @Test
    void boundCteNamesAreExcluded() {
        assertTrue(TableReferenceExtractor.extractTables("SELECT * FROM recent r JOIN RECENT x ON true", Set.of("recent")).isEmpty());
    }

    @Test
    void functionFromIsNotATable() {
        assertEquals(Set.of("payment_intent"),
                tables("SELECT EXTRACT(YEAR FROM created_at) AS y, TRIM(BOTH ' ' FROM status) FROM payment_intent"));
        assertEquals(Set.of("payment_intent"),
                tables("SELECT * FROM payment_intent WHERE status IS DISTINCT FROM currency"));
    }

    @Test
    void setReturningFunctionsAreIgnored() {
        assertTrue(tables("SELECT * FROM generate_series(1, 10) g").isEmpty());
        assertTrue(tables("SELECT * FROM unnest(ARRAY[1,2]) u").isEmpty());
    }

    @Test
    void derivedTableContributesItsInnerTable() {
        assertEquals(Set.of("customers"), tables("SELECT * FROM (SELECT id FROM customers) sub"));
    }

    @Test
    void lateralBodyTablesAreIncluded() {
        Set<String> found = tables("SELECT * FROM payment_intent p CROSS JOIN LATERAL "
                + "(SELECT * FROM payment_attempt a WHERE a.payment_id = p.id LIMIT 1) la");
        assertEquals(Set.of("payment_attempt", "payment_intent"), found);
    }

    @Test
    void reservedWordsAreNeverReported() {
        Set<String> found = tables("SELECT * FROM payment_intent JOIN lateral (SELECT 1) x ON true");
        for (String t : found) {
            assertFalse(TableReferenceExtractor.RESERVED_WORDS.contains(t.toLowerCase()), t);
        }
    }

    @Test
    void duplicatesCollapseCaseInsensitively() {
        assertEquals(1, tables("SELECT * FROM customers JOIN CUSTOMERS c2 ON true").size());
    }

    @Test
    void sameInputSameOutput() {
        String sql = "SELECT * FROM payment_intent p JOIN customers c ON c.id = p.customer_id";
        assertEquals(tables(sql), tables(sql));
    }

    @Test
    void commentsBetweenKeywordAndTableAreSkipped() {
        assertEquals(Set.of("secret_table"), tables("SELECT * FROM/**/secret_table"));
        assertEquals(Set.of("secret_table"), tables("SELECT * FROM -- c\n secret_table"));
        assertEquals(Set.of("customers", "secret_table"),
                tables("SELECT * FROM customers c JOIN /* x */ secret_table s ON true"));
    }

    @Test
    void quotedNameDirectlyAfterKeyword() {
        assertEquals(Set.of("secret_table"), tables("SELECT * FROM\"secret_table\""));
        assertEquals(Set.of("customers", "secret_table"), tables("SELECT * FROM customers JOIN\"secret_table\" s ON true"));
    }

    @Test
    void parenthesizedJoinContributesEveryTable() {
        assertEquals(Set.of("payment_intent", "secret_table"),
                tables("SELECT * FROM (payment_intent p CROSS JOIN secret_table s)"));
        assertEquals(Set.of("address", "customers", "payment_intent"),
                tables("SELECT * FROM ((payment_intent p JOIN customers c ON true) JOIN address a ON true)"));
    }

    @Test
    void fromListContinuesPastDerivedTablesAndFunctions() {
        assertEquals(Set.of("secret_table"), tables("SELECT * FROM (SELECT 1) x, secret_table"));
        assertEquals(Set.of("secret_table"), tables("SELECT * FROM generate_series(1, 3) g, secret_table s"));
        assertEquals(Set.of("payment_intent", "secret_table"),
                tables("SELECT * FROM payment_intent p TABLESAMPLE SYSTEM (10), secret_table WHERE true"));
    }

    @Test
    void onlyAndLateralPrefixes() {
        assertEquals(Set.of("secret_table"), tables("SELECT * FROM ONLY secret_table"));
        assertEquals(Set.of("customers"), tables("SELECT * FROM customers c, LATERAL unnest(c.tags) t"));
    }

    @Test
    void tableShorthandIsAReference() {
        assertEquals(Set.of("payment_intent", "secret_table"),
                tables("SELECT * FROM payment_intent WHERE id IN (TABLE secret_table)"));
        assertEquals(Set.of("secret_table"), tables("(TABLE secret_table)"));
        assertEquals(Set.of("secret_table"), tables("SELECT ARRAY(TABLE secret_table)"));
    }

    @Test
    void keywordsInLiteralsAndCommentsAreIgnored() {
        assertEquals(Set.of("customers"),
                tables("SELECT 'from secret_table' AS s FROM customers -- join other_table"));
    }
}
