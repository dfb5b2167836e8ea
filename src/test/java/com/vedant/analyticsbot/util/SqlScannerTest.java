package com.vedant.analyticsbot.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlScannerTest {

    @Test
    void masksLiteralContentButKeepsLength() {
        String sql = "SELECT * FROM t WHERE a = 'x)(y' AND b = 'it''s'";
        String masked = SqlScanner.mask(sql);

        assertEquals(sql.length(), masked.length());
        assertFalse(masked.contains("x)(y"));
        assertTrue(masked.startsWith("SELECT * FROM t WHERE a = '"));
        assertTrue(SqlScanner.isBalanced(masked));
    }

    @Test
    void commentsBecomeWhitespace() {
        String sql = "SELECT * FROM/**/payment_intent -- note ) \nWHERE /* a /* nested */ ( */ id = 1";
        String masked = SqlScanner.mask(sql);

        assertEquals(sql.length(), masked.length());
        assertEquals("SELECT * FROM    payment_intent", masked.substring(0, 31));
        assertFalse(masked.contains("note"));
        assertFalse(masked.contains("nested"));
        assertTrue(masked.contains("\nWHERE"));
        assertTrue(SqlScanner.isBalanced(masked));
    }

    @Test
    void commentMarkersInsideLiteralsAreText() {
        String sql = "SELECT '--x' AS a, '/*' AS b FROM customers";
        assertTrue(SqlScanner.mask(sql).endsWith("AS b FROM customers"));
        assertEquals(sql, SqlScanner.maskComments(sql));
    }

    @Test
    void quoteInsideQuotedIdentifierDoesNotOpenALiteral() {
        String sql = "SELECT \"it's\" FROM secret_table";
        assertEquals(sql, SqlScanner.mask(sql));
    }

    @Test
    void escapeStringsAndDollarQuotes() {
        String escaped = SqlScanner.mask("SELECT E'a\\'b' FROM customers");
        assertTrue(escaped.endsWith("' FROM customers"), escaped);
        assertFalse(escaped.contains("b'"));

        String dollar = SqlScanner.mask("SELECT $q$ it's ) $q$ FROM customers WHERE id = $1");
        assertTrue(dollar.startsWith("SELECT $q$"));
        assertFalse(dollar.contains("it's"));
        assertTrue(dollar.endsWith("$q$ FROM customers WHERE id = $1"));
    }

    @Test
    void maskCommentsKeepsLiterals() {
        assertEquals("SELECT 'a'     FROM t", SqlScanner.maskComments("SELECT 'a'/**/ FROM t"));
    }

    @Test
    void findsMatchingCloseParen() {
        String s = "(a (b) c) d";
        assertEquals(8, SqlScanner.findClosing(s, 0));
        assertEquals(5, SqlScanner.findClosing(s, 3));
    }

    @Test
    void unclosedParenReturnsMinusOne() {
        assertEquals(-1, SqlScanner.findClosing("(a (b c", 0));
    }

    @Test
    void rejectsIndexWithoutOpenParen() {
        assertThrows(IllegalArgumentException.class, () -> SqlScanner.findClosing("abc", 1));
    }

    @Test
    void detectsUnbalancedText() {
        assertTrue(SqlScanner.isBalanced("f(a, g(b))"));
        assertFalse(SqlScanner.isBalanced("f(a, g(b)"));
        assertFalse(SqlScanner.isBalanced(")("));
    }

    @Test
    void reportsInnermostEnclosingParen() {
        String s = "a(b(c)d)e";
        int[] enclosing = SqlScanner.enclosingParens(s);
        assertEquals(-1, enclosing[0]);
        assertEquals(1, enclosing[2]);
        assertEquals(3, enclosing[4]);
        assertEquals(1, enclosing[6]);
        assertEquals(-1, enclosing[8]);
    }

    @Test
    void keywordMatchRespectsWordBoundary() {
        assertTrue(SqlScanner.startsWithKeyword("  SELECT x", 0, "select"));
        assertFalse(SqlScanner.startsWithKeyword("selected", 0, "select"));
        assertTrue(SqlScanner.startsWithKeyword("select", 0, "select"));
    }
}
