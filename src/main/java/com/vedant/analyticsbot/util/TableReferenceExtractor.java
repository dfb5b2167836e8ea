package com.vedant.analyticsbot.util;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the physical tables a fragment reads: every item of a FROM list,
 * the item after each JOIN, and the {@code TABLE name} shorthand. Items may be
 * schema-qualified, quoted, prefixed by ONLY or LATERAL, or parenthesized
 * joins. Reserved words and the fragment's locally bound CTE names are never
 * reported. The result is sorted and case-insensitively unique.
 */
public final class TableReferenceExtractor {

    // Keywords that can follow FROM/JOIN without being a table.
    public static final Set<String> RESERVED_WORDS = Set.of(
            "lateral", "tablesample", "unnest", "recursive", "materialized",
            "values", "generate_series", "information_schema", "pg_catalog",
            "with", "ordinality", "select",
            "over", "partition", "rows", "range", "preceding", "following",
            "unbounded", "current", "row",
            "not", "exists", "in", "any", "all", "some", "between",
            "cast", "convert", "array", "record",
            "case", "when", "then", "else", "end", "coalesce", "nullif",
            "jsonb_array_elements", "jsonb_object_keys", "json_each", "jsonb_each",
            "union", "intersect", "except",
            "default", "null", "true", "false"
    );

    private static final Pattern TABLE_KEYWORD = Pattern.compile("\\b(from|join|table)\\b\\s*", Pattern.CASE_INSENSITIVE);

    private static final String IDENT = "(?:\"(?:[^\"]|\"\")+\"|`[^`]+`|[A-Za-z_][A-Za-z0-9_$]*)";

    // [schema.]name
    private static final Pattern QUALIFIED_NAME = Pattern.compile(
            "(" + IDENT + ")(?:\\s*\\.\\s*(" + IDENT + "))?", Pattern.CASE_INSENSITIVE);

    private static final Pattern ITEM_PREFIX = Pattern.compile("(?:only|lateral)\\b\\s*", Pattern.CASE_INSENSITIVE);

    // a IS [NOT] DISTINCT FROM b
    private static final Pattern DISTINCT_BEFORE = Pattern.compile("\\bis\\s+(?:not\\s+)?distinct\\s*$", Pattern.CASE_INSENSITIVE);

    // Clauses that close a FROM list.
    private static final Pattern FROM_LIST_END = Pattern.compile(
            "\\b(where|group|having|order|limit|offset|window|fetch|for|union|intersect|except)\\b",
            Pattern.CASE_INSENSITIVE);

    // A '(' after one of these is not a function call.
    private static final Set<String> NON_FUNCTION_WORDS = Set.of(
            "from", "join", "lateral", "only", "table", "on", "using", "in", "exists",
            "and", "or", "not", "where", "having", "as", "select", "when", "then", "else",
            "any", "all", "some", "array");

    private TableReferenceExtractor() {}

    public static Set<String> extractTables(QueryFragment fragment) {
        return extractTables(fragment.sql(), fragment.boundNames());
    }

    public static Set<String> extractTables(String sql, Set<String> boundNames) {
        TreeSet<String> tables = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (sql == null || sql.isBlank()) return tables;

        TreeSet<String> excluded = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (boundNames != null) excluded.addAll(boundNames);

        String masked = SqlScanner.mask(sql);
        int[] enclosing = SqlScanner.enclosingParens(masked);

        Matcher kw = TABLE_KEYWORD.matcher(masked);
        while (kw.find()) {
            String keyword = kw.group(1).toLowerCase(Locale.ROOT);
            if (keyword.equals("from")) {
                if (insideFunctionCall(masked, enclosing, kw.start())) continue;
                if (DISTINCT_BEFORE.matcher(masked.substring(0, kw.start())).find()) continue;
            }

            parseItem(sql, masked, kw.end(), excluded, tables);
            if (!keyword.equals("from")) continue;

            // remaining items of the FROM list: commas at the same nesting level
            int level = enclosing[kw.start()];
            int end = fromListEnd(masked, enclosing, kw.end(), level);
            for (int i = kw.end(); i < end; i++) {
                if (masked.charAt(i) == ',' && enclosing[i] == level) {
                    parseItem(sql, masked, i + 1, excluded, tables);
                }
            }
        }

        for (QueryFragment lateral : StatementDecomposer.extractLateralSubqueries(
                new QueryFragment("LATERAL subquery", sql, excluded))) {
            tables.addAll(extractTables(lateral.sql(), excluded));
        }
        return Collections.unmodifiableSet(tables);
    }

    /*
     * One FROM item starting at pos: a table, a function call, a subquery or a
     * parenthesized join. Tables go into the result; subqueries are left to
     * the keyword scan, which reaches their FROM clauses on its own.
     */
    private static void parseItem(String sql, String masked, int pos, Set<String> excluded, Set<String> tables) {
        int len = masked.length();
        pos = SqlScanner.skipWhitespace(masked, pos);
        Matcher prefix = ITEM_PREFIX.matcher(masked);
        while (pos < len && prefix.region(pos, len).lookingAt()) {
            pos = prefix.end();
        }
        if (pos >= len) return;

        if (masked.charAt(pos) == '(') {
            int close = SqlScanner.findClosing(masked, pos);
            if (close < 0) return;
            if (!opensSubquery(masked, pos)) {
                // (a JOIN b): the first item has no keyword of its own
                tables.addAll(extractTables("FROM " + sql.substring(pos + 1, close), excluded));
            }
            return;
        }

        Matcher ref = QUALIFIED_NAME.matcher(masked).region(pos, len);
        if (!ref.lookingAt()) return;
        if (followedByParen(masked, ref.end())) {
            // function call in FROM, e.g. generate_series(...)
            return;
        }
        String name = unquote(ref.group(2) != null ? ref.group(2) : ref.group(1));
        if (!RESERVED_WORDS.contains(name.toLowerCase(Locale.ROOT)) && !excluded.contains(name)) {
            tables.add(name);
        }
    }

    private static int fromListEnd(String masked, int[] enclosing, int from, int level) {
        int limit = level < 0 ? masked.length() : SqlScanner.findClosing(masked, level);
        if (limit < 0) limit = masked.length();
        Matcher m = FROM_LIST_END.matcher(masked).region(from, limit);
        while (m.find()) {
            if (enclosing[m.start()] == level) return m.start();
        }
        return limit;
    }

    private static boolean opensSubquery(String masked, int open) {
        return SqlScanner.startsWithKeyword(masked, open + 1, "select")
                || SqlScanner.startsWithKeyword(masked, open + 1, "with");
    }

    /*
     * EXTRACT(YEAR FROM x), TRIM(BOTH ' ' FROM x), SUBSTRING(x FROM 2): the
     * innermost paren follows a function name and does not open a subquery.
     */
    private static boolean insideFunctionCall(String masked, int[] enclosing, int keywordIndex) {
        int open = enclosing[keywordIndex];
        if (open < 0 || opensSubquery(masked, open)) return false;
        int p = open - 1;
        while (p >= 0 && Character.isWhitespace(masked.charAt(p))) p--;
        int wordEnd = p + 1;
        while (p >= 0 && (SqlScanner.isIdentifierChar(masked.charAt(p)) || masked.charAt(p) == '$')) p--;
        String word = masked.substring(p + 1, wordEnd).toLowerCase(Locale.ROOT);
        return !word.isEmpty() && !Character.isDigit(word.charAt(0)) && !NON_FUNCTION_WORDS.contains(word);
    }

    private static boolean followedByParen(String masked, int index) {
        int p = SqlScanner.skipWhitespace(masked, index);
        return p < masked.length() && masked.charAt(p) == '(';
    }

    private static String unquote(String ident) {
        if (ident.length() >= 2) {
            char first = ident.charAt(0);
            if (first == '"' && ident.charAt(ident.length() - 1) == '"') {
                return ident.substring(1, ident.length() - 1).replace("\"\"", "\"");
            }
            if (first == '`' && ident.charAt(ident.length() - 1) == '`') {
                return ident.substring(1, ident.length() - 1);
            }
        }
        return ident;
    }
}
