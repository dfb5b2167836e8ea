package com.vedant.analyticsbot.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a statement into CTEs and main query, and pulls parenthesized
 * subqueries and LATERAL bodies out of a fragment.
 *
 * Only the shapes the generator is asked to produce are recognized: an
 * optional leading WITH, then SELECT.
 */
public final class StatementDecomposer {

    private static final Pattern WITH_HEAD = Pattern.compile("^\\s*with\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECURSIVE = Pattern.compile("^\\s*recursive\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MATERIALIZED = Pattern.compile("^\\s*materialized\\b", Pattern.CASE_INSENSITIVE);

    // name [ (col, ...) ] AS [ [NOT] MATERIALIZED ] (
    private static final Pattern CTE_HEADER = Pattern.compile(
            "^(?:materialized\\s+)?([A-Za-z_][A-Za-z0-9_]*)\\s*(?:\\([^()]*\\)\\s*)?\\bas\\s*(?:(?:not\\s+)?materialized\\s*)?\\(",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SUBQUERY_OPEN = Pattern.compile("\\(\\s*select\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LATERAL_OPEN = Pattern.compile(
            "\\b(?:(?:inner|cross|left(?:\\s+outer)?|right(?:\\s+outer)?|full(?:\\s+outer)?)\\s+)?join\\s+lateral\\s*\\(",
            Pattern.CASE_INSENSITIVE);

    private StatementDecomposer() {}

    public static DecompositionResult decompose(String statement) {
        if (statement == null) return DecompositionResult.malformed("No statement");
        String masked = SqlScanner.mask(statement);

        Matcher with = WITH_HEAD.matcher(masked);
        if (!with.find()) {
            return DecompositionResult.notCte(statement);
        }

        int pos = with.end();
        pos = consume(RECURSIVE, masked, pos);
        pos = consume(MATERIALIZED, masked, pos);

        List<CteDefinition> ctes = new ArrayList<>();
        while (true) {
            pos = SqlScanner.skipWhitespace(masked, pos);
            if (pos >= masked.length()) {
                return DecompositionResult.malformed("no main SELECT after the CTE list");
            }

            if (SqlScanner.startsWithKeyword(masked, pos, "select")) {
                if (ctes.isEmpty()) {
                    return DecompositionResult.malformed("WITH without any CTE definition");
                }
                return DecompositionResult.cte(ctes, statement.substring(pos).trim());
            }

            Matcher header = CTE_HEADER.matcher(masked).region(pos, masked.length());
            if (!header.lookingAt()) {
                return DecompositionResult.malformed("unexpected text near '" + preview(statement, pos) + "'");
            }

            String name = header.group(1);
            int open = header.end() - 1;
            int close = SqlScanner.findClosing(masked, open);
            if (close < 0) {
                return DecompositionResult.malformed("unbalanced parentheses in CTE " + name);
            }

            String body = statement.substring(open + 1, close).trim();
            ctes.add(new CteDefinition(name, new QueryFragment("CTE " + name, body, Set.of())));

            pos = SqlScanner.skipWhitespace(masked, close + 1);
            if (pos < masked.length() && masked.charAt(pos) == ',') {
                pos++;
            }
        }
    }

    /**
     * Every {@code ( SELECT ... )} and {@code <join> LATERAL ( ... )} body in
     * source order. Plain subqueries are labelled "Subquery N"; a span opened
     * by LATERAL is labelled "LATERAL subquery" and reported once. Spans whose
     * parentheses never close are skipped.
     */
    public static List<QueryFragment> extractSubqueries(QueryFragment fragment) {
        String sql = fragment.sql();
        String masked = SqlScanner.mask(sql);

        // open-paren index -> true when opened by LATERAL
        TreeMap<Integer, Boolean> opens = new TreeMap<>();
        Matcher sub = SUBQUERY_OPEN.matcher(masked);
        while (sub.find()) {
            opens.put(sub.start(), Boolean.FALSE);
        }
        Matcher lateral = LATERAL_OPEN.matcher(masked);
        while (lateral.find()) {
            opens.put(lateral.end() - 1, Boolean.TRUE);
        }

        List<QueryFragment> out = new ArrayList<>();
        int n = 0;
        for (var e : opens.entrySet()) {
            int open = e.getKey();
            int close = SqlScanner.findClosing(masked, open);
            if (close < 0) continue;
            String body = sql.substring(open + 1, close).trim();
            String label = e.getValue() ? "LATERAL subquery" : "Subquery " + (++n);
            out.add(new QueryFragment(label, body, fragment.boundNames()));
        }
        return out;
    }

    /** Only the LATERAL bodies of a fragment, in source order. */
    public static List<QueryFragment> extractLateralSubqueries(QueryFragment fragment) {
        String sql = fragment.sql();
        String masked = SqlScanner.mask(sql);
        List<QueryFragment> out = new ArrayList<>();
        Matcher lateral = LATERAL_OPEN.matcher(masked);
        int from = 0;
        while (from < masked.length() && lateral.find(from)) {
            int open = lateral.end() - 1;
            int close = SqlScanner.findClosing(masked, open);
            if (close < 0) break;
            out.add(new QueryFragment("LATERAL subquery", sql.substring(open + 1, close).trim(), fragment.boundNames()));
            from = close + 1;
        }
        return out;
    }

    private static int consume(Pattern keyword, String text, int pos) {
        Matcher m = keyword.matcher(text).region(pos, text.length());
        return m.lookingAt() ? m.end() : pos;
    }

    private static String preview(String text, int pos) {
        String rest = text.substring(pos).strip();
        return rest.length() > 30 ? rest.substring(0, 30) + "..." : rest;
    }
}
