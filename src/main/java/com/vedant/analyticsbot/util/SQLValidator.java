package com.vedant.analyticsbot.util;

import com.vedant.analyticsbot.config.ValidationConfig;
import com.vedant.analyticsbot.dto.PolicyMode;
import com.vedant.analyticsbot.dto.ValidationOutcome;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Strict validator for LLM-generated SQL: only read-only SELECT statements
 * touching allow-listed tables get through.
 *
 * The statement is decomposed into CTE bodies, main query and nested
 * subqueries; every fragment is checked on its own and the first violation
 * (CTEs in source order, then the main query, then subqueries) is reported.
 * Stateless, so safe to call from any thread.
 */
public final class SQLValidator {

    private static final Pattern STATEMENT_HEAD = Pattern.compile("^\\s*(select\\b|with\\b|\\()", Pattern.CASE_INSENSITIVE);

    // REPLACE(...) is a string function, not a statement
    private static final Pattern FORBIDDEN_KEYWORD = Pattern.compile(
            "\\b(insert|update|delete|alter|drop|create|truncate|grant|revoke|merge|replace)\\b(?!\\s*\\()",
            Pattern.CASE_INSENSITIVE);

    private SQLValidator() {}

    /**
     * Only statements starting with SELECT, WITH or '(' and free of
     * DML/DDL keywords (outside string literals) pass.
     */
    public static boolean isSelectOnly(String sql) {
        if (sql == null) return false;
        String masked = SqlScanner.mask(sql);
        if (!STATEMENT_HEAD.matcher(masked).find()) return false;
        return !FORBIDDEN_KEYWORD.matcher(masked).find();
    }

    public static ValidationOutcome validate(String sql, String actorId, ValidationConfig config) {
        if (sql == null || sql.isBlank()) {
            return ValidationOutcome.invalid("Empty query");
        }
        if (actorId == null || actorId.isBlank()) {
            return ValidationOutcome.invalid("Empty actor id");
        }
        if (sql.length() > config.maxQueryLength()) {
            return ValidationOutcome.invalid("Query too long (max " + config.maxQueryLength() + " characters)");
        }
        if (!isSelectOnly(sql)) {
            return ValidationOutcome.invalid("Only SELECT statements are allowed");
        }
        if (!SqlScanner.isBalanced(SqlScanner.mask(sql))) {
            return ValidationOutcome.invalid("Unbalanced parentheses in query");
        }

        DecompositionResult decomposition = StatementDecomposer.decompose(sql.trim());
        if (decomposition.isMalformed()) {
            return ValidationOutcome.invalid("Malformed WITH clause: " + decomposition.error());
        }

        TableAuthorizer authorizer = new TableAuthorizer(config.allowedTables());
        TreeSet<String> allTables = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

        /* ---------- CTE bodies ---------- */
        for (CteDefinition cte : decomposition.ctes()) {
            String error = checkFragment(cte.body(), authorizer, config, allTables);
            if (error != null) {
                return ValidationOutcome.invalid(error);
            }
        }

        /* ---------- main query ---------- */
        QueryFragment main = decomposition.mainQuery();
        if (config.enableSecurityChecks()) {
            CheckResult patterns = SecurityPatternMatcher.check(main);
            if (!patterns.ok()) return ValidationOutcome.invalid(patterns.error());
        }
        Set<String> mainTables = TableReferenceExtractor.extractTables(main);
        if (config.enableTableAuthorization()) {
            CheckResult auth = authorizer.authorize(mainTables);
            if (!auth.ok()) return ValidationOutcome.invalid(auth.error());
        }
        allTables.addAll(mainTables);

        /* ---------- nested subqueries / LATERAL bodies ---------- */
        for (QueryFragment sub : StatementDecomposer.extractSubqueries(main)) {
            String error = checkFragment(sub, authorizer, config, allTables);
            if (error != null) {
                return ValidationOutcome.invalid(error);
            }
        }

        return ValidationOutcome.valid(allTables, PolicyMode.GENERAL_PURPOSE);
    }

    // Pattern check, then table authorization. Returns the error or null.
    private static String checkFragment(QueryFragment fragment, TableAuthorizer authorizer,
                                        ValidationConfig config, Set<String> collected) {
        if (config.enableSecurityChecks()) {
            CheckResult patterns = SecurityPatternMatcher.check(fragment);
            if (!patterns.ok()) return patterns.error();
        }
        Set<String> tables = TableReferenceExtractor.extractTables(fragment);
        if (config.enableTableAuthorization()) {
            CheckResult auth = authorizer.authorize(tables);
            if (!auth.ok()) return fragment.label() + ": " + auth.error();
        }
        collected.addAll(tables);
        return null;
    }
}
