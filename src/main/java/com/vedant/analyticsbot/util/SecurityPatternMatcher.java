package com.vedant.analyticsbot.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects forbidden syntactic shapes inside one fragment. Checks run in a
 * fixed order and the first match wins:
 * <ol>
 *   <li>more than one statement</li>
 *   <li>a set operator (UNION, INTERSECT, EXCEPT)</li>
 *   <li>an {@code OR 1 = 1} tautology</li>
 *   <li>an {@code OR 'x' = 'x'} tautology</li>
 * </ol>
 * The set-operator rule rejects every UNION, including ones a human would
 * consider harmless. That is a deployment policy, not an oversight.
 */
public final class SecurityPatternMatcher {

    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");

    private static final Pattern SET_OPERATOR = Pattern.compile("\\b(union|intersect|except)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern OR_NUMERIC_TAUTOLOGY = Pattern.compile(
            "\\bor\\s*['\"]?1['\"]?\\s*=\\s*['\"]?1(?![0-9])['\"]?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern OR_STRING_TAUTOLOGY = Pattern.compile(
            "\\bor\\s*['\"][^'\"]*['\"]\\s*=\\s*['\"][^'\"]*['\"]",
            Pattern.CASE_INSENSITIVE);

    private SecurityPatternMatcher() {}

    public static CheckResult check(String fragment, String context) {
        if (fragment == null) return CheckResult.pass();
        String masked = SqlScanner.mask(fragment);

        String withoutTerminator = TRAILING_SEMICOLON.matcher(masked).replaceFirst("");
        if (withoutTerminator.indexOf(';') >= 0) {
            return CheckResult.fail(context + ": Multiple semicolons not allowed");
        }

        Matcher setOp = SET_OPERATOR.matcher(masked);
        if (setOp.find()) {
            return CheckResult.fail(context + ": " + setOp.group(1).toUpperCase(Locale.ROOT) + " clauses not allowed");
        }

        // tautologies are matched with literals readable, so 'x or 1=1' inside a string is rejected too
        String uncommented = SqlScanner.maskComments(fragment);
        if (OR_NUMERIC_TAUTOLOGY.matcher(uncommented).find()) {
            return CheckResult.fail(context + ": Suspicious OR condition detected");
        }

        if (OR_STRING_TAUTOLOGY.matcher(uncommented).find()) {
            return CheckResult.fail(context + ": Suspicious OR condition with quoted strings");
        }

        return CheckResult.pass();
    }

    public static CheckResult check(QueryFragment fragment) {
        return check(fragment.sql(), fragment.label());
    }
}
