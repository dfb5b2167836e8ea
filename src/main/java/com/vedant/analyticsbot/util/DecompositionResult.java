package com.vedant.analyticsbot.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of splitting a statement into its CTE list and main query.
 *
 * <ul>
 *   <li>{@link Kind#NOT_CTE}: the statement does not open with WITH; main query is the statement itself.</li>
 *   <li>{@link Kind#CTE}: one or more CTEs followed by a main query that starts with SELECT.</li>
 *   <li>{@link Kind#MALFORMED}: it opens with WITH but cannot be decomposed (see {@link #error()}).</li>
 * </ul>
 */
public record DecompositionResult(Kind kind, List<CteDefinition> ctes, QueryFragment mainQuery, String error) {

    public enum Kind { NOT_CTE, CTE, MALFORMED }

    public DecompositionResult {
        ctes = ctes == null ? List.of() : List.copyOf(ctes);
    }

    public static DecompositionResult notCte(String statement) {
        return new DecompositionResult(Kind.NOT_CTE, List.of(), new QueryFragment("Query", statement, Set.of()), null);
    }

    public static DecompositionResult cte(List<CteDefinition> ctes, String mainQuery) {
        Set<String> names = new LinkedHashSet<>();
        List<CteDefinition> bound = new ArrayList<>(ctes.size());
        for (CteDefinition c : ctes) names.add(c.name());
        for (CteDefinition c : ctes) bound.add(new CteDefinition(c.name(), c.body().withBoundNames(names)));
        return new DecompositionResult(Kind.CTE, bound, new QueryFragment("Main query", mainQuery, names), null);
    }

    public static DecompositionResult malformed(String error) {
        return new DecompositionResult(Kind.MALFORMED, List.of(), null, error);
    }

    public boolean hasCte() {
        return kind == Kind.CTE;
    }

    public boolean isMalformed() {
        return kind == Kind.MALFORMED;
    }

    public Set<String> cteNames() {
        Set<String> names = new LinkedHashSet<>();
        for (CteDefinition c : ctes) names.add(c.name());
        return names;
    }
}
