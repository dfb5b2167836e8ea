package com.vedant.analyticsbot.util;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A piece of SQL text together with the names bound locally (CTE aliases)
 * that must never be read as table references inside it.
 */
public record QueryFragment(String label, String sql, Set<String> boundNames) {

    public QueryFragment {
        sql = sql == null ? "" : sql;
        TreeSet<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (boundNames != null) names.addAll(boundNames);
        boundNames = Collections.unmodifiableSet(names);
    }

    public QueryFragment withBoundNames(Set<String> names) {
        return new QueryFragment(label, sql, names);
    }
}
