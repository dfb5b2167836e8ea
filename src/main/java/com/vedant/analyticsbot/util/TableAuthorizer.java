package com.vedant.analyticsbot.util;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Checks table names against a fixed, case-insensitive allow-list. */
public final class TableAuthorizer {

    private final Set<String> allowed;

    public TableAuthorizer(Collection<String> allowedTables) {
        this.allowed = allowedTables == null ? Set.of() : allowedTables.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public CheckResult authorize(Collection<String> tables) {
        if (tables == null) return CheckResult.pass();
        for (String table : tables) {
            if (!allowed.contains(table.toLowerCase(Locale.ROOT))) {
                return CheckResult.fail("Unauthorized table access: " + table);
            }
        }
        return CheckResult.pass();
    }
}
