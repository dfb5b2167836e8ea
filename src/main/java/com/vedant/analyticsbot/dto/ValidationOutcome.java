package com.vedant.analyticsbot.dto;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of validating one statement. Never partially valid: any failing
 * fragment makes the whole statement invalid.
 */
public record ValidationOutcome(
        boolean valid,
        String error,
        Set<String> validatedTables,
        List<String> warnings,
        PolicyMode policyMode,
        double validationTimeMs
) {

    public ValidationOutcome {
        if (validatedTables != null) {
            TreeSet<String> copy = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            copy.addAll(validatedTables);
            validatedTables = Collections.unmodifiableSet(copy);
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationOutcome valid(Set<String> tables, PolicyMode mode) {
        return new ValidationOutcome(true, null, tables, List.of(), mode, 0.0);
    }

    public static ValidationOutcome invalid(String error) {
        return new ValidationOutcome(false, error, null, List.of(), null, 0.0);
    }

    public ValidationOutcome withValidationTimeMs(double ms) {
        return new ValidationOutcome(valid, error, validatedTables, warnings, policyMode, ms);
    }
}
