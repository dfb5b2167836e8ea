package com.vedant.analyticsbot.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Coarse shape of a generated query, sniffed from keywords. Informational only. */
public enum QueryType {
    ANALYTICS,
    REPORTING,
    SUMMARY,
    UNKNOWN;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
