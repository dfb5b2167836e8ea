package com.vedant.analyticsbot.util;

/** One {@code name AS ( body )} entry of a WITH clause. */
public record CteDefinition(String name, QueryFragment body) {}
