package com.vedant.analyticsbot.dto;

/** Which authorization path approved a statement. */
public enum PolicyMode {
    // allow-list only; the actor id is not enforced as a row filter
    GENERAL_PURPOSE
}
