package com.vedant.analyticsbot.util;

/** Pass/fail of a single validation check, with the message when it fails. */
public record CheckResult(boolean ok, String error) {

    private static final CheckResult OK = new CheckResult(true, null);

    public static CheckResult pass() {
        return OK;
    }

    public static CheckResult fail(String error) {
        return new CheckResult(false, error);
    }
}
