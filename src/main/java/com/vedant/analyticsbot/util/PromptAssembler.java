package com.vedant.analyticsbot.util;

/**
 * Builds the single prompt string handed to the SQL generator:
 * labelled system, tool (schema) and user sections, in that order.
 */
public final class PromptAssembler {

    public static final String SYSTEM_CONTEXT =
            "You answer analytics questions about an internal payments database.\n" +
                    "payment_intent holds one row per payment; payment_attempt holds every attempt to\n" +
                    "charge it (joined on payment_id). customers and address describe the payer.\n" +
                    "Success rate = succeeded / (succeeded + failed). Dropoff statuses (neither\n" +
                    "succeeded nor failed) are excluded from rate calculations.\n" +
                    "Amounts are stored in minor units (cents).";

    private PromptAssembler() {}

    public static String assemble(String systemContext, String toolContext, String userQuery) {
        return String.join("\n",
                "[SYSTEM CONTEXT]",
                systemContext == null ? "" : systemContext,
                "",
                "[TOOL CONTEXT]",
                toolContext == null ? "" : toolContext,
                "",
                "[USER CONTEXT]",
                "User Query: " + (userQuery == null ? "" : userQuery.trim()),
                "");
    }
}
