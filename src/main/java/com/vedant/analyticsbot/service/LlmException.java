package com.vedant.analyticsbot.service;

/**
 * The completion call did not produce usable text: no API key, transport
 * failure, timeout, non-2xx status or an unreadable payload.
 */
public class LlmException extends Exception {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
