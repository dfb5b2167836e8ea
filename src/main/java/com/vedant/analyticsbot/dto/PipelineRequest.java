package com.vedant.analyticsbot.dto;

/**
 * @param prompt    fully assembled generation prompt
 * @param userQuery the question as the user typed it
 * @param sessionId caller session; doubles as the validator's actor id
 */
public record PipelineRequest(String prompt, String userQuery, String sessionId) {

    public String actorId() {
        return sessionId == null || sessionId.isBlank() ? "system" : sessionId;
    }
}
