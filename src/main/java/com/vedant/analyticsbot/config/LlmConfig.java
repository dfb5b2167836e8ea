package com.vedant.analyticsbot.config;

/**
 * Settings for the OpenAI-compatible chat completions endpoint.
 */
public record LlmConfig(
        String apiUrl,
        String apiKey,
        String model,
        double temperature,
        int maxTokens,
        int timeoutSeconds,
        double sqlGenerationTemperature,
        double summaryTemperature
) {

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    // never print the key
    @Override
    public String toString() {
        return "LlmConfig[apiUrl=" + apiUrl + ", model=" + model + ", temperature=" + temperature
                + ", maxTokens=" + maxTokens + ", timeoutSeconds=" + timeoutSeconds
                + ", sqlGenerationTemperature=" + sqlGenerationTemperature
                + ", summaryTemperature=" + summaryTemperature + ", configured=" + isConfigured() + "]";
    }
}
