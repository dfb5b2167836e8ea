package com.vedant.analyticsbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

@Configuration
public class AnalyticsConfig {

    @Bean
    public LlmConfig llmConfig(
            @Value("${llm.api.url:https://openrouter.ai/api/v1/chat/completions}") String apiUrl,
            @Value("${llm.api.key:}") String apiKey,
            @Value("${llm.model:openai/gpt-4o-mini}") String model,
            @Value("${llm.temperature:0.1}") double temperature,
            @Value("${llm.max-tokens:1000}") int maxTokens,
            @Value("${llm.timeout-seconds:30}") int timeoutSeconds,
            @Value("${llm.sql-temperature:0.1}") double sqlTemperature,
            @Value("${llm.summary-temperature:0.3}") double summaryTemperature
    ) {
        return new LlmConfig(apiUrl, apiKey, model, temperature, maxTokens, timeoutSeconds, sqlTemperature, summaryTemperature);
    }

    @Bean
    public ValidationConfig validationConfig(
            @Value("${analytics.validation.allowed-tables:payment_intent,payment_attempt,customers,address}") List<String> allowedTables,
            @Value("${analytics.validation.max-query-length:10000}") int maxQueryLength,
            @Value("${analytics.validation.security-checks:true}") boolean securityChecks,
            @Value("${analytics.validation.table-authorization:true}") boolean tableAuthorization
    ) {
        return new ValidationConfig(allowedTables, maxQueryLength, securityChecks, tableAuthorization);
    }

    @Bean
    public ExecutionConfig executionConfig(
            @Value("${analytics.execution.max-rows:1000}") int maxRows,
            @Value("${analytics.execution.timeout-seconds:30}") int timeoutSeconds
    ) {
        return new ExecutionConfig(maxRows, timeoutSeconds);
    }

    @Bean
    public ChainConfig chainConfig(
            @Value("${analytics.chain.fallback:true}") boolean fallback,
            @Value("${analytics.chain.retry:false}") boolean retry,
            @Value("${analytics.chain.max-retries:1}") int maxRetries
    ) {
        return new ChainConfig(fallback, retry, maxRetries);
    }

    @Bean
    public HttpClient llmHttpClient(@Value("${llm.connect-timeout-seconds:10}") int connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connectTimeout))
                .build();
    }
}
