package com.vedant.analyticsbot.service;

import com.vedant.analyticsbot.config.ChainConfig;
import com.vedant.analyticsbot.dto.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.*;

/**
 * Drives generation, validation, execution and summarization strictly in
 * that order. Every stage failure comes back as a {@link PipelineResult};
 * callers never see an exception from {@link #process} or
 * {@link #processWithRetry}.
 */
@Service
public class SequentialPipelineService {

    private static final Logger log = LoggerFactory.getLogger(SequentialPipelineService.class);

    private final SqlGenerationService generationService;
    private final SqlValidationService validationService;
    private final SqlExecutionService executionService;
    private final DataSummarizationService summarizationService;
    private volatile ChainConfig config;

    public SequentialPipelineService(
            SqlGenerationService generationService,
            SqlValidationService validationService,
            SqlExecutionService executionService,
            DataSummarizationService summarizationService,
            ChainConfig config
    ) {
        this.generationService = generationService;
        this.validationService = validationService;
        this.executionService = executionService;
        this.summarizationService = summarizationService;
        this.config = config;
    }

    public record HealthReport(String status, Map<String, Boolean> services, List<String> unhealthyServices, Instant timestamp) {

        public boolean healthy() {
            return unhealthyServices.isEmpty();
        }
    }

    /* ============================================================
       SINGLE RUN
       ============================================================ */

    public PipelineResult process(PipelineRequest request, DataSource dataSource) {
        long start = System.nanoTime();
        try {
            return runOnce(request, dataSource, this.config, start);
        } catch (RuntimeException e) {
            log.error("Pipeline failed unexpectedly", e);
            return PipelineResult.failed(PipelineErrorType.CHAIN_ERROR, "Pipeline failed: " + e.getMessage(),
                    elapsedMs(start), request.userQuery(), request.sessionId());
        }
    }

    /* ============================================================
       RETRY WRAPPER
       ============================================================ */

    /**
     * Re-runs the whole pipeline up to {@code maxRetries + 1} times when retry
     * is enabled. Validation and execution failures are never retried.
     * Reported time covers every attempt.
     */
    public PipelineResult processWithRetry(PipelineRequest request, DataSource dataSource) {
        ChainConfig cfg = this.config;
        if (!cfg.enableRetry()) {
            return process(request, dataSource);
        }

        long start = System.nanoTime();
        int attempts = cfg.maxRetries() + 1;
        PipelineResult last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                PipelineResult result = runOnce(request, dataSource, cfg, start);
                if (result.success()) {
                    if (attempt > 1) log.info("Pipeline succeeded on attempt {}/{}", attempt, attempts);
                    return result;
                }
                last = result;
                PipelineErrorType type = result.errorType();
                if (type != null && !type.isRetryable()) {
                    log.warn("Attempt {}/{} failed with {}, not retrying: {}", attempt, attempts, type.tag(), result.error());
                    return result;
                }
                log.warn("Attempt {}/{} failed with {}: {}", attempt, attempts, result.responseType(), result.error());
            } catch (RuntimeException e) {
                log.error("Attempt {}/{} threw", attempt, attempts, e);
                if (attempt == attempts) {
                    return PipelineResult.failed(PipelineErrorType.RETRY_EXHAUSTED,
                            "All " + attempts + " attempts failed. Last error: " + e.getMessage(),
                            elapsedMs(start), request.userQuery(), request.sessionId());
                }
            }
        }

        if (last != null) return last;
        return PipelineResult.failed(PipelineErrorType.UNKNOWN_ERROR, "Pipeline produced no result",
                elapsedMs(start), request.userQuery(), request.sessionId());
    }

    /* ============================================================
       STATE MACHINE
       ============================================================ */

    private PipelineResult runOnce(PipelineRequest request, DataSource dataSource, ChainConfig cfg, long start) {
        String userQuery = request.userQuery();
        String sessionId = request.sessionId();

        SqlGenerationResult generation = null;
        ValidationOutcome validation = null;
        SqlExecutionResult execution = null;
        DataSummaryResult summary = null;
        PipelineResult result = null;

        PipelineState state = PipelineState.GENERATING;
        while (!state.isTerminal()) {
            log.debug("Pipeline state: {}", state);
            switch (state) {
                case GENERATING -> {
                    generation = generationService.generate(request.prompt());
                    if (generation.success()) {
                        state = PipelineState.VALIDATING;
                    } else {
                        result = PipelineResult.failed(PipelineErrorType.SQL_GENERATION_ERROR, generation.error(),
                                generation, null, null, null, elapsedMs(start), userQuery, sessionId);
                        state = PipelineState.FAILED;
                    }
                }
                case VALIDATING -> {
                    validation = validationService.validate(generation.sqlQuery(), request.actorId());
                    if (validation.valid()) {
                        state = PipelineState.EXECUTING;
                    } else {
                        result = PipelineResult.failed(PipelineErrorType.SQL_VALIDATION_ERROR, validation.error(),
                                generation, validation, null, null, elapsedMs(start), userQuery, sessionId);
                        state = PipelineState.FAILED;
                    }
                }
                case EXECUTING -> {
                    execution = executionService.execute(generation.sqlQuery(), dataSource);
                    if (execution.success()) {
                        state = PipelineState.SUMMARIZING;
                    } else {
                        result = PipelineResult.failed(PipelineErrorType.SQL_EXECUTION_ERROR, execution.error(),
                                generation, validation, execution, null, elapsedMs(start), userQuery, sessionId);
                        state = PipelineState.FAILED;
                    }
                }
                case SUMMARIZING -> {
                    summary = summarizationService.summarize(execution, userQuery, generation.sqlQuery());
                    if (summary.success()) {
                        result = PipelineResult.completed(PipelineResult.RESPONSE_SUMMARY, summary,
                                generation, validation, execution, summary, elapsedMs(start), userQuery, sessionId);
                        state = PipelineState.DONE;
                    } else if (cfg.enableFallback()) {
                        log.warn("Summarization failed, answering with fallback data: {}", summary.error());
                        DataSummaryResult fallback = summarizationService.buildFallbackResult(execution);
                        result = PipelineResult.completed(PipelineResult.RESPONSE_DATA, fallback,
                                generation, validation, execution, summary, elapsedMs(start), userQuery, sessionId);
                        state = PipelineState.DONE;
                    } else {
                        result = PipelineResult.failed(PipelineErrorType.DATA_SUMMARIZATION_ERROR, summary.error(),
                                generation, validation, execution, summary, elapsedMs(start), userQuery, sessionId);
                        state = PipelineState.FAILED;
                    }
                }
                default -> throw new IllegalStateException("Unexpected pipeline state " + state);
            }
        }

        log.info("Pipeline ended in {} ({}) after {} ms", state, result.responseType(), Math.round(elapsedMs(start)));
        return result;
    }

    /* ============================================================
       HEALTH / STATS / CONFIG
       ============================================================ */

    public HealthReport health(DataSource dataSource) {
        Map<String, Boolean> services = new LinkedHashMap<>();
        services.put("sql_generator", generationService.isConfigured());
        services.put("sql_validator", validationService.selfTest());
        services.put("sql_executor", executionService.ping(dataSource));
        services.put("data_summarizer", summarizationService.isConfigured());

        List<String> unhealthy = new ArrayList<>();
        services.forEach((name, ok) -> {
            if (!ok) unhealthy.add(name);
        });
        String status = unhealthy.isEmpty() ? "healthy" : "degraded";
        if (!unhealthy.isEmpty()) {
            log.warn("Pipeline health degraded: {}", unhealthy);
        }
        return new HealthReport(status, services, List.copyOf(unhealthy), Instant.now());
    }

    public Map<String, Object> stats() {
        ChainConfig cfg = this.config;
        Map<String, Object> chain = new LinkedHashMap<>();
        chain.put("enable_fallback", cfg.enableFallback());
        chain.put("enable_retry", cfg.enableRetry());
        chain.put("max_retries", cfg.maxRetries());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("chain_type", "sequential");
        out.put("chain_config", chain);
        out.put("validation", Map.of(
                "allowed_tables", validationService.getConfig().allowedTables(),
                "max_query_length", validationService.getConfig().maxQueryLength()));
        out.put("execution", Map.of(
                "max_rows", executionService.getConfig().maxRows(),
                "timeout_seconds", executionService.getConfig().timeoutSeconds()));
        out.put("llm_configured", summarizationService.isConfigured());
        return out;
    }

    public ChainConfig getConfig() {
        return config;
    }

    public void updateConfig(ChainConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig);
        log.info("Chain config updated: fallback={}, retry={}, maxRetries={}",
                newConfig.enableFallback(), newConfig.enableRetry(), newConfig.maxRetries());
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
