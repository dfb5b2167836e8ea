package com.vedant.analyticsbot.service;

import com.vedant.analyticsbot.dto.PipelineRequest;
import com.vedant.analyticsbot.dto.PipelineResult;
import com.vedant.analyticsbot.entity.QueryHistory;
import com.vedant.analyticsbot.repository.QueryHistoryRepository;
import com.vedant.analyticsbot.util.PromptAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.List;

/**
 * Entry point for one chat question: builds the prompt, runs the pipeline
 * and records the outcome in query history.
 */
@Service
public class AnalyticsChatService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsChatService.class);

    private final SequentialPipelineService pipeline;
    private final SchemaContextService schemaContext;
    private final SqlValidationService validationService;
    private final QueryHistoryRepository historyRepository;
    private final DataSource dataSource;

    public AnalyticsChatService(
            SequentialPipelineService pipeline,
            SchemaContextService schemaContext,
            SqlValidationService validationService,
            QueryHistoryRepository historyRepository,
            DataSource dataSource
    ) {
        this.pipeline = pipeline;
        this.schemaContext = schemaContext;
        this.validationService = validationService;
        this.historyRepository = historyRepository;
        this.dataSource = dataSource;
    }

    /* ============================================================
       MAIN: NL → PROMPT → PIPELINE → HISTORY
       ============================================================ */
    public PipelineResult answer(String nlQuery, String sessionId) {
        if (nlQuery == null || nlQuery.isBlank()) {
            throw new IllegalArgumentException("Query must not be empty");
        }

        List<String> tables = validationService.getConfig().allowedTables();
        String toolContext = schemaContext.formatForPrompt(schemaContext.describeTables(tables));
        String prompt = PromptAssembler.assemble(PromptAssembler.SYSTEM_CONTEXT, toolContext, nlQuery);

        log.debug("=== LLM PROMPT SENT ===\n{}\n========================", prompt);

        PipelineResult result = pipeline.processWithRetry(new PipelineRequest(prompt, nlQuery, sessionId), dataSource);

        log.info("Question answered: type={}, success={}, {} ms",
                result.responseType(), result.success(), Math.round(result.totalProcessingTimeMs()));

        saveHistory(result);
        return result;
    }

    public List<QueryHistory> recentHistory(String sessionId) {
        return historyRepository.findTop20BySessionIdOrderByExecutedAtDesc(sessionId);
    }

    public SequentialPipelineService.HealthReport health() {
        return pipeline.health(dataSource);
    }

    private void saveHistory(PipelineResult result) {
        try {
            QueryHistory h = new QueryHistory();
            h.setSessionId(result.sessionId());
            h.setNlQuery(result.userQuery());
            h.setGeneratedSql(result.sqlGeneration() == null ? null : result.sqlGeneration().sqlQuery());
            h.setResponseType(result.responseType());
            h.setSuccess(result.success());
            h.setErrorMessage(result.error());
            h.setRowCount(result.sqlExecution() == null ? null : result.sqlExecution().rowCount());
            h.setTotalTimeMs(result.totalProcessingTimeMs());
            h.setResultPreview(result.finalResponse() == null ? null : result.finalResponse().htmlSummary());
            historyRepository.save(h);
        } catch (DataAccessException e) {
            log.warn("Failed to save query history: {}", e.getMessage());
        }
    }
}
