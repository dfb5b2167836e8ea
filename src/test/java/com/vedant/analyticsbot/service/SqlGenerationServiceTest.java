package com.vedant.analyticsbot.service;

import com.vedant.analyticsbot.config.LlmConfig;
import com.vedant.analyticsbot.dto.QueryType;
import com.vedant.analyticsbot.dto.SqlGenerationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SqlGenerationServiceTest {

    private LLMService llm;
    private SqlGenerationService service;

    @BeforeEach
    void setUp() {
        llm = mock(LLMService.class);
        when(llm.getConfig()).thenReturn(new LlmConfig("http://llm", "key", "m", 0.1, 500, 30, 0.1, 0.3));
        service = new SqlGenerationService(llm);
    }

    @Test
    void cleansFencesAndReportsUsage() throws Exception {
        when(llm.complete(anyString(), anyString(), eq(0.1), eq(500)))
                .thenReturn(new LLMService.LlmCompletion("```sql\nSELECT COUNT(*)\n  FROM payment_intent;\n```", 120, 30, true));

        SqlGenerationResult r = service.generate("[USER CONTEXT]\nUser Query: how many payments?");

        assertTrue(r.success());
        assertEquals("SELECT COUNT(*) FROM payment_intent", r.sqlQuery());
        assertEquals(QueryType.ANALYTICS, r.queryType());
        assertEquals(120, r.promptTokens());
        assertEquals(30, r.completionTokens());
    }

    @Test
    void estimatesTokensWhenUsageMissing() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(new LLMService.LlmCompletion("SELECT id FROM customers", 0, 0, false));

        SqlGenerationResult r = service.generate("prompt");

        assertTrue(r.success());
        assertEquals("SELECT id FROM customers".length() / 4, r.completionTokens());
        assertTrue(r.promptTokens() > 0);
    }

    @Test
    void emptyOutputIsAFailure() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt()))
                .thenReturn(new LLMService.LlmCompletion("```sql\n;\n```", 10, 1, true));

        SqlGenerationResult r = service.generate("prompt");

        assertFalse(r.success());
        assertEquals("LLM returned empty SQL query", r.error());
    }

    @Test
    void llmErrorBecomesFailedResult() throws Exception {
        when(llm.complete(anyString(), anyString(), anyDouble(), anyInt()))
                .thenThrow(new LlmException("LLM returned status 500"));

        SqlGenerationResult r = service.generate("prompt");

        assertFalse(r.success());
        assertTrue(r.error().contains("status 500"));
        assertNull(r.sqlQuery());
    }

    @Test
    void queryTypeSniffing() {
        assertEquals(QueryType.ANALYTICS, SqlGenerationService.detectQueryType("SELECT SUM(amount) FROM payment_intent"));
        assertEquals(QueryType.REPORTING, SqlGenerationService.detectQueryType("SELECT status FROM payment_intent GROUP BY status"));
        assertEquals(QueryType.SUMMARY, SqlGenerationService.detectQueryType("SELECT amount FROM payment_intent WHERE x = 'desc' LIMIT 5"));
        assertEquals(QueryType.UNKNOWN, SqlGenerationService.detectQueryType("SELECT * FROM customers"));
    }

    @Test
    void cleanSqlStripsTrailingSemicolonsAndWhitespace() {
        assertEquals("SELECT 1", SqlGenerationService.cleanSql("  SELECT\n\t1 ;; \n"));
        assertEquals("", SqlGenerationService.cleanSql(null));
    }
}
