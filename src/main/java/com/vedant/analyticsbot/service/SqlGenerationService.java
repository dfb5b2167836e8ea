package com.vedant.analyticsbot.service;

import com.vedant.analyticsbot.dto.QueryType;
import com.vedant.analyticsbot.dto.SqlGenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generation stage: assembled prompt in, one cleaned SELECT statement out.
 */
@Service
public class SqlGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SqlGenerationService.class);

    static final String SYSTEM_PROMPT =
            "You are an expert PostgreSQL SQL generator for payment analytics.\n" +
                    "You must generate EXACTLY ONE SQL SELECT query.\n" +
                    "\n" +
                    "STRICT RULES:\n" +
                    "1. Only SELECT (optionally with a leading WITH). No INSERT/UPDATE/DELETE/ALTER/DROP.\n" +
                    "2. Use ONLY the tables and columns listed in the tool context (never hallucinate).\n" +
                    "3. Never use UNION, INTERSECT or EXCEPT. Use CTEs, subqueries or CASE instead.\n" +
                    "4. Never write more than one statement.\n" +
                    "\n" +
                    "RANKING & AGGREGATION:\n" +
                    "   • most, highest, top, largest → ORDER BY DESC LIMIT N\n" +
                    "   • least, lowest, smallest → ORDER BY ASC LIMIT N\n" +
                    "   • average → AVG(column), total → SUM(column), how many → COUNT(*)\n" +
                    "   • per status/connector/currency → GROUP BY that column\n" +
                    "\n" +
                    "OUTPUT FORMAT:\n" +
                    "   - Return ONLY the SQL string. No markdown. No ``` fences. No explanations.";

    private static final Pattern FENCE_OPEN = Pattern.compile("^```(?:sql)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCE_CLOSE = Pattern.compile("\\s*```\\s*$");
    private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[;\\s]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final LLMService llmService;

    public SqlGenerationService(LLMService llmService) {
        this.llmService = llmService;
    }

    public boolean isConfigured() {
        return llmService.isConfigured();
    }

    public SqlGenerationResult generate(String assembledPrompt) {
        long start = System.nanoTime();
        try {
            String userPrompt = assembledPrompt
                    + "\n\nWrite the PostgreSQL query that answers the user query above. Return only the SQL.";
            var cfg = llmService.getConfig();
            LLMService.LlmCompletion completion =
                    llmService.complete(SYSTEM_PROMPT, userPrompt, cfg.sqlGenerationTemperature(), cfg.maxTokens());

            String sql = cleanSql(completion.text());
            if (sql.isEmpty()) {
                return SqlGenerationResult.failed("LLM returned empty SQL query", elapsedMs(start));
            }

            int promptTokens = completion.usageReported() ? completion.promptTokens() : estimateTokens(SYSTEM_PROMPT + userPrompt);
            int completionTokens = completion.usageReported() ? completion.completionTokens() : estimateTokens(completion.text());
            QueryType type = detectQueryType(sql);

            log.info("=== SQL GENERATED ({}) ===\n{}", type.tag(), sql);
            return SqlGenerationResult.ok(sql, type, elapsedMs(start), promptTokens, completionTokens);
        } catch (LlmException e) {
            log.error("SQL generation failed", e);
            return SqlGenerationResult.failed("SQL generation failed: " + e.getMessage(), elapsedMs(start));
        }
    }

    /** Strips markdown fences and trailing semicolons, and collapses whitespace. */
    static String cleanSql(String raw) {
        if (raw == null) return "";
        String sql = raw.replace("\uFEFF", "").trim();
        sql = FENCE_OPEN.matcher(sql).replaceFirst("");
        sql = FENCE_CLOSE.matcher(sql).replaceFirst("");
        sql = TRAILING_SEMICOLONS.matcher(sql.trim()).replaceFirst("");
        return WHITESPACE.matcher(sql).replaceAll(" ").trim();
    }

    static QueryType detectQueryType(String sql) {
        String s = sql.toLowerCase(Locale.ROOT);
        if (s.contains("count(") || s.contains("sum(") || s.contains("avg(")) {
            return QueryType.ANALYTICS;
        }
        if (s.contains("group by") || s.contains("order by")) {
            return QueryType.REPORTING;
        }
        if (s.contains("limit") && s.contains("desc")) {
            return QueryType.SUMMARY;
        }
        return QueryType.UNKNOWN;
    }

    // rough: ~4 characters per token
    static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / 4;
    }

    static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
