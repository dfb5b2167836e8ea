package com.vedant.analyticsbot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.analyticsbot.dto.DataSummaryResult;
import com.vedant.analyticsbot.dto.SqlExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Summarization stage: turns an execution result into a short HTML answer,
 * a markdown table and a handful of derived insights.
 */
@Service
public class DataSummarizationService {

    private static final Logger log = LoggerFactory.getLogger(DataSummarizationService.class);

    static final int MAX_SUMMARY_WORDS = 60;
    static final int MAX_TABLE_ROWS = 50;
    static final int MAX_INSIGHTS = 10;
    private static final int SAMPLE_ROWS = 50;

    static final String SYSTEM_PROMPT =
            "You are an expert data analyst specializing in payment analytics. " +
                    "You turn SQL query results into clear, business-friendly insights. " +
                    "Use ONLY the data provided. Do NOT invent rows, columns or values. Do NOT ask the user questions.";

    private static final Set<String> ALLOWED_TAGS = Set.of("p", "strong", "em", "span");
    private static final Set<String> NUMERIC_EXCLUDED = Set.of("id", "count");
    private static final Set<String> CATEGORICAL_EXCLUDED = Set.of("id", "description", "notes");
    private static final List<String> INSIGHT_VERBS = List.of("shows", "indicates", "reveals", "suggests");

    private static final Pattern TAG = Pattern.compile("<(/?)([a-zA-Z][a-zA-Z0-9]*)\\b[^>]*>");
    private static final Pattern HTML_FENCE = Pattern.compile("^```(?:html)?\\s*|\\s*```\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("\\S+\\s*");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n");

    private final LLMService llmService;
    private final ObjectMapper mapper = new ObjectMapper();

    public DataSummarizationService(LLMService llmService) {
        this.llmService = llmService;
    }

    public boolean isConfigured() {
        return llmService.isConfigured();
    }

    public DataSummaryResult summarize(SqlExecutionResult execution, String userQuery, String sqlQuery) {
        long start = System.nanoTime();
        if (execution == null) {
            return DataSummaryResult.failed("No execution result to summarize", elapsedMs(start));
        }
        if (!execution.success()) {
            return DataSummaryResult.failed("Cannot summarize failed execution: " + execution.error(), elapsedMs(start));
        }

        String userPrompt = buildPrompt(execution, userQuery, sqlQuery);
        log.debug("=== SUMMARY PROMPT TO LLM ===\n{}", userPrompt);

        try {
            var cfg = llmService.getConfig();
            LLMService.LlmCompletion completion =
                    llmService.complete(SYSTEM_PROMPT, userPrompt, cfg.summaryTemperature(), cfg.maxTokens());

            String html = limitWords(sanitizeHtml(completion.text()), MAX_SUMMARY_WORDS);
            if (html.isBlank()) {
                return new DataSummaryResult(false, null, null, null, List.of(),
                        "Data summarization failed: LLM returned an empty summary",
                        execution.rowCount(), elapsedMs(start), 0, 0);
            }

            String plain = stripTags(html);
            int promptTokens = completion.usageReported() ? completion.promptTokens() : SqlGenerationService.estimateTokens(SYSTEM_PROMPT + userPrompt);
            int completionTokens = completion.usageReported() ? completion.completionTokens() : SqlGenerationService.estimateTokens(completion.text());

            double ms = elapsedMs(start);
            log.info("Summary generated in {} ms for {} rows", Math.round(ms), execution.rowCount());
            return new DataSummaryResult(true, plain, html, toMarkdownTable(execution.rows()),
                    extractInsights(plain, execution.rows()), null,
                    execution.rowCount(), ms, promptTokens, completionTokens);

        } catch (LlmException e) {
            log.error("Data summarization failed", e);
            return new DataSummaryResult(false, null, null, null, List.of(),
                    "Data summarization failed: " + e.getMessage(),
                    execution.rowCount(), elapsedMs(start), 0, 0);
        }
    }

    /* ============================================================
       PROMPT
       ============================================================ */

    String buildPrompt(SqlExecutionResult execution, String userQuery, String sqlQuery) {
        String sql = sqlQuery != null ? sqlQuery : execution.queryExecuted();
        return "Original User Query: " + (userQuery == null || userQuery.isBlank() ? "Data analysis query" : userQuery) + "\n\n" +
                "SQL Query Executed: " + (sql == null ? "SQL query" : sql) + "\n\n" +
                "Query Results:\n" + prepareDataSample(execution.rows()) + "\n\n" +
                "Data Details:\n" +
                "- Total Rows: " + execution.rowCount() + "\n" +
                "- Columns: " + String.join(", ", execution.columns()) + "\n" +
                "- Execution Time: " + Math.round(execution.executionTimeMs()) + "ms\n\n" +
                "INSTRUCTIONS:\n" +
                "1. Summarize the data in " + MAX_SUMMARY_WORDS + " words or less (2-3 sentences maximum).\n" +
                "2. Format the answer as HTML using only <p>, <strong>, <em>, <span>.\n" +
                "3. Highlight key figures with <strong>.\n" +
                "4. Use business-friendly language and specific numbers.\n\n" +
                "HTML Summary:";
    }

    // Every row when small; otherwise the first 5 and last 3 rows of a 50-row sample.
    String prepareDataSample(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) return "No data returned from query";
        List<Map<String, Object>> sample = rows.subList(0, Math.min(rows.size(), SAMPLE_ROWS));
        List<String> parts = new ArrayList<>();
        if (sample.size() <= 10) {
            parts.add("Complete Dataset:");
            for (int i = 0; i < sample.size(); i++) {
                parts.add("Row " + (i + 1) + ": " + toJson(sample.get(i)));
            }
            return String.join("\n", parts);
        }

        parts.add("Sample Data (First 5 rows):");
        for (int i = 0; i < 5; i++) {
            parts.add("Row " + (i + 1) + ": " + toJson(sample.get(i)));
        }
        if (rows.size() > SAMPLE_ROWS) {
            parts.add("\n... (" + (rows.size() - SAMPLE_ROWS) + " more rows not shown)");
        }
        parts.add("\nLast 3 rows from sample:");
        for (int i = sample.size() - 3; i < sample.size(); i++) {
            parts.add("Row " + (i + 1) + ": " + toJson(sample.get(i)));
        }
        return String.join("\n", parts);
    }

    private String toJson(Map<String, Object> row) {
        try {
            return mapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            log.debug("Row not serializable as JSON, using toString: {}", e.getOriginalMessage());
            return String.valueOf(row);
        }
    }

    /* ============================================================
       HTML
       ============================================================ */

    /** Keeps p/strong/em/span (attributes dropped) and removes every other tag. */
    static String sanitizeHtml(String raw) {
        if (raw == null) return "";
        String html = HTML_FENCE.matcher(raw.trim()).replaceAll("").trim();
        Matcher m = TAG.matcher(html);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(2).toLowerCase(Locale.ROOT);
            String replacement = ALLOWED_TAGS.contains(name) ? "<" + m.group(1) + name + ">" : "";
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString().trim();
    }

    /**
     * Cuts the text content after {@code maxWords} words, closing any tag
     * still open at the cut.
     */
    static String limitWords(String html, int maxWords) {
        if (stripTags(html).split("\\s+").length <= maxWords) return html;

        StringBuilder out = new StringBuilder();
        Deque<String> open = new ArrayDeque<>();
        int words = 0;
        int pos = 0;
        Matcher m = TAG.matcher(html);
        while (pos < html.length() && words < maxWords) {
            boolean tagAhead = m.find(pos);
            int textEnd = tagAhead ? m.start() : html.length();

            String text = html.substring(pos, textEnd);
            Matcher w = WORD.matcher(text);
            while (w.find()) {
                out.append(w.group());
                if (++words >= maxWords) break;
            }
            if (words >= maxWords || !tagAhead) break;

            String name = m.group(2).toLowerCase(Locale.ROOT);
            if (m.group(1).isEmpty()) {
                open.push(name);
            } else if (!open.isEmpty() && open.peek().equals(name)) {
                open.pop();
            }
            out.append(m.group());
            pos = m.end();
        }

        String cut = out.toString().stripTrailing() + "...";
        StringBuilder closed = new StringBuilder(cut);
        while (!open.isEmpty()) {
            closed.append("</").append(open.pop()).append(">");
        }
        return closed.toString();
    }

    static String stripTags(String html) {
        if (html == null) return "";
        return TAG.matcher(html).replaceAll(" ").replaceAll("[ \\t]+", " ").trim();
    }

    /* ============================================================
       MARKDOWN TABLE
       ============================================================ */

    public String toMarkdownTable(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) return "No data available";

        List<Map<String, Object>> limited = rows.subList(0, Math.min(rows.size(), MAX_TABLE_ROWS));
        List<String> headers = new ArrayList<>(limited.get(0).keySet());

        List<String> lines = new ArrayList<>();
        lines.add("| " + String.join(" | ", headers) + " |");
        lines.add("|" + String.join("|", Collections.nCopies(headers.size(), " --- ")) + "|");
        for (Map<String, Object> row : limited) {
            List<String> cells = new ArrayList<>(headers.size());
            for (String h : headers) {
                cells.add(formatCell(row.get(h)));
            }
            lines.add("| " + String.join(" | ", cells) + " |");
        }
        if (rows.size() > MAX_TABLE_ROWS) {
            lines.add("\n*Showing " + MAX_TABLE_ROWS + " of " + rows.size() + " total rows*");
        }
        return String.join("\n", lines);
    }

    private static String formatCell(Object value) {
        if (value == null) return "null";
        if (value instanceof String) {
            return ((String) value).replace("|", "\\|").replace("\n", " ");
        }
        return String.valueOf(value);
    }

    /* ============================================================
       INSIGHTS
       ============================================================ */

    List<String> extractInsights(String summaryText, List<Map<String, Object>> rows) {
        List<String> insights = new ArrayList<>();
        if (rows != null && !rows.isEmpty()) {
            insights.add("Dataset contains " + rows.size() + " records");
            insights.addAll(numericInsights(rows));
            insights.addAll(categoricalInsights(rows));
        }
        insights.addAll(textInsights(summaryText));
        return insights.size() > MAX_INSIGHTS ? new ArrayList<>(insights.subList(0, MAX_INSIGHTS)) : insights;
    }

    private static List<String> numericInsights(List<Map<String, Object>> rows) {
        List<String> out = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        for (Map.Entry<String, Object> e : rows.get(0).entrySet()) {
            if (e.getValue() instanceof Number && !NUMERIC_EXCLUDED.contains(e.getKey().toLowerCase(Locale.ROOT))) {
                columns.add(e.getKey());
            }
        }
        for (String col : columns.subList(0, Math.min(3, columns.size()))) {
            DoubleSummaryStatistics stats = new DoubleSummaryStatistics();
            for (Map<String, Object> row : rows) {
                Object v = row.get(col);
                if (v instanceof Number) stats.accept(((Number) v).doubleValue());
            }
            if (stats.getCount() > 0) {
                out.add(col + ": avg=" + String.format(Locale.ROOT, "%.2f", stats.getAverage())
                        + ", range=" + formatNumber(stats.getMin()) + "-" + formatNumber(stats.getMax()));
            }
        }
        return out;
    }

    private static List<String> categoricalInsights(List<Map<String, Object>> rows) {
        List<String> out = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        for (Map.Entry<String, Object> e : rows.get(0).entrySet()) {
            if (e.getValue() instanceof String && !CATEGORICAL_EXCLUDED.contains(e.getKey().toLowerCase(Locale.ROOT))) {
                columns.add(e.getKey());
            }
        }
        for (String col : columns.subList(0, Math.min(2, columns.size()))) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (Map<String, Object> row : rows) {
                Object v = row.get(col);
                if (v instanceof String && !((String) v).isEmpty()) {
                    counts.merge((String) v, 1, Integer::sum);
                }
            }
            if (counts.isEmpty()) continue;
            String mostCommon = null;
            int best = 0;
            for (Map.Entry<String, Integer> e : counts.entrySet()) {
                if (e.getValue() > best) {
                    best = e.getValue();
                    mostCommon = e.getKey();
                }
            }
            out.add(col + ": " + counts.size() + " unique values, most common: " + mostCommon);
        }
        return out;
    }

    private static List<String> textInsights(String summaryText) {
        List<String> out = new ArrayList<>();
        if (summaryText == null) return out;
        for (String sentence : SENTENCE_BREAK.split(summaryText)) {
            String s = sentence.strip();
            String lower = s.toLowerCase(Locale.ROOT);
            if (s.length() < 150 && INSIGHT_VERBS.stream().anyMatch(lower::contains)) {
                out.add(s);
                if (out.size() == 5) break;
            }
        }
        return out;
    }

    private static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return String.valueOf((long) d);
        }
        return String.valueOf(d);
    }

    /* ============================================================
       FALLBACK (no LLM)
       ============================================================ */

    public String createFallbackSummary(SqlExecutionResult execution) {
        if (execution == null || !execution.success()) {
            return "Query execution failed - no data to summarize";
        }
        List<String> parts = new ArrayList<>();
        parts.add("Query Results Summary:");
        parts.add("• Total rows returned: " + execution.rowCount());
        parts.add("• Execution time: " + String.format(Locale.ROOT, "%.2f", execution.executionTimeMs()) + "ms");
        if (!execution.columns().isEmpty()) {
            parts.add("• Columns: " + String.join(", ", execution.columns()));
        }
        if (!execution.rows().isEmpty()) {
            parts.add("• Sample data available for " + execution.rows().size() + " records");
        }
        return String.join("\n", parts);
    }

    /** Deterministic stand-in for a failed LLM summary, built from the rows alone. */
    public DataSummaryResult buildFallbackResult(SqlExecutionResult execution) {
        long start = System.nanoTime();
        String text = createFallbackSummary(execution);
        String html = "<p><strong>Fallback Summary:</strong> "
                + text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;") + "</p>";
        int rowCount = execution == null ? 0 : execution.rowCount();
        return new DataSummaryResult(true, text, html,
                toMarkdownTable(execution == null ? List.of() : execution.rows()),
                List.of("LLM summarization failed", "Retrieved " + rowCount + " records"),
                null, rowCount, elapsedMs(start), 0, 0);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
