package com.vedant.analyticsbot.dto;

import java.util.List;
import java.util.Map;

public class NLQueryResponseDTO {
    private boolean success;
    private String responseType;   // summary | data | *_error
    private String message;
    private String sql;
    private List<Map<String, Object>> rows;
    private String nlAnswer;       // HTML
    private String markdownData;
    private List<String> insights;
    private Double processingTimeMs;

    public NLQueryResponseDTO() {}

    public static NLQueryResponseDTO from(PipelineResult result) {
        NLQueryResponseDTO dto = new NLQueryResponseDTO();
        dto.setSuccess(result.success());
        dto.setResponseType(result.responseType());
        dto.setMessage(result.success() ? "OK" : result.error());
        if (result.sqlGeneration() != null) dto.setSql(result.sqlGeneration().sqlQuery());
        if (result.sqlExecution() != null) dto.setRows(result.sqlExecution().rows());
        if (result.finalResponse() != null) {
            dto.setNlAnswer(result.finalResponse().htmlSummary());
            dto.setMarkdownData(result.finalResponse().markdownData());
            dto.setInsights(result.finalResponse().keyInsights());
        }
        dto.setProcessingTimeMs(result.totalProcessingTimeMs());
        return dto;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getResponseType() { return responseType; }
    public void setResponseType(String responseType) { this.responseType = responseType; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public List<Map<String, Object>> getRows() { return rows; }
    public void setRows(List<Map<String, Object>> rows) { this.rows = rows; }

    public String getNlAnswer() { return nlAnswer; }
    public void setNlAnswer(String nlAnswer) { this.nlAnswer = nlAnswer; }

    public String getMarkdownData() { return markdownData; }
    public void setMarkdownData(String markdownData) { this.markdownData = markdownData; }

    public List<String> getInsights() { return insights; }
    public void setInsights(List<String> insights) { this.insights = insights; }

    public Double getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(Double processingTimeMs) { this.processingTimeMs = processingTimeMs; }
}
