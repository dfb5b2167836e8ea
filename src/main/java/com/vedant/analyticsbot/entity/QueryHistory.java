package com.vedant.analyticsbot.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "query_history")
public class QueryHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="session_id")
    private String sessionId;

    @Column(name="nl_query", columnDefinition = "text", nullable = false)
    private String nlQuery;

    // null when generation itself failed
    @Column(name="generated_sql", columnDefinition = "text")
    private String generatedSql;

    @Column(name="response_type", nullable = false)
    private String responseType;

    @Column(name="success", nullable = false)
    private boolean success;

    @Column(name="error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name="row_count")
    private Integer rowCount;

    @Column(name="total_time_ms")
    private Double totalTimeMs;

    // HTML answer shown to the user
    @Column(name="result_preview", columnDefinition = "text")
    private String resultPreview;

    @Column(name="executed_at", nullable = false)
    private Instant executedAt = Instant.now();

    public QueryHistory() {}

    // Getters / setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getNlQuery() { return nlQuery; }
    public void setNlQuery(String nlQuery) { this.nlQuery = nlQuery; }

    public String getGeneratedSql() { return generatedSql; }
    public void setGeneratedSql(String generatedSql) { this.generatedSql = generatedSql; }

    public String getResponseType() { return responseType; }
    public void setResponseType(String responseType) { this.responseType = responseType; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Integer getRowCount() { return rowCount; }
    public void setRowCount(Integer rowCount) { this.rowCount = rowCount; }

    public Double getTotalTimeMs() { return totalTimeMs; }
    public void setTotalTimeMs(Double totalTimeMs) { this.totalTimeMs = totalTimeMs; }

    public String getResultPreview() { return resultPreview; }
    public void setResultPreview(String resultPreview) { this.resultPreview = resultPreview; }

    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }
}
