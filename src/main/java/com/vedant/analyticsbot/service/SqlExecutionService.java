package com.vedant.analyticsbot.service;

import com.vedant.analyticsbot.config.ExecutionConfig;
import com.vedant.analyticsbot.dto.SqlExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSetMetaData;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Execution stage: runs an already validated statement against the caller's
 * DataSource with a row cap and a statement timeout.
 */
@Service
public class SqlExecutionService {

    private static final Logger log = LoggerFactory.getLogger(SqlExecutionService.class);

    private volatile ExecutionConfig config;

    public SqlExecutionService(ExecutionConfig config) {
        this.config = config;
    }

    private record RowSet(List<String> columns, Map<String, String> types, List<Map<String, Object>> rows, boolean truncated) {}

    public SqlExecutionResult execute(String sql, DataSource dataSource) {
        ExecutionConfig cfg = this.config;
        long start = System.nanoTime();
        try {
            JdbcTemplate jdbc = new JdbcTemplate(dataSource);
            jdbc.setQueryTimeout(cfg.timeoutSeconds());
            // one extra row tells us the cap was hit
            jdbc.setMaxRows(cfg.maxRows() + 1);

            RowSet rs = jdbc.query(sql, extractor(cfg.maxRows()));
            double ms = elapsedMs(start);

            if (rs.truncated()) {
                log.warn("Result truncated to {} rows", cfg.maxRows());
            }
            log.info("=== QUERY EXECUTED === {} rows returned in {} ms", rs.rows().size(), Math.round(ms));

            return new SqlExecutionResult(true, rs.rows(), rs.columns(), rs.types(),
                    rs.rows().size(), rs.truncated(), ms, sql, null);

        } catch (QueryTimeoutException e) {
            log.error("Query timed out after {}s", cfg.timeoutSeconds(), e);
            return SqlExecutionResult.failed(sql, "Query timed out after " + cfg.timeoutSeconds() + " seconds", elapsedMs(start));
        } catch (DataAccessException e) {
            log.error("Query execution failed", e);
            return SqlExecutionResult.failed(sql, "Query execution failed: " + e.getMostSpecificCause().getMessage(), elapsedMs(start));
        }
    }

    /** Runs {@code SELECT 1}; false when the database cannot be reached. */
    public boolean ping(DataSource dataSource) {
        try {
            Integer one = new JdbcTemplate(dataSource).queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Database ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static ResultSetExtractor<RowSet> extractor(int maxRows) {
        return resultSet -> {
            ResultSetMetaData meta = resultSet.getMetaData();
            int count = meta.getColumnCount();
            List<String> columns = new ArrayList<>(count);
            Map<String, String> types = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                String name = meta.getColumnLabel(i);
                columns.add(name);
                types.put(name, meta.getColumnTypeName(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            boolean truncated = false;
            while (resultSet.next()) {
                if (rows.size() >= maxRows) {
                    truncated = true;
                    break;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= count; i++) {
                    row.put(columns.get(i - 1), toJsonSafe(resultSet.getObject(i)));
                }
                rows.add(row);
            }
            return new RowSet(columns, types, rows, truncated);
        };
    }

    static Object toJsonSafe(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) return value;
        if (value instanceof BigDecimal) return ((BigDecimal) value).doubleValue();
        if (value instanceof BigInteger) return ((BigInteger) value).longValue();
        if (value instanceof Number) return value;
        if (value instanceof java.sql.Timestamp) return ((java.sql.Timestamp) value).toLocalDateTime().toString();
        if (value instanceof java.sql.Date) return ((java.sql.Date) value).toLocalDate().toString();
        if (value instanceof java.sql.Time) return ((java.sql.Time) value).toLocalTime().toString();
        if (value instanceof TemporalAccessor) return value.toString();
        if (value instanceof byte[]) return new String((byte[]) value, StandardCharsets.UTF_8);
        return value.toString();
    }

    public ExecutionConfig getConfig() {
        return config;
    }

    public void updateConfig(ExecutionConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig);
        log.info("Execution config updated: maxRows={}, timeout={}s", newConfig.maxRows(), newConfig.timeoutSeconds());
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
