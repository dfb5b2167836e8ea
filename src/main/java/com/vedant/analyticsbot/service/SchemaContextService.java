package com.vedant.analyticsbot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Reads column metadata of the allow-listed tables from
 * {@code information_schema.columns} so the generator only sees real columns.
 */
@Service
public class SchemaContextService {

    private static final Logger log = LoggerFactory.getLogger(SchemaContextService.class);

    static final String COLUMNS_QUERY =
            "SELECT column_name, data_type, is_nullable FROM information_schema.columns " +
                    "WHERE table_schema = current_schema() AND table_name = ? ORDER BY ordinal_position";

    private final JdbcTemplate jdbcTemplate;

    public SchemaContextService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public record ColumnInfo(String name, String dataType, boolean nullable) {}

    /** Columns of one table, or the reason they could not be read. */
    public record TableSchema(String table, List<ColumnInfo> columns, String error) {}

    public List<TableSchema> describeTables(List<String> tables) {
        List<TableSchema> out = new ArrayList<>();
        for (String table : tables) {
            out.add(describeTable(table));
        }
        return out;
    }

    TableSchema describeTable(String table) {
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(COLUMNS_QUERY, table);
            if (rows.isEmpty()) {
                return new TableSchema(table, List.of(), "table not found");
            }
            List<ColumnInfo> columns = new ArrayList<>(rows.size());
            for (Map<String, Object> r : rows) {
                columns.add(new ColumnInfo(
                        String.valueOf(value(r, "column_name")),
                        String.valueOf(value(r, "data_type")),
                        "YES".equalsIgnoreCase(String.valueOf(value(r, "is_nullable")))));
            }
            return new TableSchema(table, columns, null);
        } catch (DataAccessException e) {
            log.warn("Could not read schema of {}: {}", table, e.getMessage());
            return new TableSchema(table, List.of(), e.getMostSpecificCause().getMessage());
        }
    }

    // information_schema column labels come back upper-case on some databases
    private static Object value(Map<String, Object> row, String key) {
        Object v = row.get(key);
        return v != null ? v : row.get(key.toUpperCase(Locale.ROOT));
    }

    public String formatForPrompt(List<TableSchema> schemas) {
        List<String> parts = new ArrayList<>();
        parts.add("## DATABASE SCHEMA INFORMATION");
        parts.add("");
        for (TableSchema s : schemas) {
            String title = "### " + s.table().toUpperCase(Locale.ROOT) + " TABLE";
            if (s.error() != null) {
                parts.add(title + ": Error - " + s.error());
                parts.add("");
                continue;
            }
            parts.add(title + ":");
            parts.add("");
            parts.add("**Columns:**");
            for (ColumnInfo c : s.columns()) {
                parts.add("- " + c.name() + ": " + c.dataType() + (c.nullable() ? " NULL" : " NOT NULL"));
            }
            parts.add("");
        }
        return String.join("\n", parts);
    }
}
