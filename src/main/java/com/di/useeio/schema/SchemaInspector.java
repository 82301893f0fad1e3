package com.di.useeio.schema;

import com.di.useeio.sql.SqlQueriesProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the installed schema back from the PostgreSQL catalog.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaInspector {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public boolean tableExists(String table) {
        Boolean exists = jdbc.queryForObject(sql.getSchema().getTableExists(), Boolean.class, table);
        return Boolean.TRUE.equals(exists);
    }

    public boolean functionExists(String function) {
        Boolean exists = jdbc.queryForObject(sql.getSchema().getFunctionExists(), Boolean.class, function);
        return Boolean.TRUE.equals(exists);
    }

    /** Primary-key columns in key order; empty when the table or key is missing. */
    public List<String> primaryKeyColumns(String table) {
        return jdbc.queryForList(sql.getSchema().getPrimaryKeyColumns(), String.class, table);
    }

    public int triggerCount(String table, String triggerName) {
        Integer count = jdbc.queryForObject(sql.getSchema().getTriggerCount(), Integer.class, table, triggerName);
        return count != null ? count : 0;
    }

    public Optional<String> tableComment(String table) {
        return Optional.ofNullable(jdbc.queryForObject(sql.getSchema().getTableComment(), String.class, table));
    }

    public Optional<String> columnComment(String table, String column) {
        List<String> rows = jdbc.queryForList(sql.getSchema().getColumnComment(), String.class, table, column);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public SchemaStatus inspect() {
        Map<String, Boolean> tables = new LinkedHashMap<>();
        Map<String, List<String>> keys = new LinkedHashMap<>();
        for (String table : StoreTables.ALL) {
            boolean exists = tableExists(table);
            tables.put(table, exists);
            keys.put(table, exists ? primaryKeyColumns(table) : List.of());
        }
        int triggers = tables.get(StoreTables.MODEL_METADATA)
                ? triggerCount(StoreTables.MODEL_METADATA, StoreTables.UPDATED_AT_TRIGGER)
                : 0;
        SchemaStatus status = new SchemaStatus(tables, keys, triggers,
                functionExists(StoreTables.UPDATED_AT_FUNCTION));
        log.debug("[SCHEMA] {}", status);
        return status;
    }
}
