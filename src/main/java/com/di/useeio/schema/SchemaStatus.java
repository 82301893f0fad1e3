package com.di.useeio.schema;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Snapshot of what is installed: table presence, primary keys, and the {@code updated_at}
 * trigger with its function.
 */
public record SchemaStatus(Map<String, Boolean> tables,
                           Map<String, List<String>> primaryKeys,
                           int updatedAtTriggerCount,
                           boolean updatedAtFunctionPresent) {

    public boolean isComplete() {
        return tables.values().stream().allMatch(Boolean::booleanValue)
                && updatedAtTriggerCount == 1
                && updatedAtFunctionPresent;
    }

    public List<String> missingTables() {
        return tables.entrySet().stream()
                .filter(e -> !e.getValue())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
