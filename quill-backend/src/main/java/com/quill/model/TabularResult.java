package com.quill.model;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by the engine. Values are JSON-safe (numbers, booleans, strings, lists).
 *
 * @param columns result columns in select order
 * @param rows rows keyed by column label, in column order
 * @param truncated true if rows were cut at the configured result limit
 */
public record TabularResult(List<ColumnInfo> columns, List<Map<String, Object>> rows, boolean truncated) {

    public TabularResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public TabularResult head(int n) {
        if (rows.size() <= n) {
            return this;
        }
        return new TabularResult(columns, rows.subList(0, n), true);
    }
}
