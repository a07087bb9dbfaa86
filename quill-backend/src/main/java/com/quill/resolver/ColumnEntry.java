package com.quill.resolver;

/**
 * A schema column flattened for scoring.
 */
public record ColumnEntry(String table, String column, String type) {

    public String key() {
        return table + "." + column;
    }
}
