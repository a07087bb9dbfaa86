package com.quill.model;

import java.util.List;

/**
 * Ordered column list of a single table.
 */
public record TableSchema(String name, List<ColumnInfo> columns) {

    public TableSchema {
        columns = List.copyOf(columns);
    }
}
