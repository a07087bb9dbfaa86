package com.quill.model;

import java.util.List;

/**
 * A loaded table with its size.
 */
public record TableSummary(String name, long rowCount, List<ColumnInfo> columns) {

    public TableSummary {
        columns = List.copyOf(columns);
    }
}
