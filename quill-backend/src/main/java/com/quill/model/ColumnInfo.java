package com.quill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One column of a table as reported by the engine.
 *
 * @param name column name exactly as stored
 * @param type declared type name
 */
public record ColumnInfo(@JsonProperty("column") String name, String type) {
}
