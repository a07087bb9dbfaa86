package com.quill.model;

/**
 * Scored association between a question keyword and a schema column.
 *
 * @param keyword keyword extracted from the question
 * @param table table name
 * @param column column name
 * @param score similarity in [0, 100]
 */
public record ColumnMatch(String keyword, String table, String column, double score) {

    public String qualifiedName() {
        return table + "." + column;
    }
}
