package com.quill.engine;

import com.quill.model.Schema;
import com.quill.model.TabularResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Owner of the live dataset. Executes read-only SQL and publishes immutable schema snapshots.
 *
 * <p>Schema-altering operations ({@link #loadCsv}, {@link #dropTable}) are serialized; each one
 * ends by swapping in a new {@link Schema}, so {@link #getSchema()} never returns a partially
 * updated structure.
 */
public interface QueryEngine {

    /**
     * Execute a query.
     *
     * @param sql statement text; only read-only statements are accepted
     * @return rows, cut at the configured result limit
     * @throws SqlExecutionException if the statement is rejected or fails
     */
    TabularResult execute(String sql) throws SqlExecutionException;

    /**
     * @return current schema snapshot
     */
    Schema getSchema();

    /**
     * @return first {@code n} rows of a table
     */
    TabularResult getTableSample(String table, int n) throws SqlExecutionException;

    /**
     * @return up to {@code limit} distinct non-null values of a column
     */
    List<Object> sampleDistinctValues(String table, String column, int limit) throws SqlExecutionException;

    long countRows(String table) throws SqlExecutionException;

    /**
     * Column pairs across distinct tables whose names look alike. Advisory only; no foreign-key
     * semantics are checked.
     *
     * @param schema schema to inspect
     * @param threshold minimum name similarity (0-100)
     * @return hints formatted as {@code t1.c1 <-> t2.c2}
     */
    List<String> detectRelationships(Schema schema, int threshold);

    /**
     * Enumerate low-cardinality text columns.
     *
     * @param schema schema to inspect
     * @param maxDistinct largest distinct-value count still treated as categorical
     * @return values keyed by {@code table.column}; columns whose lookup fails are skipped
     */
    Map<String, List<String>> getCategoricalValues(Schema schema, int maxDistinct);

    /**
     * Create or replace a table from a CSV file.
     *
     * @param table sanitized table name
     * @param csvFile file to load
     * @param normalizeColumnNames lower-case and underscore header names
     * @return the schema snapshot after the load
     */
    Schema loadCsv(String table, Path csvFile, boolean normalizeColumnNames);

    /**
     * Drop a table if it exists.
     *
     * @param table sanitized table name
     * @return true if a table was dropped
     */
    boolean dropTable(String table);
}
