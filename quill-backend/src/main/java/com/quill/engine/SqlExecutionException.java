package com.quill.engine;

/**
 * A statement could not be executed against the current dataset (syntax error, unknown
 * table or column, type mismatch, rejected statement kind). Retryable by regenerating SQL.
 */
public class SqlExecutionException extends Exception {

    private final String sqlState;

    public SqlExecutionException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    public SqlExecutionException(String message) {
        this(message, null, null);
    }

    /**
     * @return SQLSTATE reported by the driver, null when the statement was rejected before execution
     */
    public String getSqlState() {
        return sqlState;
    }
}
