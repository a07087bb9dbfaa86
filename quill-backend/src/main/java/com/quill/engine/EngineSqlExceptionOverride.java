package com.quill.engine;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;
import java.util.Set;

/**
 * Stops Hikari from evicting a pooled connection because a generated statement was wrong.
 *
 * <p>Generated SQL routinely references unknown columns or compares mismatched types. Those
 * failures belong to the statement, not the connection.
 */
public class EngineSqlExceptionOverride implements SQLExceptionOverride {

    // SQLSTATE classes: 0A feature not supported, 22 data exception, 42 syntax or access rule.
    private static final Set<String> STATEMENT_STATE_CLASSES = Set.of("0A", "22", "42");

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (isStatementError(sqlException)) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }

    static boolean isStatementError(SQLException e) {
        if (e == null) {
            return false;
        }
        if (e instanceof SQLSyntaxErrorException || e instanceof SQLFeatureNotSupportedException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.length() >= 2 && STATEMENT_STATE_CLASSES.contains(state.substring(0, 2));
    }
}
