package com.quill.model;

/**
 * One execution attempt of the self-correcting executor.
 *
 * @param sql statement that was executed
 * @param error engine error message, null if the attempt succeeded
 */
public record Attempt(String sql, String error) {
}
