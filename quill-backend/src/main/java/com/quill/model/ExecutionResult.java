package com.quill.model;

import java.util.List;

/**
 * Terminal outcome of the self-correcting executor.
 *
 * @param success whether the final statement executed
 * @param sql the last statement tried
 * @param data rows of the successful statement, null on failure
 * @param error last engine error, null on success
 * @param attempts number of statements executed, including the final one
 * @param history failed attempts in execution order
 */
public record ExecutionResult(
        boolean success,
        String sql,
        TabularResult data,
        String error,
        int attempts,
        List<Attempt> history
) {

    public ExecutionResult {
        history = List.copyOf(history);
    }

    public static ExecutionResult succeeded(String sql, TabularResult data, int attempts, List<Attempt> history) {
        return new ExecutionResult(true, sql, data, null, attempts, history);
    }

    public static ExecutionResult exhausted(String sql, String error, int attempts, List<Attempt> history) {
        return new ExecutionResult(false, sql, null, error, attempts, history);
    }
}
