package com.quill.service;

import com.quill.ai.PromptTemplates;
import com.quill.engine.QueryEngine;
import com.quill.engine.SqlExecutionException;
import com.quill.model.Attempt;
import com.quill.model.ExecutionResult;
import com.quill.model.Schema;
import com.quill.model.TabularResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes a statement and, when the engine rejects it, asks for a correction conditioned on
 * every failed attempt so far, until the statement runs or the retry budget is spent.
 *
 * <p>Only {@link SqlExecutionException} triggers a correction. A generation failure propagates
 * immediately and does not count as an attempt.
 */
@Slf4j
@Service
public class SelfCorrectingExecutor {

    private final QueryEngine engine;
    private final SqlGenerator sqlGenerator;
    private final int maxRetries;

    public SelfCorrectingExecutor(
            QueryEngine engine,
            SqlGenerator sqlGenerator,
            @Value("${quill.critic.max-retries:3}") int maxRetries
    ) {
        this.engine = engine;
        this.sqlGenerator = sqlGenerator;
        this.maxRetries = Math.max(1, maxRetries);
    }

    public ExecutionResult executeWithRetry(String sql, String question, Schema schema) {
        return executeWithRetry(sql, question, schema, AttemptListener.NONE);
    }

    /**
     * Run the attempt loop.
     *
     * @param sql first statement
     * @param question question the statement answers, passed to the corrector
     * @param schema schema the corrector sees
     * @param listener notified before each correction request
     * @return success with the rows, or the last statement and error once the budget is spent
     */
    public ExecutionResult executeWithRetry(String sql, String question, Schema schema, AttemptListener listener) {
        String schemaText = PromptTemplates.formatSchema(schema);
        List<Attempt> history = new ArrayList<>();

        CriticState state = CriticState.ATTEMPTING;
        String currentSql = sql;
        TabularResult data = null;
        String lastError = null;
        int attempt = 0;

        while (state == CriticState.ATTEMPTING) {
            attempt++;
            try {
                data = engine.execute(currentSql);
                state = CriticState.SUCCEEDED;
            } catch (SqlExecutionException e) {
                lastError = e.getMessage();
                history.add(new Attempt(currentSql, lastError));
                log.info("Attempt failed (attempt={}, max_retries={}, sql_state={})", attempt, maxRetries, e.getSqlState());
                if (attempt >= maxRetries) {
                    state = CriticState.EXHAUSTED;
                } else {
                    listener.beforeCorrection(attempt + 1, lastError);
                    currentSql = sqlGenerator.correct(schemaText, question, currentSql, lastError, List.copyOf(history));
                }
            }
        }

        if (state == CriticState.SUCCEEDED) {
            return ExecutionResult.succeeded(currentSql, data, attempt, history);
        }
        log.warn("Retry budget exhausted (attempts={})", attempt);
        return ExecutionResult.exhausted(currentSql, lastError, attempt, history);
    }
}
