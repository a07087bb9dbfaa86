package com.quill.model;

import java.util.List;

/**
 * {@link ExecutionResult} plus the resolution details of the question it answers.
 */
public record PipelineResult(
        String question,
        boolean success,
        String sql,
        TabularResult data,
        String error,
        int attempts,
        List<Attempt> history,
        List<String> relevantTables,
        List<ColumnMatch> columnMatches
) {

    public PipelineResult {
        history = List.copyOf(history);
        relevantTables = List.copyOf(relevantTables);
        columnMatches = List.copyOf(columnMatches);
    }

    public static PipelineResult of(String question, ExecutionResult result, EnrichedContext enriched) {
        return new PipelineResult(
                question,
                result.success(),
                result.sql(),
                result.data(),
                result.error(),
                result.attempts(),
                result.history(),
                enriched.relevantTables(),
                enriched.columnMatches()
        );
    }

    /**
     * A run that stopped before any statement was executed.
     */
    public static PipelineResult rejected(String question, String message) {
        return new PipelineResult(question, false, null, null, message, 0, List.of(), List.of(), List.of());
    }
}
