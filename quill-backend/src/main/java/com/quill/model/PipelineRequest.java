package com.quill.model;

import java.util.List;

/**
 * Input of one pipeline run.
 *
 * @param question natural-language question
 * @param selectedTables tables the caller restricts the search to; empty means all tables
 * @param chatHistory prior turns, oldest first
 */
public record PipelineRequest(String question, List<String> selectedTables, List<ChatTurn> chatHistory) {

    public PipelineRequest {
        selectedTables = selectedTables != null ? List.copyOf(selectedTables) : List.of();
        chatHistory = chatHistory != null ? List.copyOf(chatHistory) : List.of();
    }

    public static PipelineRequest of(String question) {
        return new PipelineRequest(question, List.of(), List.of());
    }
}
