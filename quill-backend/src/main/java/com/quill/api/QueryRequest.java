package com.quill.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body of {@code POST /api/query} and {@code POST /api/query/run}.
 *
 * JSON fields (snake_case):
 * - question: natural-language question
 * - selected_tables: tables to search; empty or missing means all tables
 * - chat_history: prior turns of the conversation, oldest first
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryRequest {

    @NotBlank(message = "Question is required")
    private String question;

    @JsonAlias("selectedTables")
    private List<String> selectedTables = new ArrayList<>();

    @Valid
    private List<Turn> chatHistory = new ArrayList<>();

    @Data
    public static class Turn {
        private String question;
        private String sql;
    }
}
