package com.quill.ai;

import com.quill.model.Attempt;
import com.quill.model.ChatTurn;
import com.quill.model.ColumnInfo;
import com.quill.model.Schema;
import com.quill.model.TableSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat prompts for SQL generation, SQL correction and insight summaries.
 */
public final class PromptTemplates {

    static final String DIALECT = "H2";

    static final String SUMMARY_SYSTEM = "You are a data analyst. Given the user's original question and this JSON "
            + "result set, provide exactly ONE sentence summarizing the core insight in plain English. "
            + "Do not explain the SQL. Keep it punchy.";

    static final String CORRECTION_SYSTEM = "You are an expert SQL debugger for " + DIALECT + ".\n"
            + "You fix broken SQL queries.\n"
            + "Study all previous attempts to avoid repeating the same mistakes.\n"
            + "Return ONLY the raw SQL query.";

    private PromptTemplates() {
    }

    /**
     * Build the generation prompt.
     *
     * @param context schema text or enriched context
     * @param question user question
     * @param history prior conversational turns, oldest first
     * @return system and user messages
     */
    public static List<ChatMessage> sqlGeneration(String context, String question, List<ChatTurn> history) {
        String system = "You are an expert " + DIALECT + " SQL generator.\n"
                + "\n"
                + "Rules:\n"
                + "- Only use tables and columns from the provided schema\n"
                + "- Return ONLY the raw SQL query, no markdown, no explanation\n"
                + "- Never use columns that don't exist in the schema\n"
                + "- Always use the exact column names provided in the schema context\n"
                + "- Always alias computed columns with clear names\n"
                + "- Only write read-only queries (SELECT or WITH)\n"
                + "- Always wrap ALL table and column identifiers in double quotes "
                + "(e.g. SELECT \"column_name\" FROM \"table_name\")\n"
                + "- ALWAYS use LOWER() for string comparisons (e.g. LOWER(\"dept\") = 'cs')\n"
                + "- Use IN() with multiple value forms when filtering "
                + "(e.g. WHERE LOWER(\"dept\") IN ('cs', 'computer science'))\n"
                + "- If the question cannot be answered with the given schema, return: "
                + "SELECT 'I cannot answer this question with the available data' AS message\n"
                + "\n"
                + "### CONVERSATIONAL CONTEXT & PRONOUNS\n"
                + "If the current question contains pronouns ('those', 'them', 'it', 'this') or refers to "
                + "previous results ('filter that by...'), use the conversational history to resolve them.\n"
                + "- Do NOT answer that the entity is not in the database.\n"
                + "- Extract the entities from the previous question or SQL and write a brand new, fully "
                + "self-contained SQL query that answers the follow-up question.\n"
                + "\n"
                + "### CONVERSATIONAL HISTORY\n"
                + formatHistory(history);

        String user = "Schema:\n"
                + context + "\n"
                + "\n"
                + "Question: " + question + "\n"
                + "\n"
                + "Return only the raw SQL query with no markdown or explanation.";

        return List.of(ChatMessage.system(system), ChatMessage.user(user));
    }

    /**
     * Build the correction prompt. Every previous attempt is listed so the model can avoid
     * repeating a mistake.
     */
    public static List<ChatMessage> correction(
            String schemaText,
            String question,
            String failedSql,
            String error,
            List<Attempt> history
    ) {
        StringBuilder user = new StringBuilder();
        user.append("Original question: ").append(question).append("\n\n");
        user.append("Schema:\n").append(schemaText).append("\n");
        if (history != null && !history.isEmpty()) {
            user.append("\nPrevious failed attempts:\n");
            for (int i = 0; i < history.size(); i++) {
                Attempt attempt = history.get(i);
                user.append("\nAttempt ").append(i + 1).append(":\n");
                user.append("SQL: ").append(attempt.sql()).append("\n");
                user.append("Error: ").append(attempt.error()).append("\n");
            }
        }
        user.append("\nCurrent failing SQL:\n").append(failedSql).append("\n");
        user.append("\nCurrent error:\n").append(error).append("\n");
        user.append("\nFix the SQL query. Return only the corrected query with no markdown or explanation.");

        return List.of(ChatMessage.system(CORRECTION_SYSTEM), ChatMessage.user(user.toString()));
    }

    public static List<ChatMessage> summary(String question, String rowsJson) {
        return List.of(
                ChatMessage.system(SUMMARY_SYSTEM),
                ChatMessage.user("Question: " + question + "\n\nResults:\n" + rowsJson)
        );
    }

    /**
     * Render a schema as {@code Table: name} blocks with one indented {@code column (type)} line
     * per column, blocks separated by a blank line.
     */
    public static String formatSchema(Schema schema) {
        List<String> parts = new ArrayList<>();
        for (TableSchema table : schema.tables()) {
            StringBuilder sb = new StringBuilder("Table: ").append(table.name());
            for (ColumnInfo column : table.columns()) {
                sb.append("\n    ").append(column.name()).append(" (").append(column.type()).append(")");
            }
            parts.add(sb.toString());
        }
        return String.join("\n\n", parts);
    }

    static String formatHistory(List<ChatTurn> history) {
        if (history == null || history.isEmpty()) {
            return "None";
        }
        List<String> turns = new ArrayList<>(history.size());
        for (ChatTurn turn : history) {
            turns.add("Q: " + turn.question() + "\nSQL: " + turn.sql());
        }
        return String.join("\n", turns);
    }
}
