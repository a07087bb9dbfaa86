package com.quill.service;

import com.quill.ai.GenerationOptions;
import com.quill.ai.PromptTemplates;
import com.quill.ai.TextGenerationClient;
import com.quill.model.Attempt;
import com.quill.model.ChatTurn;
import com.quill.util.SqlTextNormalizer;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns prompts into executable SQL text. Both the first draft and every correction pass
 * through {@link SqlTextNormalizer#normalize(String)}.
 */
@Service
public class SqlGenerator {

    private final TextGenerationClient textGenerationClient;

    public SqlGenerator(TextGenerationClient textGenerationClient) {
        this.textGenerationClient = textGenerationClient;
    }

    /**
     * Draft SQL for a question.
     *
     * @param question user question
     * @param context formatted schema context
     * @param history prior conversational turns
     * @return normalized SQL text
     */
    public String generate(String question, String context, List<ChatTurn> history) {
        String raw = textGenerationClient.generate(
                PromptTemplates.sqlGeneration(context, question, history), GenerationOptions.SQL);
        return SqlTextNormalizer.normalize(raw);
    }

    /**
     * Ask for a fixed statement given the failure and all earlier failures.
     */
    public String correct(String schemaText, String question, String failedSql, String error, List<Attempt> history) {
        String raw = textGenerationClient.generate(
                PromptTemplates.correction(schemaText, question, failedSql, error, history), GenerationOptions.SQL);
        return SqlTextNormalizer.normalize(raw);
    }
}
