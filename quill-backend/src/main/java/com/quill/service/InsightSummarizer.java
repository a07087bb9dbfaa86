package com.quill.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quill.ai.GenerationException;
import com.quill.ai.GenerationOptions;
import com.quill.ai.PromptTemplates;
import com.quill.ai.TextGenerationClient;
import com.quill.model.TabularResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Streams a one-sentence summary of a result set.
 */
@Component
public class InsightSummarizer {

    private final TextGenerationClient textGenerationClient;
    private final ObjectMapper objectMapper;
    private final int summaryRows;

    public InsightSummarizer(
            TextGenerationClient textGenerationClient,
            ObjectMapper objectMapper,
            @Value("${quill.pipeline.summary-rows:50}") int summaryRows
    ) {
        this.textGenerationClient = textGenerationClient;
        this.objectMapper = objectMapper;
        this.summaryRows = summaryRows;
    }

    /**
     * @param question original question
     * @param data successful result; only the first rows are sent
     * @param onChunk receives summary text as it arrives
     * @throws GenerationException if the rows cannot be encoded or the gateway fails
     */
    public void streamSummary(String question, TabularResult data, Consumer<String> onChunk) {
        String rowsJson;
        try {
            rowsJson = objectMapper.writeValueAsString(data.head(summaryRows).rows());
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to encode result rows: " + e.getOriginalMessage(), e);
        }
        textGenerationClient.generateStream(PromptTemplates.summary(question, rowsJson), GenerationOptions.SUMMARY, onChunk);
    }
}
