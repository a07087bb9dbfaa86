package com.quill.service;

import com.quill.ai.GenerationException;
import com.quill.engine.QueryEngine;
import com.quill.model.EnrichedContext;
import com.quill.model.ExecutionResult;
import com.quill.model.PipelineRequest;
import com.quill.model.PipelineResult;
import com.quill.model.Schema;
import com.quill.resolver.SchemaResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one question through relevance gating, schema resolution, context assembly, SQL
 * generation, self-correcting execution and (streaming only) the insight summary.
 *
 * <p>Each run reads one schema snapshot at its start and uses it throughout.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    static final String NO_TABLES_MESSAGE = "No tables found in the database.";

    private final QueryEngine engine;
    private final RelevanceGate relevanceGate;
    private final SchemaResolver resolver;
    private final ContextAssembler contextAssembler;
    private final SqlGenerator sqlGenerator;
    private final SelfCorrectingExecutor executor;
    private final InsightSummarizer summarizer;

    public PipelineOrchestrator(
            QueryEngine engine,
            RelevanceGate relevanceGate,
            SchemaResolver resolver,
            ContextAssembler contextAssembler,
            SqlGenerator sqlGenerator,
            SelfCorrectingExecutor executor,
            InsightSummarizer summarizer
    ) {
        this.engine = engine;
        this.relevanceGate = relevanceGate;
        this.resolver = resolver;
        this.contextAssembler = contextAssembler;
        this.sqlGenerator = sqlGenerator;
        this.executor = executor;
        this.summarizer = summarizer;
    }

    public PipelineResult run(String question) {
        return run(PipelineRequest.of(question));
    }

    /**
     * Answer a question without streaming.
     *
     * @param request question, optional table selection and prior turns
     * @return the execution outcome plus resolution details; a rejected question yields a failed
     *         result with zero attempts
     * @throws GenerationException if the text generation gateway is unavailable
     */
    public PipelineResult run(PipelineRequest request) {
        String question = request.question();
        Schema schema = engine.getSchema();

        if (request.chatHistory().isEmpty() && !relevanceGate.isDatabaseQuestion(question, schema)) {
            log.info("Question rejected as off-topic");
            return PipelineResult.rejected(question, relevanceGate.rejectionMessage(schema));
        }

        Schema active = activeSchema(schema, request);
        if (active.isEmpty()) {
            return PipelineResult.rejected(question, NO_TABLES_MESSAGE);
        }

        EnrichedContext enriched = resolver.enrich(question, active);
        String context = contextAssembler.assemble(enriched);
        String sql = sqlGenerator.generate(question, context, request.chatHistory());
        ExecutionResult result = executor.executeWithRetry(sql, question, enriched.originalSchema());

        log.info("Pipeline finished (success={}, attempts={}, relevant_tables={})",
                result.success(), result.attempts(), enriched.relevantTables());
        return PipelineResult.of(question, result, enriched);
    }

    /**
     * Answer a question, reporting progress to {@code sink} in stage order.
     *
     * @throws EventSinkClosedException if the sink's consumer went away
     */
    public void stream(PipelineRequest request, PipelineEventSink sink) {
        String question = request.question();
        Schema schema = engine.getSchema();

        sink.thinking("Analyzing your question...");
        // Follow-ups ("filter those by...") look off-topic in isolation.
        if (request.chatHistory().isEmpty() && !relevanceGate.isDatabaseQuestion(question, schema)) {
            sink.error(relevanceGate.rejectionMessage(schema));
            return;
        }

        Schema active = activeSchema(schema, request);
        if (active.isEmpty()) {
            sink.error(NO_TABLES_MESSAGE);
            return;
        }

        sink.thinking("Searching schema for relevant tables...");
        EnrichedContext enriched = resolver.enrich(question, active);
        String tableList = enriched.relevantTables().isEmpty()
                ? "none found"
                : String.join(", ", enriched.relevantTables());
        sink.thinking("Found relevant tables: " + tableList);

        ExecutionResult result;
        try {
            String context = contextAssembler.assemble(enriched);
            String sql = sqlGenerator.generate(question, context, request.chatHistory());
            sink.sql(sql);
            result = executor.executeWithRetry(sql, question, enriched.originalSchema(),
                    (nextAttempt, error) -> sink.thinking("Refining query... (attempt " + nextAttempt + ")"));
        } catch (GenerationException e) {
            log.warn("SQL generation failed: {}", e.getMessage());
            sink.error(e.getMessage());
            return;
        }

        if (!result.success()) {
            sink.error(result.error());
            return;
        }
        sink.result(result.data(), result.attempts());

        sink.thinking("Generating insight summary...");
        try {
            summarizer.streamSummary(question, result.data(), sink::summaryChunk);
        } catch (GenerationException e) {
            log.warn("Summary streaming failed: {}", e.getMessage());
            sink.error("Insight generation failed: " + e.getMessage());
            return;
        }
        sink.summaryDone();
    }

    private static Schema activeSchema(Schema schema, PipelineRequest request) {
        if (request.selectedTables().isEmpty()) {
            return schema;
        }
        return schema.restrictTo(request.selectedTables());
    }
}
