package com.quill.service;

import com.quill.engine.QueryEngine;
import com.quill.model.EnrichedContext;
import com.quill.resolver.SchemaResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds the generation context: resolver output, then join hints, then low-cardinality values.
 * The last two are best effort; a failing lookup drops its section.
 */
@Slf4j
@Component
public class ContextAssembler {

    private final QueryEngine engine;
    private final SchemaResolver resolver;
    private final int relationshipThreshold;
    private final int categoricalLimit;

    public ContextAssembler(
            QueryEngine engine,
            SchemaResolver resolver,
            @Value("${quill.pipeline.relationship-threshold:85}") int relationshipThreshold,
            @Value("${quill.pipeline.categorical-limit:50}") int categoricalLimit
    ) {
        this.engine = engine;
        this.resolver = resolver;
        this.relationshipThreshold = relationshipThreshold;
        this.categoricalLimit = categoricalLimit;
    }

    public String assemble(EnrichedContext enriched) {
        StringBuilder context = new StringBuilder(resolver.formatEnrichedContext(enriched));

        try {
            List<String> relationships = engine.detectRelationships(enriched.originalSchema(), relationshipThreshold);
            if (!relationships.isEmpty()) {
                context.append("\n\nDetected Join Relationships:\n").append(String.join("\n", relationships));
            }
        } catch (RuntimeException e) {
            log.warn("Relationship detection skipped: {}", e.getMessage());
        }

        try {
            Map<String, List<String>> categoricals = engine.getCategoricalValues(enriched.originalSchema(), categoricalLimit);
            if (!categoricals.isEmpty()) {
                context.append("\n\nCategorical Values:\n");
                for (Map.Entry<String, List<String>> e : categoricals.entrySet()) {
                    context.append(e.getKey()).append(": ").append(String.join(", ", e.getValue())).append("\n");
                }
            }
        } catch (RuntimeException e) {
            log.warn("Categorical value lookup skipped: {}", e.getMessage());
        }

        return context.toString();
    }
}
