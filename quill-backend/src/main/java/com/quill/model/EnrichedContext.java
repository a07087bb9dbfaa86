package com.quill.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of schema resolution for one question.
 *
 * @param originalSchema schema the question was resolved against
 * @param columnMatches retained matches, one per (table, column)
 * @param valueHints sampled distinct values keyed by {@code table.column}
 * @param relevantTables distinct tables of {@code columnMatches} in first-seen order; empty means
 *                       "use the full schema"
 */
public record EnrichedContext(
        Schema originalSchema,
        List<ColumnMatch> columnMatches,
        Map<String, List<Object>> valueHints,
        List<String> relevantTables
) {

    public EnrichedContext {
        columnMatches = List.copyOf(columnMatches);
        valueHints = Collections.unmodifiableMap(new LinkedHashMap<>(valueHints));
        relevantTables = List.copyOf(relevantTables);
    }
}
