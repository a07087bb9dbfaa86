package com.quill.resolver;

import com.quill.ai.PromptTemplates;
import com.quill.engine.QueryEngine;
import com.quill.engine.SqlExecutionException;
import com.quill.model.ColumnInfo;
import com.quill.model.ColumnMatch;
import com.quill.model.EnrichedContext;
import com.quill.model.Schema;
import com.quill.model.TableSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps question keywords onto schema columns and collects sample values for the matches.
 *
 * <p>All derived state lives in one {@link ResolverSnapshot} that {@link #refreshSchema(Schema)}
 * replaces atomically, so a concurrent {@link #enrich} sees either the old or the new schema.
 */
@Slf4j
@Service
public class SchemaResolver {

    private final QueryEngine engine;
    private final MatchingStrategy strategy;
    private final int fuzzyThreshold;
    private final int sampleSize;

    private final AtomicReference<ResolverSnapshot> snapshot = new AtomicReference<>();

    public SchemaResolver(
            QueryEngine engine,
            MatchingStrategy strategy,
            @Value("${quill.resolver.fuzzy-threshold:70}") int fuzzyThreshold,
            @Value("${quill.resolver.sample-size:5}") int sampleSize
    ) {
        this.engine = engine;
        this.strategy = strategy;
        this.fuzzyThreshold = fuzzyThreshold;
        this.sampleSize = sampleSize;
        refreshSchema(engine.getSchema());
    }

    /**
     * Rebuild the column entries (and, in hybrid mode, the column vectors) for a new schema.
     *
     * @param schema schema after a load, upload or drop
     */
    public void refreshSchema(Schema schema) {
        List<ColumnEntry> entries = new ArrayList<>();
        for (TableSchema table : schema.tables()) {
            for (ColumnInfo column : table.columns()) {
                entries.add(new ColumnEntry(table.name(), column.name(), column.type()));
            }
        }
        ColumnScorer scorer = strategy.prepare(entries);
        snapshot.set(new ResolverSnapshot(schema, entries, scorer));
        log.debug("Resolver snapshot refreshed (mode={}, tables={}, columns={})",
                strategy.mode(), schema.tableNames().size(), entries.size());
    }

    /**
     * Resolve a question against the tables of {@code schema}.
     *
     * @param question natural-language question
     * @param schema active schema; only its tables are matched
     * @return matches, sample values and relevant tables; never fails for "no match"
     */
    public EnrichedContext enrich(String question, Schema schema) {
        ResolverSnapshot current = snapshot.get();
        Set<String> activeTables = new HashSet<>(schema.tableNames());
        List<ColumnEntry> entries = current.entries();

        Map<String, ColumnMatch> best = new LinkedHashMap<>();
        for (String keyword : KeywordExtractor.extractKeywords(question)) {
            double[] scores = current.scorer().score(keyword);
            for (int i = 0; i < entries.size(); i++) {
                ColumnEntry entry = entries.get(i);
                if (!activeTables.contains(entry.table())) {
                    continue;
                }
                double score = scores[i];
                if (score < fuzzyThreshold) {
                    continue;
                }
                ColumnMatch existing = best.get(entry.key());
                if (existing == null || score > existing.score()) {
                    best.put(entry.key(), new ColumnMatch(keyword, entry.table(), entry.column(), score));
                }
            }
        }

        List<ColumnMatch> matches = new ArrayList<>(best.values());
        Map<String, List<Object>> valueHints = new LinkedHashMap<>();
        Set<String> relevant = new LinkedHashSet<>();
        for (ColumnMatch match : matches) {
            valueHints.put(match.qualifiedName(), sampleValues(match));
            relevant.add(match.table());
        }
        return new EnrichedContext(schema, matches, valueHints, new ArrayList<>(relevant));
    }

    private List<Object> sampleValues(ColumnMatch match) {
        try {
            return engine.sampleDistinctValues(match.table(), match.column(), sampleSize);
        } catch (SqlExecutionException e) {
            log.debug("Value sampling failed (column={}, error={})", match.qualifiedName(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Render an enriched context for the generation prompt: mode line, schema of the relevant
     * tables (all tables when none matched) and semantic hints.
     */
    public String formatEnrichedContext(EnrichedContext enriched) {
        Schema original = enriched.originalSchema();
        List<TableSchema> filtered = new ArrayList<>();
        for (String table : enriched.relevantTables()) {
            original.table(table).ifPresent(filtered::add);
        }
        Schema shown = filtered.isEmpty() ? original : new Schema(filtered);

        List<String> parts = new ArrayList<>();
        parts.add("Matching mode: " + strategy.mode() + "\n" + PromptTemplates.formatSchema(shown));

        if (!enriched.columnMatches().isEmpty()) {
            parts.add("Semantic Hints:");
            for (ColumnMatch match : enriched.columnMatches()) {
                parts.add("  '" + match.keyword() + "' likely refers to " + match.qualifiedName());
            }
            for (Map.Entry<String, List<Object>> hint : enriched.valueHints().entrySet()) {
                if (hint.getValue().isEmpty()) {
                    continue;
                }
                List<String> values = new ArrayList<>(hint.getValue().size());
                for (Object v : hint.getValue()) {
                    values.add(String.valueOf(v));
                }
                parts.add("  Sample values for " + hint.getKey() + ": " + String.join(", ", values));
            }
        }
        return String.join("\n", parts);
    }
}
