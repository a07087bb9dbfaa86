package com.quill.service;

import com.quill.model.ColumnInfo;
import com.quill.model.Schema;
import com.quill.model.TableSchema;
import com.quill.resolver.KeywordExtractor;
import com.quill.util.FuzzyScores;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cheap check that a question talks about the loaded data before any generation call is made.
 *
 * <p>The vocabulary is every underscore-separated fragment of the table and column names. A
 * question passes when one of its tokens is in the vocabulary or resembles a table name.
 */
@Component
public class RelevanceGate {

    private final int threshold;

    public RelevanceGate(@Value("${quill.pipeline.relevance-threshold:70}") int threshold) {
        this.threshold = threshold;
    }

    public boolean isDatabaseQuestion(String question, Schema schema) {
        List<String> tables = schema.tableNames();
        Set<String> vocabulary = vocabulary(schema);
        for (String word : KeywordExtractor.tokenize(question)) {
            if (vocabulary.contains(word)) {
                return true;
            }
            for (String table : tables) {
                if (FuzzyScores.partialRatio(word, table) >= threshold) {
                    return true;
                }
            }
        }
        return false;
    }

    public String rejectionMessage(Schema schema) {
        List<String> tables = schema.tableNames();
        String examples = tables.isEmpty()
                ? "your data"
                : String.join(", ", tables.subList(0, Math.min(3, tables.size())));
        return "I can only answer questions about your database. Try asking about " + examples + ".";
    }

    static Set<String> vocabulary(Schema schema) {
        Set<String> out = new HashSet<>();
        for (TableSchema table : schema.tables()) {
            addFragments(out, table.name());
            for (ColumnInfo column : table.columns()) {
                addFragments(out, column.name());
            }
        }
        return out;
    }

    private static void addFragments(Set<String> out, String name) {
        for (String part : name.toLowerCase(Locale.ROOT).split("_")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
    }
}
