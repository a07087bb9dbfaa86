package com.quill.resolver;

import com.quill.ai.EmbeddingClient;
import com.quill.ai.GenerationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Combines lexical matching with embedding similarity: the score of a column is
 * {@code max(partialRatio, cosine * 100)}.
 *
 * <p>Column vectors are computed once per schema snapshot. When the embedding gateway fails,
 * the affected snapshot (or the affected keyword) is scored lexically; the reported mode stays
 * {@code hybrid}.
 */
@Slf4j
public class HybridMatchingStrategy implements MatchingStrategy {

    public static final String MODE = "hybrid";

    private final EmbeddingClient embeddingClient;

    public HybridMatchingStrategy(EmbeddingClient embeddingClient) {
        this.embeddingClient = embeddingClient;
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public ColumnScorer prepare(List<ColumnEntry> entries) {
        ColumnScorer lexical = LexicalMatchingStrategy.scorerFor(entries);
        if (entries.isEmpty()) {
            return lexical;
        }

        List<String> names = new ArrayList<>(entries.size());
        for (ColumnEntry entry : entries) {
            names.add(entry.column().toLowerCase(Locale.ROOT));
        }

        List<float[]> columnVectors;
        try {
            columnVectors = embeddingClient.embed(names);
        } catch (GenerationException e) {
            log.warn("Column embedding failed, using lexical scores for this schema (columns={}, error={})",
                    names.size(), e.getMessage());
            return lexical;
        }

        return keyword -> {
            double[] scores = lexical.score(keyword);
            float[] keywordVector;
            try {
                keywordVector = embeddingClient.embed(List.of(keyword)).get(0);
            } catch (GenerationException e) {
                log.warn("Keyword embedding failed, scoring lexically (keyword={}, error={})", keyword, e.getMessage());
                return scores;
            }
            for (int i = 0; i < scores.length; i++) {
                double semantic = cosine(keywordVector, columnVectors.get(i)) * 100.0;
                scores[i] = Math.max(scores[i], semantic);
            }
            return scores;
        };
    }

    static double cosine(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < n; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
