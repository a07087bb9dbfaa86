package com.quill.resolver;

import com.quill.util.FuzzyScores;

import java.util.List;
import java.util.Locale;

/**
 * Partial-ratio matching of the keyword against the lower-cased column name.
 */
public class LexicalMatchingStrategy implements MatchingStrategy {

    public static final String MODE = "fuzzy";

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public ColumnScorer prepare(List<ColumnEntry> entries) {
        return scorerFor(entries);
    }

    static ColumnScorer scorerFor(List<ColumnEntry> entries) {
        String[] names = new String[entries.size()];
        for (int i = 0; i < names.length; i++) {
            names[i] = entries.get(i).column().toLowerCase(Locale.ROOT);
        }
        return keyword -> {
            double[] scores = new double[names.length];
            for (int i = 0; i < names.length; i++) {
                scores[i] = FuzzyScores.partialRatio(keyword, names[i]);
            }
            return scores;
        };
    }
}
