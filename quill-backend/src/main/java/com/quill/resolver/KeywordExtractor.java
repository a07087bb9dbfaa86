package com.quill.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits questions into lower-case tokens.
 */
public final class KeywordExtractor {

    public static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "is", "in", "of", "for", "by", "and",
            "or", "to", "show", "me", "what", "how", "many", "which",
            "who", "where", "get", "find", "list", "give", "with", "per"
    );

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\W]+", Pattern.UNICODE_CHARACTER_CLASS);

    private KeywordExtractor() {
    }

    /**
     * Lower-case the text and split it on whitespace and non-word runs. Empty tokens are dropped.
     */
    public static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String token : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * {@link #tokenize(String)} without stop words. Duplicates and order are kept.
     */
    public static List<String> extractKeywords(String question) {
        List<String> out = new ArrayList<>();
        for (String token : tokenize(question)) {
            if (!STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }
}
