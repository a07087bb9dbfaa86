package com.quill.util;

import java.util.List;
import java.util.Locale;

/**
 * Extracts a bare SQL statement from free-form model output.
 *
 * <p>{@link #normalize(String)} is pure and idempotent: normalizing an already normalized
 * statement returns it unchanged.
 */
public final class SqlTextNormalizer {

    private static final String FENCE = "```";
    private static final List<String> STATEMENT_KEYWORDS = List.of("SELECT", "WITH", "INSERT", "UPDATE", "DELETE");

    private SqlTextNormalizer() {
    }

    /**
     * Normalize model output into a SQL statement.
     *
     * @param raw raw model output, may be null
     * @return trimmed statement, empty if there was nothing to extract
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.trim();
        while (!startsWithStatementKeyword(s) && s.contains(FENCE)) {
            String unfenced = stripFence(s);
            if (unfenced.equals(s)) {
                break;
            }
            s = unfenced;
        }
        if (startsWithStatementKeyword(s) || s.contains(FENCE)) {
            return s;
        }
        return fromFirstStatementLine(s);
    }

    static boolean startsWithStatementKeyword(String s) {
        String upper = s.toUpperCase(Locale.ROOT);
        for (String keyword : STATEMENT_KEYWORDS) {
            if (upper.startsWith(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String stripFence(String s) {
        int open = s.indexOf(FENCE);
        int bodyStart = s.indexOf('\n', open);
        if (bodyStart < 0) {
            // Single-line fence: ```SELECT 1```
            bodyStart = open + FENCE.length();
        } else {
            bodyStart++;
        }
        int close = s.indexOf(FENCE, bodyStart);
        String body = close >= 0 ? s.substring(bodyStart, close) : s.substring(bodyStart);
        return body.trim();
    }

    private static String fromFirstStatementLine(String s) {
        String[] lines = s.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (startsWithStatementKeyword(lines[i].trim())) {
                StringBuilder sb = new StringBuilder();
                for (int j = i; j < lines.length; j++) {
                    if (j > i) {
                        sb.append('\n');
                    }
                    sb.append(lines[j]);
                }
                return sb.toString().trim();
            }
        }
        return s;
    }
}
