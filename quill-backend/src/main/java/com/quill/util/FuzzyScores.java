package com.quill.util;

/**
 * Lexical similarity scores on a 0-100 scale.
 *
 * <p>{@link #ratio(String, String)} is the normalized longest-common-subsequence similarity
 * {@code 200 * lcs / (len(a) + len(b))}. {@link #partialRatio(String, String)} aligns the
 * shorter string against every equally long window of the longer one and keeps the best
 * window, so a keyword that is a substring of a column name scores 100.
 */
public final class FuzzyScores {

    private FuzzyScores() {
    }

    public static int ratio(String a, String b) {
        if (a == null || b == null) {
            return 0;
        }
        int total = a.length() + b.length();
        if (total == 0) {
            return 100;
        }
        return (int) Math.round(200.0 * lcsLength(a, b) / total);
    }

    public static int partialRatio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = a.length() <= b.length() ? b : a;
        if (longer.contains(shorter)) {
            return 100;
        }

        int window = shorter.length();
        int best = 0;
        for (int start = 0; start + window <= longer.length(); start++) {
            int score = ratio(shorter, longer.substring(start, start + window));
            if (score > best) {
                best = score;
                if (best == 100) {
                    break;
                }
            }
        }
        return best;
    }

    static int lcsLength(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
