package com.quill.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FuzzyScoresTest {

    @Test
    void ratioOfIdenticalStringsIs100() {
        assertThat(FuzzyScores.ratio("customerid", "customerid")).isEqualTo(100);
        assertThat(FuzzyScores.ratio("", "")).isEqualTo(100);
    }

    @Test
    void ratioUsesLongestCommonSubsequence() {
        // lcs("kitten", "sitting") = "ittn"
        assertThat(FuzzyScores.lcsLength("kitten", "sitting")).isEqualTo(4);
        assertThat(FuzzyScores.ratio("kitten", "sitting")).isEqualTo(62);
    }

    @Test
    void ratioOfDisjointStringsIsZero() {
        assertThat(FuzzyScores.ratio("abc", "xyz")).isZero();
        assertThat(FuzzyScores.ratio(null, "xyz")).isZero();
    }

    @Test
    void partialRatioScoresSubstringAs100() {
        assertThat(FuzzyScores.partialRatio("customer", "customerid")).isEqualTo(100);
        assertThat(FuzzyScores.partialRatio("customerid", "customer")).isEqualTo(100);
    }

    @Test
    void partialRatioUsesBestWindow() {
        // best window of "customer_id" is "customer_" (lcs 8 of 9 + 9)
        assertThat(FuzzyScores.partialRatio("customers", "customer_id")).isEqualTo(89);
    }

    @Test
    void partialRatioOfEmptyInputIsZero() {
        assertThat(FuzzyScores.partialRatio("", "orders")).isZero();
    }
}
