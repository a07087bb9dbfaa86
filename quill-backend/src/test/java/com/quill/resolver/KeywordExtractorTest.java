package com.quill.resolver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordExtractorTest {

    @Test
    void tokenizeSplitsOnPunctuationAndLowerCases() {
        assertThat(KeywordExtractor.tokenize("Show me Revenue, by customer_id!"))
                .containsExactly("show", "me", "revenue", "by", "customer_id");
    }

    @Test
    void tokenizeHandlesBlankInput() {
        assertThat(KeywordExtractor.tokenize("  ?! ")).isEmpty();
        assertThat(KeywordExtractor.tokenize(null)).isEmpty();
    }

    @Test
    void extractKeywordsDropsStopWords() {
        assertThat(KeywordExtractor.extractKeywords("How many orders per customer in 1997?"))
                .containsExactly("orders", "customer", "1997");
    }
}
