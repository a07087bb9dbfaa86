package com.quill.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierSanitizerTest {

    @Test
    void stripsSpacesAndLowerCases() {
        assertThat(IdentifierSanitizer.sanitize("Order Details")).isEqualTo("orderdetails");
    }

    @Test
    void prefixesIdentifiersStartingWithDigit() {
        assertThat(IdentifierSanitizer.sanitize("123abc")).isEqualTo("t_123abc");
    }

    @Test
    void removesInjectionCharacters() {
        assertThat(IdentifierSanitizer.sanitize("table; DROP users--")).isEqualTo("tabledropusers");
    }

    @Test
    void emptyAndNullBecomePrefixOnly() {
        assertThat(IdentifierSanitizer.sanitize("")).isEqualTo("t_");
        assertThat(IdentifierSanitizer.sanitize(null)).isEqualTo("t_");
        assertThat(IdentifierSanitizer.sanitize("!!!")).isEqualTo("t_");
    }

    @Test
    void keepsUnderscorePrefix() {
        assertThat(IdentifierSanitizer.sanitize("_Staging_2024")).isEqualTo("_staging_2024");
    }

    @Test
    void truncatesTo64Characters() {
        String sanitized = IdentifierSanitizer.sanitize("a".repeat(100));
        assertThat(sanitized).hasSize(IdentifierSanitizer.MAX_LENGTH);
    }

    @Test
    void quoteEscapesEmbeddedQuotes() {
        assertThat(IdentifierSanitizer.quote("customerID")).isEqualTo("\"customerID\"");
        assertThat(IdentifierSanitizer.quote("we\"ird")).isEqualTo("\"we\"\"ird\"");
    }
}
