package com.quill.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqlTextNormalizerTest {

    @Test
    void stripsMarkdownFence() {
        String raw = "```sql\nSELECT * FROM \"orders\"\n```";
        assertThat(SqlTextNormalizer.normalize(raw)).isEqualTo("SELECT * FROM \"orders\"");
    }

    @Test
    void stripsSingleLineFence() {
        assertThat(SqlTextNormalizer.normalize("```SELECT 1```")).isEqualTo("SELECT 1");
    }

    @Test
    void dropsLeadingProse() {
        String raw = "Here is the SQL you asked for:\n```sql\nSELECT COUNT(*) FROM \"orders\"\n```\nHope this helps.";
        assertThat(SqlTextNormalizer.normalize(raw)).isEqualTo("SELECT COUNT(*) FROM \"orders\"");
    }

    @Test
    void dropsProseWithoutFence() {
        String raw = "Sure! The query is:\nWITH t AS (SELECT 1 AS x)\nSELECT x FROM t";
        assertThat(SqlTextNormalizer.normalize(raw)).isEqualTo("WITH t AS (SELECT 1 AS x)\nSELECT x FROM t");
    }

    @Test
    void leavesPlainStatementUntouched() {
        assertThat(SqlTextNormalizer.normalize("  select 1  ")).isEqualTo("select 1");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(SqlTextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void normalizeIsIdempotent() {
        List<String> inputs = List.of(
                "```sql\nSELECT 1\n```",
                "Here you go:\nSELECT a, b\nFROM t",
                "SELECT 1",
                "no sql here at all",
                "```\n```",
                "```sql\nHere:\n```sql\nSELECT 2\n```\n```",
                ""
        );
        for (String input : inputs) {
            String once = SqlTextNormalizer.normalize(input);
            assertThat(SqlTextNormalizer.normalize(once)).as(input).isEqualTo(once);
        }
    }
}
