package com.quill.ai;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayConfigTest {

    @Test
    void defaultsWhenNothingConfigured() {
        GatewayConfig config = GatewayConfig.fromEnvironment(new MockEnvironment());

        assertThat(config.baseUrl()).isEqualTo(GatewayConfig.DEFAULT_BASE_URL);
        assertThat(config.timeoutMs()).isEqualTo(GatewayConfig.DEFAULT_TIMEOUT_MS);
        assertThat(config.isEnabled()).isFalse();
        assertThat(config.isEmbeddingEnabled()).isFalse();
    }

    @Test
    void propertiesWinOverEnvironmentVariables() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("quill.ai.model", "gpt-4o-mini")
                .withProperty("QUILL_AI_MODEL", "ignored")
                .withProperty("QUILL_AI_API_KEY", "  sk-test  ")
                .withProperty("quill.ai.base-url", "http://localhost:4000//");

        GatewayConfig config = GatewayConfig.fromEnvironment(env);

        assertThat(config.model()).isEqualTo("gpt-4o-mini");
        assertThat(config.apiKey()).isEqualTo("sk-test");
        assertThat(config.baseUrl()).isEqualTo("http://localhost:4000");
        assertThat(config.isEnabled()).isTrue();
        assertThat(config.isEmbeddingEnabled()).isFalse();
    }

    @Test
    void invalidTimeoutKeepsDefault() {
        MockEnvironment env = new MockEnvironment().withProperty("quill.ai.timeout-ms", "soon");

        assertThat(GatewayConfig.fromEnvironment(env).timeoutMs()).isEqualTo(GatewayConfig.DEFAULT_TIMEOUT_MS);
    }

    @Test
    void embeddingNeedsKeyAndModel() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("quill.ai.api-key", "k")
                .withProperty("quill.ai.embedding-model", "text-embedding-3-small");

        GatewayConfig config = GatewayConfig.fromEnvironment(env);

        assertThat(config.isEmbeddingEnabled()).isTrue();
        assertThat(config.isEnabled()).isFalse();
    }
}
