package com.quill.ai;

import org.springframework.core.env.Environment;

import java.util.List;

/**
 * Immutable OpenAI-compatible gateway configuration resolved from Spring properties, falling
 * back to environment variables.
 */
public record GatewayConfig(
        String baseUrl,
        String apiKey,
        String model,
        String embeddingModel,
        int timeoutMs
) {
    static final String DEFAULT_BASE_URL = "https://api.openai.com";
    static final int DEFAULT_TIMEOUT_MS = 30000;

    public static GatewayConfig fromEnvironment(Environment environment) {
        String baseUrl = getTrimmed(environment, "quill.ai.base-url", "QUILL_AI_BASE_URL");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        int timeoutMs = DEFAULT_TIMEOUT_MS;
        String timeoutRaw = getTrimmed(environment, "quill.ai.timeout-ms", "QUILL_AI_TIMEOUT_MS");
        if (timeoutRaw != null && !timeoutRaw.isBlank()) {
            try {
                timeoutMs = Integer.parseInt(timeoutRaw);
            } catch (NumberFormatException ignored) {
                // Keep default
            }
        }

        return new GatewayConfig(
                baseUrl,
                getTrimmed(environment, "quill.ai.api-key", "QUILL_AI_API_KEY"),
                getTrimmed(environment, "quill.ai.model", "QUILL_AI_MODEL"),
                getTrimmed(environment, "quill.ai.embedding-model", "QUILL_AI_EMBEDDING_MODEL"),
                timeoutMs
        );
    }

    public boolean isEnabled() {
        return hasText(apiKey) && hasText(model);
    }

    public boolean isEmbeddingEnabled() {
        return hasText(apiKey) && hasText(embeddingModel);
    }

    public List<String> getDisabledWarnings() {
        return List.of(
                "AI generation is disabled - missing gateway configuration",
                "Required env: QUILL_AI_API_KEY, QUILL_AI_MODEL",
                "Optional env: QUILL_AI_BASE_URL, QUILL_AI_EMBEDDING_MODEL, QUILL_AI_TIMEOUT_MS"
        );
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }

    private static String getTrimmed(Environment environment, String propKey, String envKey) {
        if (environment == null) {
            return null;
        }
        String v = environment.getProperty(propKey);
        if (v == null || v.isBlank()) {
            v = environment.getProperty(envKey);
        }
        return v != null ? v.trim() : null;
    }
}
