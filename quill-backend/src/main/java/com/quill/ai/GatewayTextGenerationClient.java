package com.quill.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link TextGenerationClient} for an OpenAI-compatible {@code /v1/chat/completions} gateway.
 *
 * Plain HTTP plus Jackson; no vendor SDK, so any compatible gateway or local server works.
 */
@Component
public class GatewayTextGenerationClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GatewayTextGenerationClient.class);

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE = "[DONE]";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final GatewayConfig config;

    /**
     * Create a new gateway client.
     *
     * @param objectMapper Jackson object mapper
     * @param environment Spring environment for configuration
     */
    public GatewayTextGenerationClient(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.config = GatewayConfig.fromEnvironment(environment);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether generation is enabled. Never logs the API key itself.
     */
    @PostConstruct
    public void logAiConfigStatus() {
        if (config.isEnabled()) {
            log.info("AI SQL generation is ENABLED (gateway_base_url={}, model={})", config.baseUrl(), config.model());
            return;
        }
        log.warn("AI SQL generation is DISABLED (gateway_base_url={}, api_key_configured={}, model_configured={})",
                config.baseUrl(),
                config.apiKey() != null && !config.apiKey().isBlank(),
                config.model() != null && !config.model().isBlank());
    }

    @Override
    public String generate(List<ChatMessage> messages, GenerationOptions options) {
        ensureEnabled();
        HttpRequest request = buildRequest(messages, options, false);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw gatewayError(response.statusCode(), response.body());
            }
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            if (!contentNode.isTextual()) {
                throw new GenerationException("AI gateway returned no message content");
            }
            return contentNode.asText();
        } catch (IOException e) {
            throw new GenerationException("AI generation failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("AI generation interrupted", e);
        }
    }

    @Override
    public void generateStream(List<ChatMessage> messages, GenerationOptions options, Consumer<String> onChunk) {
        ensureEnabled();
        HttpRequest request = buildRequest(messages, options, true);
        try {
            HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
            try (Stream<String> lines = response.body()) {
                if (response.statusCode() >= 400) {
                    throw gatewayError(response.statusCode(), lines.collect(Collectors.joining("\n")));
                }
                Iterator<String> it = lines.iterator();
                while (it.hasNext()) {
                    String line = it.next().trim();
                    if (!line.startsWith(SSE_DATA_PREFIX)) {
                        continue;
                    }
                    String payload = line.substring(SSE_DATA_PREFIX.length()).trim();
                    if (SSE_DONE.equals(payload)) {
                        break;
                    }
                    String chunk = extractDelta(payload);
                    if (!chunk.isEmpty()) {
                        onChunk.accept(chunk);
                    }
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new GenerationException("AI streaming failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("AI streaming interrupted", e);
        }
    }

    private String extractDelta(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload).path("choices").path(0).path("delta").path("content");
            return node.isTextual() ? node.asText() : "";
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed stream event: {}", e.getOriginalMessage());
            return "";
        }
    }

    private void ensureEnabled() {
        if (!config.isEnabled()) {
            throw new GenerationException(String.join("; ", config.getDisabledWarnings()));
        }
    }

    private HttpRequest buildRequest(List<ChatMessage> messages, GenerationOptions options, boolean stream) {
        List<Map<String, String>> wireMessages = new ArrayList<>(messages.size());
        for (ChatMessage m : messages) {
            wireMessages.add(Map.of("role", m.role(), "content", m.content()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("messages", wireMessages);
        payload.put("temperature", options.temperature());
        payload.put("max_tokens", options.maxTokens());
        if (stream) {
            payload.put("stream", true);
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to encode AI request: " + e.getMessage(), e);
        }

        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
    }

    private GenerationException gatewayError(int statusCode, String body) {
        log.warn("AI gateway request failed (status_code={}, gateway_base_url={}, model={})",
                statusCode, config.baseUrl(), config.model());
        return new GenerationException("AI gateway error: HTTP " + statusCode + " - " + body);
    }
}
