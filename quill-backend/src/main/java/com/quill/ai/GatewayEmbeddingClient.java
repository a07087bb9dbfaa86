package com.quill.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link EmbeddingClient} for an OpenAI-compatible {@code /v1/embeddings} endpoint.
 */
@Slf4j
@Component
public class GatewayEmbeddingClient implements EmbeddingClient {

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final GatewayConfig config;

    public GatewayEmbeddingClient(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.config = GatewayConfig.fromEnvironment(environment);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public boolean isAvailable() {
        return config.isEmbeddingEnabled();
    }

    @Override
    public List<float[]> embed(List<String> inputs) {
        if (!isAvailable()) {
            throw new GenerationException("Embeddings are disabled - set QUILL_AI_API_KEY and QUILL_AI_EMBEDDING_MODEL");
        }
        if (inputs.isEmpty()) {
            return List.of();
        }
        try {
            String json = objectMapper.writeValueAsString(Map.of(
                    "model", config.embeddingModel(),
                    "input", inputs
            ));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/embeddings"))
                    .timeout(Duration.ofMillis(config.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + config.apiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warn("Embedding request failed (status_code={}, model={})", response.statusCode(), config.embeddingModel());
                throw new GenerationException("Embedding gateway error: HTTP " + response.statusCode());
            }
            return parseVectors(objectMapper.readTree(response.body()), inputs.size());
        } catch (IOException e) {
            throw new GenerationException("Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Embedding request interrupted", e);
        }
    }

    private static List<float[]> parseVectors(JsonNode root, int expected) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new GenerationException("Embedding gateway returned " + data.size() + " vectors, expected " + expected);
        }
        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            if (index < 0 || index >= expected) {
                throw new GenerationException("Embedding gateway returned out-of-range index " + index);
            }
            JsonNode values = item.path("embedding");
            float[] vector = new float[values.size()];
            for (int j = 0; j < values.size(); j++) {
                vector[j] = (float) values.get(j).asDouble();
            }
            ordered[index] = vector;
        }
        List<float[]> out = new ArrayList<>(expected);
        for (float[] vector : ordered) {
            if (vector == null) {
                throw new GenerationException("Embedding gateway response is missing vectors");
            }
            out.add(vector);
        }
        return out;
    }
}
