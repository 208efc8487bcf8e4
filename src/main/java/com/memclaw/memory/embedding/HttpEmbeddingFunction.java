package com.memclaw.memory.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/** OpenAI-compatible {@code /embeddings} endpoint (Ollama, vLLM, OpenAI). */
public class HttpEmbeddingFunction implements EmbeddingFunction {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final HttpClient httpClient;

    public HttpEmbeddingFunction(String baseUrl, String apiKey, String model) {
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.model = model;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Creates the function and embeds a short sample string, so a missing server or model
     * fails here instead of on the first real memory.
     */
    public static HttpEmbeddingFunction connect(String baseUrl, String apiKey, String model) throws IOException {
        var fn = new HttpEmbeddingFunction(baseUrl, apiKey, model);
        fn.embed("ping");
        return fn;
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public float[] embed(String text) throws IOException {
        var body = MAPPER.writeValueAsString(Map.of("model", model, "input", text));
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/embeddings"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling embedding endpoint", e);
        }
        if (resp.statusCode() != 200) {
            throw new IOException("Embedding API error " + resp.statusCode() + ": " + resp.body());
        }
        var arr = MAPPER.readTree(resp.body()).path("data").path(0).path("embedding");
        if (!arr.isArray() || arr.isEmpty()) {
            throw new IOException("Embedding API returned no vector");
        }
        var vec = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) {
            vec[i] = (float) arr.get(i).asDouble();
        }
        return vec;
    }
}
