package io.koios.core.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Embeddings from an OpenAI-compatible {@code /embeddings} endpoint.
 */
public final class OpenAiCompatEmbeddingClient implements EmbeddingClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl apiBase;
    private final String apiKey;
    private final String model;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiCompatEmbeddingClient(String apiBase, String apiKey, String model) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.apiKey = apiKey == null ? "" : apiKey;
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(120))
            .writeTimeout(Duration.ofSeconds(60))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public List<double[]> embed(List<String> texts) throws IOException {
        if (texts.isEmpty()) {
            return List.of();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", texts);

        Request request = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("embeddings").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + (apiKey.isBlank() ? "not-needed" : apiKey))
            .build();

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("Embedding request failed: HTTP " + response.code() + " " + body);
            }
            return parse(body, texts.size());
        }
    }

    private List<double[]> parse(String body, int expected) throws IOException {
        JsonNode data = mapper.readTree(body).path("data");
        double[][] vectors = new double[expected][];
        int position = 0;
        for (JsonNode item : data) {
            int index = item.has("index") ? item.path("index").asInt() : position;
            if (index < 0 || index >= expected) {
                throw new IOException("Embedding response index out of range: " + index);
            }
            JsonNode embedding = item.path("embedding");
            double[] vector = new double[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = embedding.get(i).asDouble();
            }
            vectors[index] = vector;
            position++;
        }

        List<double[]> result = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            if (vectors[i] == null) {
                throw new IOException("Embedding response is missing entry " + i);
            }
            result.add(vectors[i]);
        }
        return result;
    }
}
