package io.koios.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the models served by the local OpenAI-compatible endpoint.
 */
public final class ModelCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(ModelCatalog.class);

    private final HttpUrl apiBase;
    private final String apiKey;
    private final String defaultModel;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public ModelCatalog(String apiBase, String apiKey, String defaultModel) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.apiKey = apiKey == null ? "" : apiKey;
        this.defaultModel = Objects.requireNonNull(defaultModel, "defaultModel must not be null");
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(Duration.ofSeconds(10))
            .build();
        this.mapper = new ObjectMapper();
    }

    /**
     * Model ids reported by {@code GET {apiBase}/models}, or the default model
     * alone when the endpoint cannot be reached or lists nothing.
     */
    public List<String> availableModels() {
        Request request = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("models").build())
            .get()
            .header("Authorization", "Bearer " + (apiKey.isBlank() ? "not-needed" : apiKey))
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                LOG.warn("Model listing returned HTTP {}, using default model {}", response.code(), defaultModel);
                return List.of(defaultModel);
            }
            JsonNode root = mapper.readTree(response.body().string());
            List<String> models = new ArrayList<>();
            for (JsonNode item : root.path("data")) {
                String id = item.path("id").asText("");
                if (!id.isBlank()) {
                    models.add(id);
                }
            }
            return models.isEmpty() ? List.of(defaultModel) : List.copyOf(models);
        } catch (IOException e) {
            LOG.warn("Model listing failed, using default model {}: {}", defaultModel, e.getMessage());
            return List.of(defaultModel);
        }
    }

    public String defaultModel() {
        return defaultModel;
    }

    /**
     * The requested model when given, otherwise the first model the server lists.
     */
    public String resolve(String requestedModel) {
        if (requestedModel != null && !requestedModel.isBlank()) {
            return requestedModel;
        }
        return availableModels().get(0);
    }
}
