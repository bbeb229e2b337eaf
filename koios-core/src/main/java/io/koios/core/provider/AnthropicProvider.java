package io.koios.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.koios.core.model.ChatMessage;
import io.koios.core.model.MessageRole;
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
 * Anthropic messages API. The API has no JSON response mode, so JSON requests
 * get an extra system instruction and rely on structured-output extraction
 * downstream.
 */
public final class AnthropicProvider implements LlmProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String JSON_ONLY_INSTRUCTION = "Respond with a single JSON object and nothing else.";

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, CompletionOptions options) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name);
        }

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request request = buildRequest(model, messages, options);
                try (Response response = client.newCall(request).execute()) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            sleep(delayMs);
                            delayMs = Math.min(delayMs * 2, 2000);
                            continue;
                        }
                        return LlmResponse.error(
                            "HTTP " + response.code() + " " + errorBody,
                            Map.of("http_status", response.code())
                        );
                    }

                    if (response.body() == null) {
                        return new LlmResponse("", Map.of());
                    }
                    return parseResponse(response.body().string());
                }
            } catch (IOException ioe) {
                if (attempt < maxAttempts && !Thread.currentThread().isInterrupted()) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                return LlmResponse.error(String.valueOf(ioe.getMessage()));
            } catch (Exception e) {
                return LlmResponse.error(String.valueOf(e.getMessage()));
            }
        }

        return LlmResponse.error("exhausted retries");
    }

    private Request buildRequest(String model, List<ChatMessage> messages, CompletionOptions options) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", 4096);
        payload.put("temperature", Math.min(1.0, options.temperature()));
        payload.put("messages", toWireMessages(messages));

        String systemPrompt = extractSystemPrompt(messages);
        if (options.responseFormat() == ResponseFormat.JSON) {
            systemPrompt = systemPrompt.isBlank() ? JSON_ONLY_INSTRUCTION : systemPrompt + "\n\n" + JSON_ONLY_INSTRUCTION;
        }
        if (!systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(messagesUrl())
            .post(body)
            .header("x-api-key", apiKey)
            .header("anthropic-version", "2023-06-01")
            .header("content-type", "application/json")
            .build();
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireValue());
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String extractSystemPrompt(List<ChatMessage> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .reduce("", (a, b) -> a.isBlank() ? b : a + "\n\n" + b);
    }

    private LlmResponse parseResponse(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        StringBuilder content = new StringBuilder();
        for (JsonNode item : root.path("content")) {
            if ("text".equals(item.path("type").asText(""))) {
                content.append(item.path("text").asText(""));
            }
        }

        Map<String, Object> usage = root.hasNonNull("usage")
            ? mapper.convertValue(root.path("usage"), new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new LlmResponse(content.toString(), usage);
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
