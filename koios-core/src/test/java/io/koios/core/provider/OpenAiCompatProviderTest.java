package io.koios.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.koios.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseJsonCompletionResponse() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "hello from json" } }
                  ],
                  "usage": { "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai",
            "sk-test",
            server.url("/v1").toString(),
            true,
            Map.of("X-App", "koios"),
            1
        );

        LlmResponse response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), CompletionOptions.text(0.5));

        assertThat(response.failed()).isFalse();
        assertThat(response.content()).isEqualTo("hello from json");
        assertThat(response.usage()).containsEntry("total_tokens", 42);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-App")).isEqualTo("koios");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"stream\":true");
        assertThat(body).contains("\"temperature\":0.5");
        assertThat(body).doesNotContain("response_format");
    }

    @Test
    void shouldConcatenateSseDeltas() {
        String sse = """
            data: {"choices":[{"delta":{"content":"hello "}}]}

            data: {"choices":[{"delta":{"content":"world"}}]}

            data: {"usage":{"total_tokens":13}}

            data: [DONE]

            """;
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(sse));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("local", "", server.url("/v1").toString(), false);

        LlmResponse response = provider.chat("llama3.2", List.of(ChatMessage.user("hi")), CompletionOptions.text(0.0));

        assertThat(response.content()).isEqualTo("hello world");
        assertThat(response.usage()).containsEntry("total_tokens", 13);
    }

    @Test
    void shouldRequestJsonObjectInJsonMode() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"{\\\"choice\\\":\\\"generate\\\"}\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("local", "", server.url("/v1").toString(), false);

        LlmResponse response = provider.chat("llama3.2", List.of(ChatMessage.user("route me")), CompletionOptions.json());

        assertThat(response.content()).isEqualTo("{\"choice\":\"generate\"}");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer not-needed");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"response_format\":{\"type\":\"json_object\"}");
        assertThat(body).contains("\"temperature\":0.0");
    }

    @Test
    void shouldReportHttpErrorsWithErrorPrefix() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("bad model"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("local", "", server.url("/v1").toString(), false);

        LlmResponse response = provider.chat("missing", List.of(ChatMessage.user("hi")), CompletionOptions.text(0.5));

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).startsWith("Error calling LLM:").contains("HTTP 400").contains("bad model");
        assertThat(response.usage()).containsEntry("http_status", 400);
    }

    @Test
    void shouldRetryServerErrors() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"recovered\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "local", "", server.url("/v1").toString(), false, Map.of(), 2
        );

        LlmResponse response = provider.chat("llama3.2", List.of(ChatMessage.user("hi")), CompletionOptions.text(0.5));

        assertThat(response.content()).isEqualTo("recovered");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectMissingKeyWhenRequired() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", " ", server.url("/v1").toString(), true);

        LlmResponse response = provider.chat("gpt-4.1", List.of(ChatMessage.user("hi")), CompletionOptions.text(0.5));

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("missing API key");
        assertThat(server.getRequestCount()).isZero();
    }
}
