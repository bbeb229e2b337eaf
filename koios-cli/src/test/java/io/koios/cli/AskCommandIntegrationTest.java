package io.koios.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.koios.core.config.ConfigService;
import io.koios.core.graph.DecisionGraphFactory;
import io.koios.core.history.ChatHistoryStore;
import io.koios.core.history.InMemoryChatHistoryStore;
import io.koios.core.model.ConversationTurn;
import io.koios.core.provider.CompletionService;
import io.koios.core.provider.OpenAiCompatProvider;
import io.koios.core.provider.ProviderRegistry;
import io.koios.core.provider.ProviderRouter;
import io.koios.core.retrieval.DocumentIngestor;
import io.koios.core.retrieval.SqliteDocumentIndex;
import io.koios.core.retrieval.TextSplitter;
import io.koios.core.search.DuckDuckGoSearchProvider;
import io.koios.core.search.WebSearchRateLimiter;
import io.koios.core.search.WebSearchService;
import io.koios.core.search.WikipediaSummaryProvider;
import io.koios.core.toon.ToonEncoder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class AskCommandIntegrationTest {

    private MockWebServer server;
    private InMemoryChatHistoryStore history;
    private CliContext context;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": { "model": "llama3.2", "temperature": 0.3 }
            }
            """, StandardCharsets.UTF_8);

        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new OpenAiCompatProvider(
            ProviderRouter.LOCAL, "", server.url("/v1").toString(), false, Map.of(), 1
        ));
        CompletionService completions = new CompletionService(new ProviderRouter(registry));
        SqliteDocumentIndex documents = new SqliteDocumentIndex(tempDir.resolve("documents.db"), texts -> {
            List<double[]> vectors = new ArrayList<>();
            for (String text : texts) {
                vectors.add(new double[] {text.length(), 1.0});
            }
            return vectors;
        });
        WebSearchService web = new WebSearchService(
            new DuckDuckGoSearchProvider(server.url("/html/").toString()),
            new WikipediaSummaryProvider(server.url("/w/api.php").toString(), 3, 4000),
            new WebSearchRateLimiter(Duration.ZERO),
            new ToonEncoder(),
            3
        );
        history = new InMemoryChatHistoryStore(500);
        context = new CliContext(
            new ConfigService(),
            configPath,
            new DecisionGraphFactory(completions, documents, web, new ToonEncoder(), 3),
            history,
            documents,
            new DocumentIngestor(documents, new TextSplitter(1000, 200))
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldAnswerThroughHttpProviderAndSaveHistory() throws Exception {
        server.enqueue(completion("{\\\"choice\\\": \\\"generate\\\"}"));
        server.enqueue(completion("Paris is the capital of France."));

        Captured captured = run(new AskCommand(context), "What is the capital of France?", "--no-internet", "-u", "alice", "-v");

        assertThat(captured.code).isZero();
        assertThat(captured.out).contains("Route: generate").contains("Paris is the capital of France.");
        assertThat(history.getHistory("alice")).containsExactly(
            ConversationTurn.user("What is the capital of France?"),
            ConversationTurn.assistant("Paris is the capital of France.")
        );

        RecordedRequest route = server.takeRequest();
        assertThat(route.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(route.getBody().readUtf8()).contains("\"model\":\"llama3.2\"").contains("json_object");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"temperature\":0.3");
    }

    @Test
    void shouldReportProviderFailure() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("model not found"));

        Captured captured = run(new AskCommand(context), "Hello?", "--no-internet", "-m", "missing-model");

        assertThat(captured.code).isEqualTo(1);
        assertThat(captured.err).contains("Ask command failed:").contains("model not found");
    }

    @Test
    void shouldPrintAnswerEvenWhenHistoryCannotBeSaved() {
        server.enqueue(completion("{\\\"choice\\\": \\\"generate\\\"}"));
        server.enqueue(completion("Paris."));
        CliContext failingHistory = new CliContext(
            context.configService(),
            context.configPath(),
            context.graphs(),
            new UnwritableHistoryStore(),
            context.documents(),
            context.ingestor()
        );

        Captured captured = run(new AskCommand(failingHistory), "Capital of France?", "--no-internet", "-u", "alice");

        assertThat(captured.code).isEqualTo(AskCommand.HISTORY_NOT_SAVED);
        assertThat(captured.out).contains("Paris.");
        assertThat(captured.err).contains("Answer not saved to history: disk is read-only");
        assertThat(captured.err).doesNotContain("Ask command failed");
    }

    @Test
    void shouldIngestListAndClearDocuments() throws Exception {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "Koios keeps answers grounded.");

        Captured ingest = run(new IngestCommand(context), notes.toString());
        Captured list = run(new DocumentsCommand(context));
        Captured clear = run(new DocumentsCommand(context), "--clear");
        Captured empty = run(new DocumentsCommand(context));

        assertThat(ingest.out).contains("Indexed notes.txt: 1 chunks").contains("Total chunks indexed: 1");
        assertThat(list.out).contains("notes.txt");
        assertThat(clear.out).contains("Removed 1 chunks");
        assertThat(empty.out).contains("No documents indexed");
    }

    @Test
    void shouldShowListAndClearHistory() throws Exception {
        history.addMessages("alice", List.of(ConversationTurn.user("hi"), ConversationTurn.assistant("hello")));

        Captured shown = run(new HistoryCommand(context), "alice");
        Captured users = run(new HistoryCommand(context), "--users");
        Captured cleared = run(new HistoryCommand(context), "alice", "--clear");
        Captured missingUser = run(new HistoryCommand(context));

        assertThat(shown.out).contains("user: hi").contains("assistant: hello");
        assertThat(users.out).contains("alice (2 messages)");
        assertThat(cleared.out).contains("Deleted 2 messages for alice");
        assertThat(missingUser.code).isEqualTo(1);
    }

    @Test
    void shouldDelegateGatewayToRunner() {
        List<Integer> ports = new ArrayList<>();
        CliContext withRunner = new CliContext(
            context.configService(),
            context.configPath(),
            context.graphs(),
            context.history(),
            context.documents(),
            context.ingestor(),
            port -> {
                ports.add(port);
                return 0;
            }
        );

        assertThat(run(new GatewayCommand(withRunner), "--port", "9090").code).isZero();
        assertThat(run(new GatewayCommand(context)).code).isEqualTo(1);
        assertThat(ports).containsExactly(9090);
    }

    private static MockResponse completion(String content) {
        return new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"" + content + "\"}}]}");
    }

    private static Captured run(Object command, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            return new Captured(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Captured(int code, String out, String err) {
    }

    private static final class UnwritableHistoryStore implements ChatHistoryStore {
        @Override
        public List<ConversationTurn> getHistory(String userId) {
            return List.of();
        }

        @Override
        public void addMessages(String userId, List<ConversationTurn> messages) throws IOException {
            throw new IOException("disk is read-only");
        }

        @Override
        public int clearHistory(String userId) {
            return 0;
        }

        @Override
        public int messageCount(String userId) {
            return 0;
        }

        @Override
        public List<String> listUsers() {
            return List.of();
        }

        @Override
        public int maxMessagesPerUser() {
            return 500;
        }
    }
}
