package io.koios.app;

import io.koios.cli.AskCommand;
import io.koios.cli.CliContext;
import io.koios.cli.DocumentsCommand;
import io.koios.cli.GatewayCommand;
import io.koios.cli.HistoryCommand;
import io.koios.cli.IngestCommand;
import io.koios.cli.KoiosCliCommand;
import io.koios.cli.OnboardCommand;
import io.koios.cli.StatusCommand;
import io.koios.core.api.GatewayServer;
import io.koios.core.config.ConfigPaths;
import io.koios.core.config.ConfigService;
import io.koios.core.config.model.GatewayConfig;
import io.koios.core.config.model.HistoryConfig;
import io.koios.core.config.model.KoiosConfig;
import io.koios.core.config.model.ProviderConfig;
import io.koios.core.config.model.ProvidersConfig;
import io.koios.core.config.model.WebSearchConfig;
import io.koios.core.graph.DecisionGraphFactory;
import io.koios.core.history.ChatHistoryStore;
import io.koios.core.history.InMemoryChatHistoryStore;
import io.koios.core.history.SqliteChatHistoryStore;
import io.koios.core.provider.AnthropicProvider;
import io.koios.core.provider.CompletionService;
import io.koios.core.provider.DisabledProvider;
import io.koios.core.provider.FallbackLlmProvider;
import io.koios.core.provider.LlmProvider;
import io.koios.core.provider.ModelCatalog;
import io.koios.core.provider.OpenAiCompatProvider;
import io.koios.core.provider.ProviderRegistry;
import io.koios.core.provider.ProviderRouter;
import io.koios.core.retrieval.DocumentIngestor;
import io.koios.core.retrieval.OpenAiCompatEmbeddingClient;
import io.koios.core.retrieval.SqliteDocumentIndex;
import io.koios.core.retrieval.TextSplitter;
import io.koios.core.search.BraveSearchProvider;
import io.koios.core.search.DuckDuckGoSearchProvider;
import io.koios.core.search.WebSearchProvider;
import io.koios.core.search.WebSearchRateLimiter;
import io.koios.core.search.WebSearchService;
import io.koios.core.search.WikipediaSummaryProvider;
import io.koios.core.toon.ToonEncoder;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KoiosApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KoiosApplication.class);
    private static final String OPENAI_API_BASE = "https://api.openai.com/v1";
    private static final String ANTHROPIC_API_BASE = "https://api.anthropic.com/v1";

    private KoiosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        KoiosConfig config = loadConfig(configService, configPath);

        LlmProvider local = new OpenAiCompatProvider(
            ProviderRouter.LOCAL,
            config.providers().local().apiKey(),
            apiBase(config.providers().local(), ProvidersConfig.DEFAULT_LOCAL_API_BASE),
            false,
            headers(config.providers().local()),
            3
        );
        LlmProvider openai = buildOpenAiProvider(config.providers().openai());
        LlmProvider anthropic = buildAnthropicProvider(config.providers().anthropic());

        ProviderRegistry providerRegistry = new ProviderRegistry();
        providerRegistry.register(local);
        providerRegistry.register(new FallbackLlmProvider("openai", List.of(openai, anthropic)));
        providerRegistry.register(new FallbackLlmProvider("anthropic", List.of(anthropic, openai)));

        CompletionService completions = new CompletionService(
            new ProviderRouter(providerRegistry),
            config.agent().provider()
        );
        ModelCatalog models = new ModelCatalog(
            apiBase(config.providers().local(), ProvidersConfig.DEFAULT_LOCAL_API_BASE),
            config.providers().local().apiKey(),
            config.agent().model()
        );

        ToonEncoder toon = new ToonEncoder();
        SqliteDocumentIndex documents = openDocumentIndex(config);
        DocumentIngestor ingestor = new DocumentIngestor(
            documents,
            new TextSplitter(config.retrieval().chunkSize(), config.retrieval().chunkOverlap())
        );
        WebSearchService webSearch = buildWebSearch(config.webSearch(), toon);
        DecisionGraphFactory graphs = new DecisionGraphFactory(
            completions,
            documents,
            webSearch,
            toon,
            config.retrieval().topK()
        );
        ChatHistoryStore history = buildHistoryStore(config.history());

        CliContext context = new CliContext(
            configService,
            configPath,
            graphs,
            history,
            documents,
            ingestor,
            port -> runGateway(config.gateway(), port, graphs, history, models, toon, config)
        );

        CommandLine commandLine = new CommandLine(new KoiosCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("history", new HistoryCommand(context));
        commandLine.addSubcommand("ingest", new IngestCommand(context));
        commandLine.addSubcommand("documents", new DocumentsCommand(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static KoiosConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath, Map.copyOf(System.getenv()));
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return configService.applyEnvironment(KoiosConfig.defaults(), Map.copyOf(System.getenv()));
        }
    }

    private static LlmProvider buildOpenAiProvider(ProviderConfig providerConfig) {
        if (providerConfig != null && providerConfig.configured()) {
            return new OpenAiCompatProvider(
                "openai",
                providerConfig.apiKey(),
                apiBase(providerConfig, OPENAI_API_BASE),
                true,
                headers(providerConfig),
                3
            );
        }
        return new DisabledProvider("openai", "missing API key");
    }

    private static LlmProvider buildAnthropicProvider(ProviderConfig providerConfig) {
        if (providerConfig != null && providerConfig.configured()) {
            return new AnthropicProvider("anthropic", providerConfig.apiKey(), apiBase(providerConfig, ANTHROPIC_API_BASE));
        }
        return new DisabledProvider("anthropic", "missing API key");
    }

    private static String apiBase(ProviderConfig providerConfig, String defaultBase) {
        return providerConfig == null || providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
            ? defaultBase
            : providerConfig.apiBase();
    }

    private static Map<String, String> headers(ProviderConfig providerConfig) {
        return providerConfig == null || providerConfig.extraHeaders() == null ? Map.of() : providerConfig.extraHeaders();
    }

    private static SqliteDocumentIndex openDocumentIndex(KoiosConfig config) {
        Path dbPath = ConfigPaths.resolve(config.retrieval().dbPath());
        try {
            return new SqliteDocumentIndex(
                dbPath,
                new OpenAiCompatEmbeddingClient(
                    apiBase(config.providers().local(), ProvidersConfig.DEFAULT_LOCAL_API_BASE),
                    config.providers().local().apiKey(),
                    config.retrieval().embeddingModel()
                )
            );
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize document index at " + dbPath, e);
        }
    }

    private static WebSearchService buildWebSearch(WebSearchConfig webSearch, ToonEncoder toon) {
        WebSearchProvider primary = "brave".equals(webSearch.provider().toLowerCase(Locale.ROOT))
            ? new BraveSearchProvider(webSearch.braveApiKey())
            : new DuckDuckGoSearchProvider();
        return new WebSearchService(
            primary,
            new WikipediaSummaryProvider(webSearch.wikipediaEndpoint(), 3, 4000),
            new WebSearchRateLimiter(Duration.ofMillis(webSearch.minIntervalMillis())),
            toon,
            webSearch.maxResults()
        );
    }

    private static ChatHistoryStore buildHistoryStore(HistoryConfig history) {
        if ("memory".equals(history.backend())) {
            return new InMemoryChatHistoryStore(history.maxMessagesPerUser());
        }
        Path dbPath = ConfigPaths.resolve(history.dbPath());
        try {
            return new SqliteChatHistoryStore(dbPath, history.maxMessagesPerUser());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize SQLite chat history store at " + dbPath, e);
        }
    }

    private static int runGateway(
        GatewayConfig gateway,
        Integer portOverride,
        DecisionGraphFactory graphs,
        ChatHistoryStore history,
        ModelCatalog models,
        ToonEncoder toon,
        KoiosConfig config
    ) throws Exception {
        GatewayConfig effective = portOverride == null
            ? gateway
            : new GatewayConfig(gateway.host(), portOverride, gateway.workerThreads(),
                gateway.requestTimeoutSeconds(), gateway.approvedUserIds());
        if (effective.approvedUserIds().isEmpty()) {
            LOG.warn("No approved user ids configured; every query will be rejected. Set APPROVED_USER_IDS.");
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(
            effective,
            graphs,
            history,
            models,
            toon,
            config.agent().temperature(),
            config.webSearch().enableInternetSearch()
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: GET /healthz, GET /models, POST|GET /query, GET|DELETE /history, POST /analyze");
            shutdown.await();
        }
        return 0;
    }
}
