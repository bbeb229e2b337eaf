package io.koios.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.koios.core.config.model.GatewayConfig;
import io.koios.core.graph.DecisionGraph;
import io.koios.core.graph.DecisionGraphFactory;
import io.koios.core.graph.GraphCancelledException;
import io.koios.core.graph.GraphInput;
import io.koios.core.graph.GraphResult;
import io.koios.core.graph.GraphSettings;
import io.koios.core.history.ChatHistoryStore;
import io.koios.core.model.ConversationTurn;
import io.koios.core.provider.CompletionException;
import io.koios.core.provider.ModelCatalog;
import io.koios.core.toon.ToonEncoder;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end for the decision graph. Handlers move off the IO thread;
 * graph runs happen on a bounded pool under the configured timeout, and
 * history is written only after a graph run succeeds.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    static final String USER_HEADER = "X-User-ID";
    static final double STATELESS_TEMPERATURE = 0.5;

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final int workerThreads;
    private final long timeoutSeconds;
    private final Set<String> approvedUserIds;
    private final DecisionGraphFactory graphs;
    private final ChatHistoryStore history;
    private final ModelCatalog models;
    private final ToonEncoder toon;
    private final double defaultTemperature;
    private final boolean defaultInternetSearch;

    private final ExecutorService graphExecutor;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        GatewayConfig config,
        DecisionGraphFactory graphs,
        ChatHistoryStore history,
        ModelCatalog models,
        ToonEncoder toon,
        double defaultTemperature,
        boolean defaultInternetSearch
    ) {
        this.host = config.host() == null || config.host().isBlank() ? "0.0.0.0" : config.host();
        this.requestedPort = config.port();
        this.workerThreads = Math.max(1, config.workerThreads());
        this.timeoutSeconds = Math.max(1, config.requestTimeoutSeconds());
        this.approvedUserIds = Set.copyOf(config.approvedUserIds());
        this.graphs = graphs;
        this.history = history;
        this.models = models;
        this.toon = toon;
        this.defaultTemperature = defaultTemperature;
        this.defaultInternetSearch = defaultInternetSearch;

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.graphExecutor = Executors.newFixedThreadPool(workerThreads, new GraphThreadFactory());
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/health", this::handleHealth)
            .addExactPath("/models", this::handleModels)
            .addExactPath("/query", this::handleQuery)
            .addExactPath("/history", this::handleHistory)
            .addExactPath("/analyze", this::handleAnalyze);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setWorkerThreads(workerThreads)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
        graphExecutor.shutdownNow();
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleModels(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> runHandler(exchange, this::handleModels));
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("models", models.availableModels()));
    }

    private void handleQuery(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> runHandler(exchange, this::handleQuery));
            return;
        }
        String userId = authenticate(exchange);
        if (userId == null) {
            return;
        }

        String method = exchange.getRequestMethod().toString();
        if ("GET".equalsIgnoreCase(method)) {
            handleStatelessQuery(exchange, userId);
            return;
        }
        if (!"POST".equalsIgnoreCase(method)) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        QueryRequest request = readBody(exchange, QueryRequest.class);
        if (request == null) {
            return;
        }
        if (request.query() == null || request.query().isBlank()) {
            sendJson(exchange, 400, Map.of("error", "query_required"));
            return;
        }

        String model = models.resolve(request.model());
        double temperature = request.temperature() == null ? defaultTemperature : request.temperature();
        boolean internet = request.enableInternetSearch() == null ? defaultInternetSearch : request.enableInternetSearch();

        List<ConversationTurn> priorTurns;
        try {
            priorTurns = history.getHistory(userId);
        } catch (IOException e) {
            LOG.error("Failed to load history for {}", userId, e);
            sendJson(exchange, 500, Map.of("error", "history_unavailable", "detail", String.valueOf(e.getMessage())));
            return;
        }
        LOG.info("Loaded {} history message(s) for user '{}'", priorTurns.size(), userId);

        GraphResult result = runGraph(
            exchange,
            new GraphSettings(model, temperature, internet),
            new GraphInput(request.query(), priorTurns, "")
        );
        if (result == null) {
            return;
        }

        List<ConversationTurn> newTurns = List.of(
            ConversationTurn.user(request.query()),
            ConversationTurn.assistant(result.generation())
        );
        Map<String, Object> response = queryResponse(request.query(), userId, model, result);
        try {
            history.addMessages(userId, newTurns);
        } catch (IOException e) {
            LOG.error("Answer produced but history not saved for {}", userId, e);
            response.put("error", "history_not_persisted");
            response.put("detail", String.valueOf(e.getMessage()));
            response.put("history_persisted", false);
            sendJson(exchange, 500, response);
            return;
        }

        List<ConversationTurn> updated = new ArrayList<>(priorTurns);
        updated.addAll(newTurns);
        response.put("history", toWire(updated));
        response.put("history_persisted", true);
        sendJson(exchange, 200, response);
    }

    private void handleStatelessQuery(HttpServerExchange exchange, String userId) throws IOException {
        String query = queryParam(exchange, "query");
        if (query.isBlank()) {
            sendJson(exchange, 400, Map.of("error", "query_required"));
            return;
        }
        String model = models.resolve(queryParam(exchange, "model"));

        GraphResult result = runGraph(
            exchange,
            new GraphSettings(model, STATELESS_TEMPERATURE, defaultInternetSearch),
            GraphInput.of(query, List.of())
        );
        if (result == null) {
            return;
        }
        Map<String, Object> response = queryResponse(query, userId, model, result);
        response.put("history", List.of());
        sendJson(exchange, 200, response);
    }

    private void handleHistory(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> runHandler(exchange, this::handleHistory));
            return;
        }
        String userId = authenticate(exchange);
        if (userId == null) {
            return;
        }

        String method = exchange.getRequestMethod().toString();
        if ("GET".equalsIgnoreCase(method)) {
            List<ConversationTurn> turns = history.getHistory(userId);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("user_id", userId);
            response.put("message_count", turns.size());
            response.put("history", toWire(turns));
            sendJson(exchange, 200, response);
            return;
        }
        if ("DELETE".equalsIgnoreCase(method)) {
            int deleted = history.clearHistory(userId);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("user_id", userId);
            response.put("messages_deleted", deleted);
            sendJson(exchange, 200, response);
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleAnalyze(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> runHandler(exchange, this::handleAnalyze));
            return;
        }
        String userId = authenticate(exchange);
        if (userId == null) {
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        AnalyzeRequest request = readBody(exchange, AnalyzeRequest.class);
        if (request == null) {
            return;
        }
        if (request.prompt() == null || request.prompt().isBlank()) {
            sendJson(exchange, 400, Map.of("error", "prompt_required"));
            return;
        }

        String model = models.resolve(request.model());
        double temperature = request.temperature() == null ? defaultTemperature : request.temperature();
        String context = toon.encode(Map.of("details", request.details()));

        GraphResult result = runGraph(
            exchange,
            new GraphSettings(model, temperature, false),
            new GraphInput(request.prompt(), List.of(), context)
        );
        if (result == null) {
            return;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("prompt", request.prompt());
        response.put("user_id", userId);
        response.put("generation", result.generation());
        response.put("model", model);
        response.put("details", request.details());
        sendJson(exchange, 200, response);
    }

    /**
     * Runs one graph invocation under the request timeout. Writes the error
     * response itself and returns {@code null} when no answer was produced.
     */
    private GraphResult runGraph(HttpServerExchange exchange, GraphSettings settings, GraphInput input) throws IOException {
        DecisionGraph graph = graphs.create(settings);
        Future<GraphResult> future = graphExecutor.submit(() -> graph.invoke(input));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Graph run timed out after {}s for question '{}'", timeoutSeconds, input.question());
            sendJson(exchange, 504, Map.of("error", "timeout"));
            return null;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            sendJson(exchange, 503, Map.of("error", "interrupted"));
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException completion) {
                LOG.error("Completion failed on provider {}: {}", completion.provider(), completion.getMessage());
                sendJson(exchange, 502, Map.of(
                    "error", "completion_failed",
                    "provider", String.valueOf(completion.provider()),
                    "detail", String.valueOf(completion.getMessage())
                ));
            } else if (cause instanceof GraphCancelledException) {
                sendJson(exchange, 504, Map.of("error", "timeout"));
            } else {
                LOG.error("Graph run failed", cause);
                sendJson(exchange, 500, Map.of("error", String.valueOf(cause == null ? e.getMessage() : cause.getMessage())));
            }
            return null;
        }
    }

    private Map<String, Object> queryResponse(String query, String userId, String model, GraphResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("query", query);
        response.put("user_id", userId);
        response.put("generation", result.generation());
        response.put("model", model);
        response.put("route", result.route() == null ? null : result.route().wireValue());
        response.put("search_query", result.searchQuery());
        return response;
    }

    private List<Map<String, String>> toWire(List<ConversationTurn> turns) {
        List<Map<String, String>> wire = new ArrayList<>();
        for (ConversationTurn turn : turns) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("role", turn.role().wireValue());
            row.put("content", turn.content());
            wire.add(row);
        }
        return wire;
    }

    /**
     * The caller's user id, or {@code null} after a 401 has been sent.
     */
    private String authenticate(HttpServerExchange exchange) throws IOException {
        String userId = header(exchange, USER_HEADER).trim();
        if (userId.isEmpty()) {
            sendJson(exchange, 401, Map.of("error", "missing_user_id"));
            return null;
        }
        if (!approvedUserIds.contains(userId)) {
            LOG.warn("Rejected request from unapproved user '{}'", userId);
            sendJson(exchange, 401, Map.of("error", "user_not_approved"));
            return null;
        }
        return userId;
    }

    private <T> T readBody(HttpServerExchange exchange, Class<T> type) throws IOException {
        try {
            return mapper.treeToValue(readJsonBody(exchange), type);
        } catch (JsonProcessingException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_body", "detail", e.getOriginalMessage()));
            return null;
        }
    }

    private void runHandler(HttpServerExchange exchange, ExchangeHandler handler) {
        try {
            handler.handle(exchange);
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange, e);
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.warn("Could not send error response: {}", e.getMessage());
        }
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.peekFirst();
        return value == null ? "" : value;
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }

    private static final class GraphThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "koios-graph-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
