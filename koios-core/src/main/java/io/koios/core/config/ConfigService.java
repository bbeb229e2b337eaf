package io.koios.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.koios.core.config.model.KoiosConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public KoiosConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KoiosConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(KoiosConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, KoiosConfig.class);
    }

    /**
     * File configuration with environment overrides on top.
     */
    public KoiosConfig load(Path configPath, Map<String, String> environment) throws IOException {
        return applyEnvironment(load(configPath), environment);
    }

    public KoiosConfig applyEnvironment(KoiosConfig config, Map<String, String> environment) {
        KoiosConfig result = config;

        String openAiUrl = value(environment, "OPENAI_URL");
        if (openAiUrl != null) {
            result = result.withProviders(result.providers().withLocal(
                result.providers().local().withApiBase(withVersionSuffix(openAiUrl))
            ));
        }

        String internet = value(environment, "ENABLE_INTERNET_SEARCH");
        if (internet != null) {
            result = result.withWebSearch(result.webSearch().withEnableInternetSearch(parseFlag(internet)));
        }

        String historyDb = value(environment, "CHAT_HISTORY_DB_PATH");
        if (historyDb != null) {
            result = result.withHistory(result.history().withDbPath(historyDb));
        }

        String backend = value(environment, "KOIOS_HISTORY_BACKEND");
        if (backend != null) {
            result = result.withHistory(result.history().withBackend(backend.toLowerCase(Locale.ROOT)));
        }

        String maxMessages = value(environment, "MAX_MESSAGES_PER_USER");
        if (maxMessages != null) {
            try {
                result = result.withHistory(result.history().withMaxMessagesPerUser(Integer.parseInt(maxMessages)));
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring MAX_MESSAGES_PER_USER={}: not a number", maxMessages);
            }
        }

        String approved = value(environment, "APPROVED_USER_IDS");
        if (approved != null) {
            List<String> ids = new ArrayList<>();
            for (String id : approved.split(",")) {
                if (!id.isBlank()) {
                    ids.add(id.trim());
                }
            }
            result = result.withGateway(result.gateway().withApprovedUserIds(ids));
        }
        return result;
    }

    public void save(Path configPath, KoiosConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        KoiosConfig config;
        if (created || overwrite) {
            config = KoiosConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path dataPath = ConfigPaths.resolve(config.agent().dataDir());
        Files.createDirectories(dataPath);
        return new OnboardResult(
            configPath,
            dataPath,
            ConfigPaths.resolve(config.history().dbPath()),
            ConfigPaths.resolve(config.retrieval().dbPath()),
            created,
            overwritten
        );
    }

    public String toPrettyJson(KoiosConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    private static String value(Map<String, String> environment, String key) {
        String raw = environment == null ? null : environment.get(key);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    static boolean parseFlag(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
    }

    // OPENAI_URL names the server root; the client talks to its /v1 API
    static String withVersionSuffix(String url) {
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return trimmed.endsWith("/v1") ? trimmed : trimmed + "/v1";
    }
}
