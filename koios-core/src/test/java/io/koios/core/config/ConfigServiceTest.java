package io.koios.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.koios.core.config.model.KoiosConfig;
import io.koios.core.config.model.ProvidersConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        KoiosConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.agent().model()).isEqualTo("llama3.2");
        assertThat(config.agent().temperature()).isEqualTo(0.5);
        assertThat(config.providers().local().apiBase()).isEqualTo(ProvidersConfig.DEFAULT_LOCAL_API_BASE);
        assertThat(config.providers().openai().configured()).isFalse();
        assertThat(config.webSearch().enableInternetSearch()).isFalse();
        assertThat(config.webSearch().maxResults()).isEqualTo(3);
        assertThat(config.history().maxMessagesPerUser()).isEqualTo(500);
        assertThat(config.retrieval().topK()).isEqualTo(3);
        assertThat(config.gateway().approvedUserIds()).isEmpty();
    }

    @Test
    void shouldMergeFileValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": { "model": "qwen2.5-7b-instruct" },
              "providers": { "openai": { "apiKey": "sk-test" } },
              "history": { "maxMessagesPerUser": 50 },
              "unknownSection": { "ignored": true }
            }
            """);

        KoiosConfig config = service.load(configPath);

        assertThat(config.agent().model()).isEqualTo("qwen2.5-7b-instruct");
        assertThat(config.agent().temperature()).isEqualTo(0.5);
        assertThat(config.providers().openai().apiKey()).isEqualTo("sk-test");
        assertThat(config.providers().anthropic().configured()).isFalse();
        assertThat(config.history().maxMessagesPerUser()).isEqualTo(50);
        assertThat(config.history().backend()).isEqualTo("sqlite");
    }

    @Test
    void shouldApplyEnvironmentOverrides() throws Exception {
        ConfigService service = new ConfigService();

        KoiosConfig config = service.load(tempDir.resolve("config.json"), Map.of(
            "OPENAI_URL", "http://localhost:11434/",
            "ENABLE_INTERNET_SEARCH", "Yes",
            "CHAT_HISTORY_DB_PATH", "/var/lib/koios/chat.db",
            "KOIOS_HISTORY_BACKEND", "MEMORY",
            "MAX_MESSAGES_PER_USER", "20",
            "APPROVED_USER_IDS", "alice, bob,,carol "
        ));

        assertThat(config.providers().local().apiBase()).isEqualTo("http://localhost:11434/v1");
        assertThat(config.webSearch().enableInternetSearch()).isTrue();
        assertThat(config.history().dbPath()).isEqualTo("/var/lib/koios/chat.db");
        assertThat(config.history().backend()).isEqualTo("memory");
        assertThat(config.history().maxMessagesPerUser()).isEqualTo(20);
        assertThat(config.gateway().approvedUserIds()).containsExactly("alice", "bob", "carol");
    }

    @Test
    void shouldIgnoreMalformedNumbersAndBlankValues() {
        ConfigService service = new ConfigService();

        KoiosConfig config = service.applyEnvironment(KoiosConfig.defaults(), Map.of(
            "MAX_MESSAGES_PER_USER", "lots",
            "OPENAI_URL", "  "
        ));

        assertThat(config.history().maxMessagesPerUser()).isEqualTo(500);
        assertThat(config.providers().local().apiBase()).isEqualTo(ProvidersConfig.DEFAULT_LOCAL_API_BASE);
    }

    @Test
    void shouldParseFlagsAndVersionSuffix() {
        assertThat(ConfigService.parseFlag("TRUE")).isTrue();
        assertThat(ConfigService.parseFlag("1")).isTrue();
        assertThat(ConfigService.parseFlag("false")).isFalse();
        assertThat(ConfigService.parseFlag("no")).isFalse();
        assertThat(ConfigService.withVersionSuffix("http://host:1234/v1/")).isEqualTo("http://host:1234/v1");
        assertThat(ConfigService.withVersionSuffix("http://host:1234")).isEqualTo("http://host:1234/v1");
    }

    @Test
    void onboardShouldKeepExistingConfigAndCreateDataDir() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".koios/config.json");
        Path dataDir = tempDir.resolve("data");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"agent\": {\"dataDir\": \"" + dataDir.toString().replace("\\", "\\\\") + "\", \"model\": \"phi-4\"}}");

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(result.dataPath()).isEqualTo(dataDir);
        assertThat(result.historyDbPath().getFileName().toString()).isEqualTo("chat_history.db");
        assertThat(result.documentsDbPath().getFileName().toString()).isEqualTo("documents.db");
        assertThat(Files.isDirectory(dataDir)).isTrue();
        assertThat(service.load(configPath).agent().model()).isEqualTo("phi-4");
        assertThat(Files.readString(configPath)).contains("\"webSearch\"");
    }
}
