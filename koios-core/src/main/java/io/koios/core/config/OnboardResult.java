package io.koios.core.config;

import java.nio.file.Path;

/**
 * Outcome of {@link ConfigService#onboard}: where the config and the SQLite databases live.
 */
public record OnboardResult(
    Path configPath,
    Path dataPath,
    Path historyDbPath,
    Path documentsDbPath,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
