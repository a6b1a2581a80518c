package work.lcod.components.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;
import work.lcod.components.api.LogLevel;
import work.lcod.components.api.RuntimeConfiguration;
import work.lcod.components.definition.ComponentDefinition;
import work.lcod.components.manifest.ComponentManifestLoader;
import work.lcod.components.shared.Durations;

/**
 * Options shared by every subcommand. No logger lives in the CLI classes so {@code --log-level}
 * is applied before the first one is created.
 */
final class ManifestOptions {
    static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @CommandLine.Option(
        names = {"-m", "--manifest"},
        required = true,
        description = "Component manifest (.toml, .yaml or .yml)."
    )
    Path manifest;

    @CommandLine.Option(
        names = {"-p", "--props"},
        paramLabel = "JSON",
        description = "Prop values as a JSON object (default: {})."
    )
    String props;

    @CommandLine.Option(
        names = "--state-dir",
        description = "Directory for persisted instance state (default: in memory)."
    )
    Path stateDir;

    @CommandLine.Option(
        names = "--http-timeout",
        description = "How long an HTTP caller waits for respond() (e.g. 30s, 2m)."
    )
    String httpTimeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal)."
    )
    String logLevelRaw;

    LogLevel applyLogLevel() {
        LogLevel level = LogLevel.from(logLevelRaw);
        level.apply();
        return level;
    }

    RuntimeConfiguration configuration(LogLevel logLevel) {
        var builder = RuntimeConfiguration.builder().logLevel(logLevel);
        if (stateDir != null) {
            builder.stateDirectory(stateDir);
        }
        if (httpTimeoutRaw != null) {
            Duration timeout = Durations.parse(httpTimeoutRaw)
                .orElseThrow(() -> new IllegalArgumentException("Invalid --http-timeout: " + httpTimeoutRaw));
            builder.httpTimeout(timeout);
        }
        return builder.build();
    }

    ComponentDefinition definition() {
        return ComponentManifestLoader.load(manifest);
    }

    Map<String, Object> values() {
        return parseObject(props, "--props");
    }

    static Map<String, Object> parseObject(String raw, String option) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return new LinkedHashMap<>(JSON.readValue(raw, MAP_TYPE));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to parse " + option + " as a JSON object: " + ex.getMessage(), ex);
        }
    }

    static Object parseValue(String raw, String option) {
        if (raw == null) {
            return null;
        }
        try {
            return JSON.readValue(raw, Object.class);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to parse " + option + " as JSON: " + ex.getMessage(), ex);
        }
    }
}
