package io.chessucimcp.mcp.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.chessucimcp.core.model.OptionValue;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from an optional YAML file, an environment variable overlay and
 * the command line, in increasing order of precedence.
 *
 * <p>
 * The YAML file is {@code --config <path>} when given (it must then exist), otherwise the first
 * existing file of {@code ./chess-uci-mcp.yaml}, {@code ~/.config/chess-uci-mcp/config.yaml}
 * and {@code /etc/chess-uci-mcp/config.yaml}. Without any, defaults from
 * {@link ServerConfig.Builder} apply.
 *
 * <p>
 * An env var is considered "set" if and only if it is defined AND its trimmed value is
 * non-empty; empty or whitespace-only values leave the YAML value in place.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "chess-uci-mcp.yaml";
    static final String USER_CONFIG_FILE = ".config/chess-uci-mcp/config.yaml";
    static final String SYSTEM_CONFIG_FILE = "/etc/chess-uci-mcp/config.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration for the given command line, reading overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is unreadable, a value is malformed, or no
     *                             engine path is configured
     */
    public static ServerConfig load(CommandLineArgs cli) {
        return load(cli, System::getenv);
    }

    /**
     * Loads configuration for the given command line, reading overrides from {@code envLookup}.
     * Returning {@code null} from the lookup means the variable is not defined.
     */
    public static ServerConfig load(CommandLineArgs cli, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        Optional<Path> configPath = resolveConfigPath(cli);
        if (configPath.isPresent()) {
            mapYaml(readYaml(configPath.get()), builder);
        }
        applyEnvOverrides(builder, envLookup);
        applyCommandLine(builder, cli);

        ServerConfig config = builder.build();
        try {
            config.toEngineSettings();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid engine settings: " + e.getMessage(), e);
        }
        return config;
    }

    /**
     * Resolves the YAML file to read: {@code --config} when given, otherwise the first default
     * location that holds a regular file.
     *
     * @throws ConfigLoadException if {@code --config} names a missing file
     */
    public static Optional<Path> resolveConfigPath(CommandLineArgs cli) {
        return resolveConfigPath(cli, defaultConfigLocations());
    }

    static Optional<Path> resolveConfigPath(CommandLineArgs cli, List<Path> searchPath) {
        if (cli.configPath() != null) {
            if (!Files.exists(cli.configPath())) {
                throw new ConfigLoadException("Configuration file not found: " + cli.configPath());
            }
            return Optional.of(cli.configPath());
        }
        return searchPath.stream().filter(Files::isRegularFile).findFirst();
    }

    /** Working directory, then user, then system configuration. */
    static List<Path> defaultConfigLocations() {
        return List.of(
                Path.of(DEFAULT_CONFIG_FILE),
                Path.of(System.getProperty("user.home"), USER_CONFIG_FILE),
                Path.of(SYSTEM_CONFIG_FILE));
    }

    private static JsonNode readYaml(Path configPath) {
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return root;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Maps a parsed YAML tree onto the builder. */
    private static void mapYaml(JsonNode root, ServerConfig.Builder builder) {
        // Engine section
        JsonNode engine = root.path("engine");
        if (engine.hasNonNull("path")) builder.enginePath(expandHome(engine.get("path").asText()));
        if (engine.hasNonNull("name")) builder.engineName(engine.get("name").asText());
        if (engine.has("handshake-timeout-ms"))
            builder.handshakeTimeoutMs(intValue(engine, "handshake-timeout-ms"));
        if (engine.has("quit-grace-ms")) builder.quitGraceMs(intValue(engine, "quit-grace-ms"));

        JsonNode options = engine.path("options");
        if (!options.isMissingNode() && !options.isNull()) {
            if (!options.isObject()) {
                throw new ConfigLoadException("engine.options must be a mapping of option name to value");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = options.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.engineOption(field.getKey(), optionValue(field.getKey(), field.getValue()));
            }
        }

        // Analysis section
        JsonNode analysis = root.path("analysis");
        if (analysis.has("default-think-time-ms"))
            builder.defaultThinkTimeMs(intValue(analysis, "default-think-time-ms"));
        if (analysis.has("slack-ms")) builder.analysisSlackMs(intValue(analysis, "slack-ms"));
        if (analysis.has("best-move-grace-ms"))
            builder.bestMoveGraceMs(intValue(analysis, "best-move-grace-ms"));
        if (analysis.has("sync-timeout-ms")) builder.syncTimeoutMs(intValue(analysis, "sync-timeout-ms"));

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(ServerConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "CHESS_ENGINE_PATH", value -> builder.enginePath(expandHome(value)));
        envString(envLookup, "CHESS_ENGINE_NAME", builder::engineName);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "CHESS_THINK_TIME_MS", builder::defaultThinkTimeMs);
        envInt(envLookup, "CHESS_HANDSHAKE_TIMEOUT_MS", builder::handshakeTimeoutMs);
    }

    private static void applyCommandLine(ServerConfig.Builder builder, CommandLineArgs cli) {
        if (cli.enginePath() != null) builder.enginePath(expandHome(cli.enginePath()));
        // Typed against the advertised option type once the engine has answered uci
        cli.uciOptions().forEach((name, value) -> builder.engineOption(name, OptionValue.ofString(value)));
        if (cli.thinkTimeMs() != null) builder.defaultThinkTimeMs(cli.thinkTimeMs());
        if (cli.debug() != null) builder.loggingLevel(cli.debug() ? "DEBUG" : "INFO");
    }

    /** Replaces a leading {@code ~} with the user's home directory. */
    static Path expandHome(String path) {
        String trimmed = path.trim();
        if (trimmed.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (trimmed.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), trimmed.substring(2));
        }
        return Path.of(trimmed);
    }

    private static OptionValue optionValue(String name, JsonNode node) {
        if (node.isNull()) {
            return OptionValue.none();
        }
        if (node.isBoolean()) {
            return OptionValue.ofBoolean(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return OptionValue.ofInteger(node.longValue());
        }
        if (node.isTextual()) {
            return OptionValue.ofString(node.textValue());
        }
        throw new ConfigLoadException(
                "engine.options." + name + " must be a boolean, integer or string, got " + node.getNodeType());
    }

    private static int intValue(JsonNode section, String field) {
        JsonNode node = section.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigLoadException("Expected an integer for '" + field + "', got '" + node.asText() + "'");
        }
        return node.intValue();
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Environment variable " + envVar + " must be an integer, got '" + raw
                        + "'", e);
            }
        }
    }
}
