package io.chessucimcp.mcp.config;

import io.chessucimcp.core.model.EngineSettings;
import io.chessucimcp.core.model.OptionValue;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration of the MCP server, merged from YAML, environment and command line.
 *
 * <p>
 * All fields provide defaults except {@code enginePath}, which is required. Use
 * {@link #builder()} to construct instances with the builder pattern.
 *
 * @param enginePath         UCI engine executable ({@code engine.path})
 * @param engineName         display name reported by {@code engine_info}; defaults to the
 *                           executable's file name ({@code engine.name})
 * @param engineOptions      UCI options applied during the handshake, in order
 *                           ({@code engine.options}, {@code -o NAME VALUE})
 * @param defaultThinkTimeMs think time when a tool call omits {@code time_ms}
 *                           ({@code analysis.default-think-time-ms}, {@code --think-time})
 * @param handshakeTimeoutMs bound for {@code uciok}/{@code readyok}
 *                           ({@code engine.handshake-timeout-ms})
 * @param quitGraceMs        wait for a voluntary exit after {@code quit}
 *                           ({@code engine.quit-grace-ms})
 * @param analysisSlackMs    analysis read deadline beyond the think time
 *                           ({@code analysis.slack-ms})
 * @param bestMoveGraceMs    best-move read deadline beyond the think time
 *                           ({@code analysis.best-move-grace-ms})
 * @param syncTimeoutMs      bound for option sync and abandoned-search drain
 *                           ({@code analysis.sync-timeout-ms})
 * @param loggingFormat      json or text ({@code logging.format})
 * @param loggingLevel       root log level ({@code logging.level}, {@code --debug})
 */
public record ServerConfig(
        Path enginePath,
        String engineName,
        Map<String, OptionValue> engineOptions,
        int defaultThinkTimeMs,
        int handshakeTimeoutMs,
        int quitGraceMs,
        int analysisSlackMs,
        int bestMoveGraceMs,
        int syncTimeoutMs,
        String loggingFormat,
        String loggingLevel) {

    public ServerConfig {
        engineOptions = Collections.unmodifiableMap(new LinkedHashMap<>(engineOptions));
    }

    /** Creates a new builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Settings for the engine bridge derived from this configuration. */
    public EngineSettings toEngineSettings() {
        return EngineSettings.builder(enginePath)
                .options(engineOptions)
                .defaultThinkTimeMs(defaultThinkTimeMs)
                .handshakeTimeoutMs(handshakeTimeoutMs)
                .quitGraceMs(quitGraceMs)
                .analysisSlackMs(analysisSlackMs)
                .bestMoveGraceMs(bestMoveGraceMs)
                .syncTimeoutMs(syncTimeoutMs)
                .build();
    }

    /**
     * Builder for {@link ServerConfig}. All fields have defaults except {@code enginePath}.
     */
    public static final class Builder {
        private Path enginePath;
        private String engineName;
        private final Map<String, OptionValue> engineOptions = new LinkedHashMap<>();
        private int defaultThinkTimeMs = 1000;
        private int handshakeTimeoutMs = 10_000;
        private int quitGraceMs = 2000;
        private int analysisSlackMs = 500;
        private int bestMoveGraceMs = 5000;
        private int syncTimeoutMs = 2000;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder enginePath(Path enginePath) {
            this.enginePath = enginePath;
            return this;
        }

        public Builder engineName(String engineName) {
            this.engineName = engineName;
            return this;
        }

        /** Adds or replaces one engine option; first insertion fixes its position. */
        public Builder engineOption(String name, OptionValue value) {
            this.engineOptions.put(name, value);
            return this;
        }

        public Builder defaultThinkTimeMs(int defaultThinkTimeMs) {
            this.defaultThinkTimeMs = defaultThinkTimeMs;
            return this;
        }

        public Builder handshakeTimeoutMs(int handshakeTimeoutMs) {
            this.handshakeTimeoutMs = handshakeTimeoutMs;
            return this;
        }

        public Builder quitGraceMs(int quitGraceMs) {
            this.quitGraceMs = quitGraceMs;
            return this;
        }

        public Builder analysisSlackMs(int analysisSlackMs) {
            this.analysisSlackMs = analysisSlackMs;
            return this;
        }

        public Builder bestMoveGraceMs(int bestMoveGraceMs) {
            this.bestMoveGraceMs = bestMoveGraceMs;
            return this;
        }

        public Builder syncTimeoutMs(int syncTimeoutMs) {
            this.syncTimeoutMs = syncTimeoutMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the {@link ServerConfig}, deriving {@code engineName} from the executable when
         * not set.
         *
         * @throws ConfigLoadException if no engine path was configured
         */
        public ServerConfig build() {
            if (enginePath == null) {
                throw new ConfigLoadException("Engine path is required. Pass ENGINE_PATH, set "
                        + "CHESS_ENGINE_PATH, or configure engine.path in the YAML file.");
            }
            String resolvedName = engineName != null && !engineName.isBlank()
                    ? engineName
                    : String.valueOf(enginePath.getFileName());

            return new ServerConfig(
                    enginePath,
                    resolvedName,
                    engineOptions,
                    defaultThinkTimeMs,
                    handshakeTimeoutMs,
                    quitGraceMs,
                    analysisSlackMs,
                    bestMoveGraceMs,
                    syncTimeoutMs,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
