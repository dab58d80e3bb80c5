package io.chessucimcp.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Construction-time settings of one engine bridge.
 *
 * <p>
 * All fields provide defaults except {@code executable}, which is required. Use
 * {@link #builder(Path)} to construct instances.
 *
 * @param executable         path of the UCI engine executable
 * @param options            options to apply during the handshake, in application order
 * @param defaultThinkTimeMs think time used when a caller does not supply one
 * @param handshakeTimeoutMs upper bound for {@code uciok} and {@code readyok} to arrive
 * @param quitGraceMs        wait for a voluntary exit after {@code quit} before killing
 * @param analysisSlackMs    added to the think time to form the analysis read deadline
 * @param bestMoveGraceMs    added to the think time to form the best-move read deadline
 * @param syncTimeoutMs      upper bound for {@code readyok} after option changes and for
 *                           draining an abandoned search
 */
public record EngineSettings(
        Path executable,
        Map<String, OptionValue> options,
        int defaultThinkTimeMs,
        int handshakeTimeoutMs,
        int quitGraceMs,
        int analysisSlackMs,
        int bestMoveGraceMs,
        int syncTimeoutMs) {

    public EngineSettings {
        Objects.requireNonNull(executable, "executable must not be null");
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options == null ? Map.of() : options));
        requirePositive(defaultThinkTimeMs, "defaultThinkTimeMs");
        requirePositive(handshakeTimeoutMs, "handshakeTimeoutMs");
        requirePositive(quitGraceMs, "quitGraceMs");
        requireNonNegative(analysisSlackMs, "analysisSlackMs");
        requireNonNegative(bestMoveGraceMs, "bestMoveGraceMs");
        requirePositive(syncTimeoutMs, "syncTimeoutMs");
    }

    /** Creates a builder for the given executable with default timeouts. */
    public static Builder builder(Path executable) {
        return new Builder(executable);
    }

    private static void requirePositive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative, got " + value);
        }
    }

    /** Builder for {@link EngineSettings}. */
    public static final class Builder {
        private final Path executable;
        private final Map<String, OptionValue> options = new LinkedHashMap<>();
        private int defaultThinkTimeMs = 1000;
        private int handshakeTimeoutMs = 10_000;
        private int quitGraceMs = 2000;
        private int analysisSlackMs = 500;
        private int bestMoveGraceMs = 5000;
        private int syncTimeoutMs = 2000;

        Builder(Path executable) {
            this.executable = executable;
        }

        /** Adds an option to apply during the handshake; insertion order is preserved. */
        public Builder option(String name, OptionValue value) {
            this.options.put(name, value);
            return this;
        }

        public Builder options(Map<String, OptionValue> options) {
            this.options.putAll(options);
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

        public EngineSettings build() {
            return new EngineSettings(
                    executable,
                    options,
                    defaultThinkTimeMs,
                    handshakeTimeoutMs,
                    quitGraceMs,
                    analysisSlackMs,
                    bestMoveGraceMs,
                    syncTimeoutMs);
        }
    }
}
