package io.chessucimcp.core.protocol;

import io.chessucimcp.core.model.EngineId;
import io.chessucimcp.core.model.OptionMetadata;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fold over the lines an engine prints between {@code uci} and {@code uciok}. Each call to
 * {@link #accept(String)} consumes one line; the fold ends at the {@code uciok} sentinel.
 *
 * <p>
 * Not thread-safe; owned by the single read loop driving the handshake.
 */
public final class HandshakeAccumulator {

    private static final String ID_NAME = "id name ";
    private static final String ID_AUTHOR = "id author ";
    private static final String OPTION = "option ";

    private String name;
    private String author;
    private final Map<String, OptionMetadata> options = new LinkedHashMap<>();
    private boolean complete;
    private int linesConsumed;

    /**
     * Consumes one line.
     *
     * @return {@code true} once the line was {@code uciok}
     * @throws IllegalStateException if called after {@code uciok}
     */
    public boolean accept(String rawLine) {
        if (complete) {
            throw new IllegalStateException("Handshake output already complete");
        }
        linesConsumed++;
        String line = rawLine.strip();
        if ("uciok".equals(line)) {
            complete = true;
        } else if (line.startsWith(ID_NAME)) {
            name = line.substring(ID_NAME.length()).strip();
        } else if (line.startsWith(ID_AUTHOR)) {
            author = line.substring(ID_AUTHOR.length()).strip();
        } else if (line.startsWith(OPTION)) {
            // first advertisement of a name wins
            OptionLineParser.parse(line).ifPresent(meta -> options.putIfAbsent(meta.name(), meta));
        }
        return complete;
    }

    public boolean isComplete() {
        return complete;
    }

    /** Number of lines consumed, {@code uciok} included. */
    public int linesConsumed() {
        return linesConsumed;
    }

    public EngineId engineId() {
        return name == null && author == null ? EngineId.UNKNOWN : new EngineId(name, author);
    }

    /** Advertised options in advertisement order. */
    public Map<String, OptionMetadata> options() {
        return Collections.unmodifiableMap(options);
    }
}
