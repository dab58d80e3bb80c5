package io.chessucimcp.core.spi;

import io.chessucimcp.core.error.EngineNotReadyException;
import io.chessucimcp.core.error.EngineTimeoutException;
import io.chessucimcp.core.error.HandshakeException;
import io.chessucimcp.core.error.ProcessClosedException;
import io.chessucimcp.core.error.SpawnException;
import io.chessucimcp.core.model.AnalysisResult;
import io.chessucimcp.core.model.EngineId;
import io.chessucimcp.core.model.EngineSettings;
import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionValue;
import io.chessucimcp.core.model.OptionsUpdate;
import io.chessucimcp.core.protocol.HandshakeState;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Caller-facing seam over one supervised UCI engine process.
 *
 * <p>
 * Implementations own exactly one engine process from {@link #start()} to {@link #stop()}.
 * Protocol operations are serialized: at most one is in flight per bridge. {@link #stop()} may
 * be called from any thread at any time and wakes a blocked operation, which then fails with
 * {@link ProcessClosedException}.
 *
 * <p>
 * All failures are reported through the unchecked
 * {@link io.chessucimcp.core.error.EngineException} hierarchy.
 */
public interface EngineBridge extends AutoCloseable {

    /**
     * Spawns the engine, performs the handshake, applies the configured options and waits for
     * the engine to report ready.
     *
     * @throws SpawnException     if the executable is missing, not executable or cannot be
     *                            spawned
     * @throws HandshakeException if {@code uciok} or {@code readyok} does not arrive in time, or
     *                            the engine exits during the handshake
     * @throws IllegalStateException if the bridge was already started
     */
    void start();

    /** Quits the engine, forcing termination after the grace period. Idempotent. */
    void stop();

    HandshakeState state();

    EngineSettings settings();

    /**
     * Searches {@code fen} for {@code timeMs} milliseconds.
     *
     * <p>
     * Returns within {@code timeMs} plus the configured analysis slack. If the engine has not
     * reported {@code bestmove} by then, the partial result gathered so far is returned with an
     * absent best move.
     *
     * @throws EngineNotReadyException if the handshake has not completed or the bridge stopped
     * @throws IllegalArgumentException if {@code fen} contains a line break or {@code timeMs} is
     *                                  not positive
     */
    AnalysisResult analyze(String fen, long timeMs);

    /**
     * Sets the position for subsequent searches: the start position when {@code fen} is
     * {@code null} or blank, followed by {@code moves} when given.
     */
    void setPosition(String fen, List<String> moves);

    /**
     * Searches the current position for {@code timeMs} milliseconds and returns the engine's
     * move, or empty when the engine reports a null move (no legal moves).
     *
     * @throws EngineTimeoutException if {@code bestmove} does not arrive within {@code timeMs}
     *                                plus the configured best-move grace
     */
    Optional<String> getBestMove(long timeMs);

    /** Engine identity from the handshake; {@link EngineId#UNKNOWN} before it completes. */
    EngineId getEngineId();

    /** Options the engine advertised, in advertisement order. */
    Map<String, OptionMetadata> getAvailableOptions();

    /**
     * Validates and applies option values. Each key is applied or rejected on its own; the
     * result covers every input key exactly once.
     *
     * @throws EngineNotReadyException if the bridge is not ready
     */
    OptionsUpdate setOptions(Map<String, OptionValue> values);

    /** Snapshot of the values this bridge has sent. Advisory: engines cannot be queried. */
    Map<String, OptionValue> getCurrentOptionValues();

    /** Equivalent to {@link #stop()}. */
    @Override
    default void close() {
        stop();
    }
}
