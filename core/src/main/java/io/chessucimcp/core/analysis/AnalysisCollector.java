package io.chessucimcp.core.analysis;

import io.chessucimcp.core.channel.Deadline;
import io.chessucimcp.core.channel.LineChannel;
import io.chessucimcp.core.channel.ReadResult;
import io.chessucimcp.core.error.EngineTimeoutException;
import io.chessucimcp.core.error.ProcessClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read loop shared by analysis and best-move searches. The caller has already sent
 * {@code position} and {@code go}; the collector only consumes output.
 *
 * <p>
 * Each read races the next line against the call's deadline in a single timed wait. When the
 * deadline wins, the collector stops consuming but the channel stays valid; whatever the engine
 * prints later is left for {@link #drainToBestMove(Deadline)}.
 */
public final class AnalysisCollector {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisCollector.class);

    private final LineChannel channel;
    private final String executable;

    public AnalysisCollector(LineChannel channel, String executable) {
        this.channel = channel;
        this.executable = executable;
    }

    /**
     * Folds {@code info} lines until {@code bestmove} or the deadline.
     *
     * @return the accumulator; {@link AnalysisAccumulator#isConcluded()} tells whether
     *         {@code bestmove} arrived in time
     * @throws ProcessClosedException if the engine output closes
     */
    public AnalysisAccumulator collect(Deadline deadline) {
        AnalysisAccumulator acc = new AnalysisAccumulator();
        while (!acc.isConcluded()) {
            ReadResult result = channel.readLine(deadline);
            if (result.isTimeout()) {
                LOG.debug("Analysis deadline reached before bestmove (depth={})", acc.depth());
                break;
            }
            if (result.isClosed()) {
                throw new ProcessClosedException("Engine output closed during analysis", executable);
            }
            String line = result.line().strip();
            if (InfoLineParser.isBestMove(line)) {
                InfoLineParser.applyBestMove(line, acc);
            } else if (InfoLineParser.isInfo(line)) {
                InfoLineParser.applyInfo(line, acc);
            }
        }
        return acc;
    }

    /**
     * Waits for {@code bestmove}, discarding everything before it.
     *
     * @return the concluded accumulator (best move may still be {@code null} for a null move)
     * @throws EngineTimeoutException if the deadline passes first
     * @throws ProcessClosedException if the engine output closes first
     */
    public AnalysisAccumulator awaitBestMove(Deadline deadline) {
        AnalysisAccumulator acc = drainToBestMove(deadline);
        if (!acc.isConcluded()) {
            throw new EngineTimeoutException("Engine did not report bestmove in time", executable);
        }
        return acc;
    }

    /**
     * Consumes output up to and including the next {@code bestmove}, or until the deadline.
     * Used both for best-move searches and to discard the tail of an abandoned search.
     */
    public AnalysisAccumulator drainToBestMove(Deadline deadline) {
        AnalysisAccumulator acc = new AnalysisAccumulator();
        while (!acc.isConcluded()) {
            ReadResult result = channel.readLine(deadline);
            if (result.isTimeout()) {
                break;
            }
            if (result.isClosed()) {
                throw new ProcessClosedException("Engine output closed while awaiting bestmove", executable);
            }
            String line = result.line().strip();
            if (InfoLineParser.isBestMove(line)) {
                InfoLineParser.applyBestMove(line, acc);
            }
        }
        return acc;
    }
}
