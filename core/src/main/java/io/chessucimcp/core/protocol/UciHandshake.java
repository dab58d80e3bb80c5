package io.chessucimcp.core.protocol;

import io.chessucimcp.core.channel.Deadline;
import io.chessucimcp.core.channel.LineChannel;
import io.chessucimcp.core.channel.ReadResult;
import io.chessucimcp.core.error.EngineNotReadyException;
import io.chessucimcp.core.error.EngineTimeoutException;
import io.chessucimcp.core.error.ProcessClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * UCI handshake state machine over one {@link LineChannel}.
 *
 * <pre>
 * UNINITIALIZED     --send "uci"-----------------&gt; AWAITING_UCI_OK
 * AWAITING_UCI_OK   --receive "uciok"------------&gt; AWAITING_READY_OK
 * AWAITING_READY_OK --send "isready", "readyok"--&gt; READY
 * READY             --quit-----------------------&gt; STOPPED
 * any               --output closed--------------&gt; STOPPED
 * </pre>
 *
 * <p>
 * Lines read while awaiting {@code uciok} are folded into a {@link HandshakeAccumulator}.
 * Out-of-order transitions raise {@link IllegalStateException}; they indicate a bug in the
 * caller, not an engine fault.
 *
 * <p>
 * The state is readable from any thread; transitions are driven by the single thread holding
 * the bridge's operation lock, except {@link #markStopped()}, which any thread may call.
 */
public final class UciHandshake {

    private static final Logger LOG = LoggerFactory.getLogger(UciHandshake.class);

    private final LineChannel channel;
    private final String executable;
    private volatile HandshakeState state = HandshakeState.UNINITIALIZED;

    public UciHandshake(LineChannel channel, String executable) {
        this.channel = channel;
        this.executable = executable;
    }

    public HandshakeState state() {
        return state;
    }

    /** Sends {@code uci}. */
    public void sendUci() {
        transition(HandshakeState.UNINITIALIZED, HandshakeState.AWAITING_UCI_OK);
        channel.writeLine(UciCommands.UCI);
    }

    /**
     * Reads and folds handshake output until {@code uciok}.
     *
     * @return the completed accumulator holding engine identity and advertised options
     * @throws EngineTimeoutException  if {@code uciok} does not arrive before {@code deadline}
     * @throws ProcessClosedException  if the engine output closes first
     */
    public HandshakeAccumulator awaitUciOk(Deadline deadline) {
        requireState(HandshakeState.AWAITING_UCI_OK);
        HandshakeAccumulator accumulator = new HandshakeAccumulator();
        boolean done = false;
        while (!done) {
            done = accumulator.accept(nextLine(deadline, "uciok"));
        }
        state = HandshakeState.AWAITING_READY_OK;
        LOG.debug(
                "uciok received after {} lines: id={}, options={}",
                accumulator.linesConsumed(),
                accumulator.engineId(),
                accumulator.options().size());
        return accumulator;
    }

    /**
     * Sends {@code isready}, waits for {@code readyok}, and enters {@link HandshakeState#READY}.
     */
    public void awaitReady(Deadline deadline) {
        requireState(HandshakeState.AWAITING_READY_OK);
        synchronize(deadline);
        state = HandshakeState.READY;
    }

    /**
     * Sends {@code isready} and discards output up to {@code readyok}. Legal once options have
     * been advertised.
     */
    public void synchronize(Deadline deadline) {
        requireOptionsAdvertised();
        channel.writeLine(UciCommands.IS_READY);
        String line;
        while (!"readyok".equals(line = nextLine(deadline, "readyok").strip())) {
            LOG.debug("Discarding engine output while awaiting readyok: {}", line);
        }
    }

    /**
     * @throws EngineNotReadyException unless the state is {@link HandshakeState#READY}
     */
    public void requireReady(String operation) {
        HandshakeState current = state;
        if (current != HandshakeState.READY) {
            throw new EngineNotReadyException(
                    "Engine not ready for " + operation + " (state " + current + ")", executable);
        }
    }

    /**
     * @throws EngineNotReadyException unless {@code uciok} has been observed and the bridge is
     *                                 not stopped
     */
    public void requireOptionsAdvertised() {
        HandshakeState current = state;
        if (current != HandshakeState.AWAITING_READY_OK && current != HandshakeState.READY) {
            throw new EngineNotReadyException(
                    "Engine options are not known yet (state " + current + ")", executable);
        }
    }

    /** Enters the terminal state. Safe from any thread; idempotent. */
    public void markStopped() {
        state = HandshakeState.STOPPED;
    }

    private String nextLine(Deadline deadline, String awaited) {
        ReadResult result = channel.readLine(deadline);
        if (result.isTimeout()) {
            throw new EngineTimeoutException("Engine did not send " + awaited + " in time", executable);
        }
        if (result.isClosed()) {
            markStopped();
            throw new ProcessClosedException("Engine output closed while awaiting " + awaited, executable);
        }
        return result.line();
    }

    private void transition(HandshakeState from, HandshakeState to) {
        requireState(from);
        state = to;
    }

    private void requireState(HandshakeState expected) {
        HandshakeState current = state;
        if (current != expected) {
            throw new IllegalStateException("Handshake is in state " + current + ", expected " + expected);
        }
    }
}
