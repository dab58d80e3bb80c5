package io.chessucimcp.core.protocol;

/** Position of a bridge in the UCI handshake. */
public enum HandshakeState {
    /** Process spawned, {@code uci} not yet sent. */
    UNINITIALIZED,
    /** {@code uci} sent; folding {@code id} and {@code option} lines until {@code uciok}. */
    AWAITING_UCI_OK,
    /** {@code uciok} seen; options may be applied, {@code readyok} pending. */
    AWAITING_READY_OK,
    /** Search and option commands are legal. */
    READY,
    /** Terminal: quit sent, process killed, or engine output closed. */
    STOPPED
}
