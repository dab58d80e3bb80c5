package io.chessucimcp.core.error;

/**
 * Thrown when a protocol operation is attempted before the handshake reached the ready state,
 * or after the bridge was stopped.
 */
public final class EngineNotReadyException extends EngineException {

    private static final long serialVersionUID = 1L;

    public EngineNotReadyException(String message, String executable) {
        super(message, executable);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
