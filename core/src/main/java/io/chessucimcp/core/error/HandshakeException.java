package io.chessucimcp.core.error;

/**
 * Thrown when the {@code uci}/{@code isready} handshake does not complete: the engine exited,
 * closed its output, or did not answer within the handshake timeout. The engine process has
 * already been terminated when this is raised.
 */
public final class HandshakeException extends EngineException {

    private static final long serialVersionUID = 1L;

    public HandshakeException(String message, String executable) {
        super(message, executable);
    }

    public HandshakeException(String message, Throwable cause, String executable) {
        super(message, cause, executable);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
