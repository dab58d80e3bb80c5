package io.chessucimcp.core.error;

/**
 * Thrown when the engine does not produce an expected line before a deadline. The channel
 * stays valid, so the bridge remains usable.
 */
public final class EngineTimeoutException extends EngineException {

    private static final long serialVersionUID = 1L;

    public EngineTimeoutException(String message, String executable) {
        super(message, executable);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
