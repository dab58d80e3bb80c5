package io.chessucimcp.core.error;

/**
 * Thrown when the engine process has exited, its output stream reached end-of-file, or the
 * bridge was stopped while an operation was in flight.
 */
public final class ProcessClosedException extends EngineException {

    private static final long serialVersionUID = 1L;

    public ProcessClosedException(String message, String executable) {
        super(message, executable);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
