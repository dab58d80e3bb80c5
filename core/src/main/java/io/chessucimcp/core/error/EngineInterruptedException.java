package io.chessucimcp.core.error;

/**
 * Thrown when the calling thread is interrupted while waiting on the engine. The thread's
 * interrupt flag is restored before this is raised.
 */
public final class EngineInterruptedException extends EngineException {

    private static final long serialVersionUID = 1L;

    public EngineInterruptedException(String message, Throwable cause, String executable) {
        super(message, cause, executable);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
