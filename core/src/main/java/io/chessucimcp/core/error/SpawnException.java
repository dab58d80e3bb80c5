package io.chessucimcp.core.error;

/**
 * Thrown when the engine executable is missing, is not runnable, or the operating system
 * refuses to spawn it. Fatal; never retried.
 */
public final class SpawnException extends EngineException {

    private static final long serialVersionUID = 1L;

    public SpawnException(String message, String executable) {
        super(message, executable);
    }

    public SpawnException(String message, Throwable cause, String executable) {
        super(message, cause, executable);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
