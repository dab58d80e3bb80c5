package io.chessucimcp.core.error;

/** Thrown when a command cannot be written to the engine's standard input. */
public final class WriteException extends EngineException {

    private static final long serialVersionUID = 1L;

    public WriteException(String message, Throwable cause, String executable) {
        super(message, cause, executable);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
