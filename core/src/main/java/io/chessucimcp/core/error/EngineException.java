package io.chessucimcp.core.error;

/**
 * Abstract base for all engine bridge exceptions. Never thrown directly; use the concrete
 * subclasses. Carries the engine executable the failure relates to, when known.
 */
public abstract class EngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String executable;

    protected EngineException(String message, String executable) {
        super(message);
        this.executable = executable;
    }

    protected EngineException(String message, Throwable cause, String executable) {
        super(message, cause);
        this.executable = executable;
    }

    /** The engine executable path, or {@code null} if not yet identified. */
    public String executable() {
        return executable;
    }

    /**
     * Whether the bridge that raised this exception is still usable. Fatal failures require the
     * caller to discard the bridge and create a new one.
     */
    public abstract boolean isFatal();
}
