package io.chessucimcp.core.error;

/**
 * Abstract parent for per-option validation failures. Raised by the option validator and
 * collected per key by {@code setOptions}, which reports them instead of propagating.
 */
public abstract class EngineOptionException extends EngineException {

    private static final long serialVersionUID = 1L;

    private final String optionName;

    protected EngineOptionException(String message, String optionName) {
        super(message, null);
        this.optionName = optionName;
    }

    /** The option the failure applies to. */
    public String optionName() {
        return optionName;
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
