package io.chessucimcp.core.error;

/** A value does not satisfy the type, bounds or allowed values of an advertised option. */
public final class InvalidOptionValueException extends EngineOptionException {

    private static final long serialVersionUID = 1L;

    public InvalidOptionValueException(String message, String optionName) {
        super(message, optionName);
    }
}
