package io.chessucimcp.core.error;

/** The engine did not advertise an option with the given name. */
public final class UnsupportedOptionException extends EngineOptionException {

    private static final long serialVersionUID = 1L;

    public UnsupportedOptionException(String optionName) {
        super("Unsupported option: '" + optionName + "'", optionName);
    }
}
