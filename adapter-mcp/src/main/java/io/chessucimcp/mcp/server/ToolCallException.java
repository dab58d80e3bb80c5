package io.chessucimcp.mcp.server;

/**
 * Rejects a {@code tools/call} request before the tool runs: unknown tool name, or arguments
 * that violate the tool's input schema. Mapped to a JSON-RPC error response, unlike engine
 * failures, which become tool results with {@code isError: true}.
 */
public class ToolCallException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int code;

    public ToolCallException(int code, String message) {
        super(message);
        this.code = code;
    }

    /** Convenience for the common {@code -32602 Invalid params} case. */
    public static ToolCallException invalidParams(String message) {
        return new ToolCallException(JsonRpcError.INVALID_PARAMS, message);
    }

    public int code() {
        return code;
    }
}
