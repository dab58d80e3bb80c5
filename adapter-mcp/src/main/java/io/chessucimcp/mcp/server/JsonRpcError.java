package io.chessucimcp.mcp.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds JSON-RPC 2.0 error objects for protocol-level failures.
 *
 * <p>
 * Failures of a tool itself (engine timeout, engine not ready) are not protocol errors; they
 * are reported as tool results with {@code isError: true} by {@link ChessTools}.
 *
 * <p>
 * Every method returns a fresh {@link JsonNode}:
 * <pre>{@code
 * {
 * "code": -32601,
 * "message": "Method not found",
 * "data": "Unknown method: resources/list"
 * }
 * }</pre>
 */
public final class JsonRpcError {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;

    private JsonRpcError() {
        // utility class
    }

    /** The request line is not valid JSON. */
    public static JsonNode parseError(String detail) {
        return build(PARSE_ERROR, "Parse error", detail);
    }

    /** The JSON is not a valid request object. */
    public static JsonNode invalidRequest(String detail) {
        return build(INVALID_REQUEST, "Invalid Request", detail);
    }

    public static JsonNode methodNotFound(String method) {
        return build(METHOD_NOT_FOUND, "Method not found", "Unknown method: " + method);
    }

    /** Missing or malformed params, unknown tool, or arguments violating a tool schema. */
    public static JsonNode invalidParams(String detail) {
        return build(INVALID_PARAMS, "Invalid params", detail);
    }

    public static JsonNode internalError(String detail) {
        return build(INTERNAL_ERROR, "Internal error", detail);
    }

    /** Error object for an arbitrary code; used for {@link ToolCallException}. */
    public static JsonNode of(int code, String detail) {
        return switch (code) {
            case PARSE_ERROR -> parseError(detail);
            case INVALID_REQUEST -> invalidRequest(detail);
            case METHOD_NOT_FOUND -> build(METHOD_NOT_FOUND, "Method not found", detail);
            case INVALID_PARAMS -> invalidParams(detail);
            default -> build(code, "Internal error", detail);
        };
    }

    private static JsonNode build(int code, String message, String detail) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", code);
        node.put("message", message);
        if (detail != null) {
            node.put("data", detail);
        }
        return node;
    }
}
