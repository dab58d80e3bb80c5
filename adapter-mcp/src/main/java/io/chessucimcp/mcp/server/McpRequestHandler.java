package io.chessucimcp.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches one JSON-RPC 2.0 message to the MCP method it names.
 *
 * <p>
 * Supported methods: {@code initialize}, {@code ping}, {@code tools/list} and
 * {@code tools/call}. Messages without an {@code id} are notifications and never produce a
 * response. Batches are not supported.
 */
public final class McpRequestHandler {

    private static final Logger LOG = LoggerFactory.getLogger(McpRequestHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DEFAULT_PROTOCOL_VERSION = "2025-06-18";
    private static final Set<String> SUPPORTED_PROTOCOL_VERSIONS =
            Set.of("2024-11-05", "2025-03-26", DEFAULT_PROTOCOL_VERSION);

    private final ChessTools tools;
    private final String serverName;
    private final String serverVersion;

    public McpRequestHandler(ChessTools tools, String serverName, String serverVersion) {
        this.tools = tools;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    /**
     * Handles one line of input.
     *
     * @param line a single JSON-RPC message
     * @return the serialized response, or empty for notifications
     */
    public Optional<String> handle(String line) {
        JsonNode message;
        try {
            message = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            LOG.warn("Discarding unparseable message: {}", e.getOriginalMessage());
            return Optional.of(errorResponse(NullNode.getInstance(), JsonRpcError.parseError(e.getOriginalMessage())));
        }
        if (message == null || !message.isObject()) {
            return Optional.of(errorResponse(
                    NullNode.getInstance(), JsonRpcError.invalidRequest("Message must be a JSON object")));
        }

        JsonNode id = message.get("id");
        boolean notification = id == null;
        if (!notification && !(id.isTextual() || id.isIntegralNumber() || id.isNull())) {
            return Optional.of(errorResponse(
                    NullNode.getInstance(), JsonRpcError.invalidRequest("id must be a string or an integer")));
        }
        JsonNode method = message.get("method");
        if (!"2.0".equals(message.path("jsonrpc").asText()) || method == null || !method.isTextual()) {
            if (notification) {
                LOG.debug("Ignoring malformed notification: {}", line);
                return Optional.empty();
            }
            return Optional.of(
                    errorResponse(id, JsonRpcError.invalidRequest("Expected jsonrpc \"2.0\" and a method name")));
        }

        if (notification) {
            LOG.debug("Notification received: {}", method.asText());
            return Optional.empty();
        }
        return Optional.of(dispatch(id, method.asText(), message.get("params")));
    }

    private String dispatch(JsonNode id, String method, JsonNode params) {
        LOG.debug("Request received: id={}, method={}", id, method);
        try {
            return switch (method) {
                case "initialize" -> resultResponse(id, initialize(params));
                case "ping" -> resultResponse(id, MAPPER.createObjectNode());
                case "tools/list" -> {
                    ObjectNode result = MAPPER.createObjectNode();
                    result.set("tools", tools.list());
                    yield resultResponse(id, result);
                }
                case "tools/call" -> resultResponse(id, callTool(params));
                default -> errorResponse(id, JsonRpcError.methodNotFound(method));
            };
        } catch (ToolCallException e) {
            LOG.warn("Rejected {}: {}", method, e.getMessage());
            return errorResponse(id, JsonRpcError.of(e.code(), e.getMessage()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure handling {}: {}", method, e.getMessage(), e);
            return errorResponse(id, JsonRpcError.internalError(e.getMessage()));
        }
    }

    private JsonNode initialize(JsonNode params) {
        String requested = params != null ? params.path("protocolVersion").asText(null) : null;
        String version = requested != null && SUPPORTED_PROTOCOL_VERSIONS.contains(requested)
                ? requested
                : DEFAULT_PROTOCOL_VERSION;

        ObjectNode result = MAPPER.createObjectNode();
        result.put("protocolVersion", version);
        result.putObject("capabilities").putObject("tools").put("listChanged", false);
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", serverName);
        info.put("version", serverVersion);
        LOG.info("Client initialized: protocolVersion={}, client={}", version, clientName(params));
        return result;
    }

    private JsonNode callTool(JsonNode params) {
        if (params == null || !params.isObject()) {
            throw ToolCallException.invalidParams("tools/call requires params");
        }
        JsonNode name = params.get("name");
        if (name == null || !name.isTextual()) {
            throw ToolCallException.invalidParams("tools/call requires a tool name");
        }
        JsonNode arguments = params.get("arguments");
        if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
            throw ToolCallException.invalidParams("Tool arguments must be an object");
        }
        return tools.call(name.asText(), arguments);
    }

    private static String clientName(JsonNode params) {
        return params == null ? "unknown" : params.path("clientInfo").path("name").asText("unknown");
    }

    private static String resultResponse(JsonNode id, JsonNode result) {
        ObjectNode response = envelope(id);
        response.set("result", result);
        return response.toString();
    }

    private static String errorResponse(JsonNode id, JsonNode error) {
        ObjectNode response = envelope(id);
        response.set("error", error);
        return response.toString();
    }

    private static ObjectNode envelope(JsonNode id) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        return response;
    }
}
