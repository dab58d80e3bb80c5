package io.chessucimcp.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.chessucimcp.core.error.EngineException;
import io.chessucimcp.core.model.AnalysisResult;
import io.chessucimcp.core.model.EngineId;
import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionValue;
import io.chessucimcp.core.model.OptionsUpdate;
import io.chessucimcp.core.model.Score;
import io.chessucimcp.core.spi.EngineBridge;
import io.chessucimcp.mcp.config.ServerConfig;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The MCP tools exposed by the server, each backed by one {@link EngineBridge} operation.
 *
 * <p>
 * Arguments are validated against the tool's JSON Schema (draft 2020-12) before the tool runs;
 * a violation is a {@link ToolCallException}. Failures raised by the engine while the tool runs
 * are returned as a tool result with {@code isError: true} and the failure message as text.
 */
public final class ChessTools {

    private static final Logger LOG = LoggerFactory.getLogger(ChessTools.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /** Upper bound for {@code time_ms}: one hour. */
    static final long MAX_TIME_MS = 3_600_000L;

    private static final String TIME_MS_SCHEMA = "\"time_ms\":{\"type\":\"integer\",\"minimum\":1,\"maximum\":"
            + MAX_TIME_MS + ",\"description\":\"Thinking time in milliseconds\"}";

    private static final String EMPTY_SCHEMA =
            "{\"type\":\"object\",\"properties\":{},\"additionalProperties\":false}";

    private final EngineBridge bridge;
    private final ServerConfig config;
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ChessTools(EngineBridge bridge, ServerConfig config) {
        this.bridge = bridge;
        this.config = config;

        register(
                "analyze",
                "Analyze a chess position given in FEN and report depth, score, principal variation and best move.",
                "{\"type\":\"object\",\"properties\":{"
                        + "\"fen\":{\"type\":\"string\",\"minLength\":1,\"description\":\"Position in FEN notation\"},"
                        + TIME_MS_SCHEMA
                        + "},\"required\":[\"fen\"],\"additionalProperties\":false}",
                this::analyze);
        register(
                "get_best_move",
                "Get the engine's best move, optionally for a FEN position (otherwise the current position).",
                "{\"type\":\"object\",\"properties\":{"
                        + "\"fen\":{\"type\":\"string\",\"minLength\":1,\"description\":\"Position in FEN notation\"},"
                        + TIME_MS_SCHEMA
                        + "},\"additionalProperties\":false}",
                this::getBestMove);
        register(
                "set_position",
                "Set the current position from FEN (default: start position), optionally followed by moves in UCI notation.",
                "{\"type\":\"object\",\"properties\":{"
                        + "\"fen\":{\"type\":\"string\",\"description\":\"Position in FEN notation\"},"
                        + "\"moves\":{\"type\":\"array\",\"items\":{\"type\":\"string\",\"minLength\":4,\"maxLength\":5},"
                        + "\"description\":\"Moves in UCI notation, e.g. e2e4\"}"
                        + "},\"additionalProperties\":false}",
                this::setPosition);
        register("engine_info", "Get information about the configured chess engine.", EMPTY_SCHEMA, this::engineInfo);
        register(
                "get_engine_options",
                "List the UCI options the engine supports, with their metadata and current values.",
                EMPTY_SCHEMA,
                this::getEngineOptions);
        register(
                "set_engine_options",
                "Set UCI options. Each option is applied or rejected on its own.",
                "{\"type\":\"object\",\"properties\":{"
                        + "\"options\":{\"type\":\"object\",\"minProperties\":1,"
                        + "\"additionalProperties\":{\"type\":[\"boolean\",\"integer\",\"string\",\"null\"]},"
                        + "\"description\":\"Option name to value\"}"
                        + "},\"required\":[\"options\"],\"additionalProperties\":false}",
                this::setEngineOptions);
    }

    private void register(String name, String description, String schemaJson, Function<JsonNode, JsonNode> handler) {
        JsonNode schemaNode;
        try {
            schemaNode = MAPPER.readTree(schemaJson);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid input schema for tool " + name, e);
        }
        tools.put(name, new Tool(name, description, schemaNode, SCHEMA_FACTORY.getSchema(schemaNode), handler));
    }

    /** Tool descriptors for {@code tools/list}, in registration order. */
    public ArrayNode list() {
        ArrayNode array = MAPPER.createArrayNode();
        for (Tool tool : tools.values()) {
            ObjectNode node = array.addObject();
            node.put("name", tool.name());
            node.put("description", tool.description());
            node.set("inputSchema", tool.inputSchema().deepCopy());
        }
        return array;
    }

    /**
     * Runs a tool.
     *
     * @param name      tool name
     * @param arguments tool arguments; {@code null} means none
     * @return an MCP {@code CallToolResult}
     * @throws ToolCallException if the tool is unknown or the arguments violate its schema
     */
    public JsonNode call(String name, JsonNode arguments) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw ToolCallException.invalidParams("Unknown tool: " + name);
        }
        JsonNode args = arguments == null || arguments.isNull() ? MAPPER.createObjectNode() : arguments;

        Set<ValidationMessage> errors = tool.schema().validate(args);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; "));
            throw ToolCallException.invalidParams("Invalid arguments for tool '" + name + "': " + detail);
        }

        long startNanos = System.nanoTime();
        try {
            JsonNode result = tool.handler().apply(args);
            LOG.debug("Tool {} completed in {} ms", name, (System.nanoTime() - startNanos) / 1_000_000);
            return success(result);
        } catch (EngineException e) {
            if (e.isFatal()) {
                LOG.error("Tool {} failed: {}", name, e.getMessage());
            } else {
                LOG.warn("Tool {} failed: {}", name, e.getMessage());
            }
            return failure(e.getMessage());
        } catch (IllegalArgumentException e) {
            LOG.warn("Tool {} rejected arguments: {}", name, e.getMessage());
            return failure(e.getMessage());
        }
    }

    // --- Tool handlers ---

    private JsonNode analyze(JsonNode args) {
        AnalysisResult result = bridge.analyze(args.get("fen").asText(), thinkTime(args));

        ObjectNode node = MAPPER.createObjectNode();
        node.put("depth", result.depth());
        node.set("score", scoreNode(result.score()));
        ArrayNode pv = node.putArray("pv");
        result.pv().forEach(pv::add);
        node.put("best_move", result.bestMove());
        return node;
    }

    private JsonNode getBestMove(JsonNode args) {
        if (args.hasNonNull("fen")) {
            bridge.setPosition(args.get("fen").asText(), null);
        }
        Optional<String> move = bridge.getBestMove(thinkTime(args));

        ObjectNode node = MAPPER.createObjectNode();
        node.put("move", move.orElse(null));
        return node;
    }

    private JsonNode setPosition(JsonNode args) {
        String fen = args.hasNonNull("fen") ? args.get("fen").asText() : null;
        List<String> moves = null;
        if (args.hasNonNull("moves")) {
            moves = new ArrayList<>();
            for (JsonNode move : args.get("moves")) {
                moves.add(move.asText());
            }
        }
        bridge.setPosition(fen, moves);

        ObjectNode node = MAPPER.createObjectNode();
        node.put("success", true);
        return node;
    }

    private JsonNode engineInfo(JsonNode args) {
        EngineId id = bridge.getEngineId();

        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", config.engineName());
        node.put("path", config.enginePath().toString());
        ObjectNode idNode = node.putObject("id");
        idNode.put("name", id.name());
        idNode.put("author", id.author());
        ObjectNode configured = node.putObject("configured_options");
        config.engineOptions().forEach((name, value) -> configured.set(name, valueNode(value)));
        return node;
    }

    private JsonNode getEngineOptions(JsonNode args) {
        Map<String, OptionValue> current = bridge.getCurrentOptionValues();

        ObjectNode node = MAPPER.createObjectNode();
        ObjectNode options = node.putObject("options");
        for (OptionMetadata meta : bridge.getAvailableOptions().values()) {
            ObjectNode entry = options.putObject(meta.name());
            entry.set("metadata", metadataNode(meta));
            entry.set("current_value", valueNode(current.getOrDefault(meta.name(), meta.defaultValue())));
        }
        return node;
    }

    private JsonNode setEngineOptions(JsonNode args) {
        Map<String, OptionValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = args.get("options").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), optionValue(field.getValue()));
        }
        OptionsUpdate update = bridge.setOptions(values);

        ObjectNode node = MAPPER.createObjectNode();
        node.put("success", update.success());
        ObjectNode applied = node.putObject("applied_options");
        update.applied().forEach((name, value) -> applied.set(name, valueNode(value)));
        ObjectNode errors = node.putObject("errors");
        update.errors().forEach(errors::put);
        return node;
    }

    // --- Helpers ---

    private long thinkTime(JsonNode args) {
        return args.hasNonNull("time_ms") ? args.get("time_ms").asLong() : config.defaultThinkTimeMs();
    }

    private static JsonNode success(JsonNode structured) {
        ObjectNode result = MAPPER.createObjectNode();
        result.putArray("content").addObject().put("type", "text").put("text", structured.toString());
        result.set("structuredContent", structured);
        result.put("isError", false);
        return result;
    }

    private static JsonNode failure(String message) {
        ObjectNode result = MAPPER.createObjectNode();
        result.putArray("content").addObject().put("type", "text").put("text", message);
        result.put("isError", true);
        return result;
    }

    /** Pawns as a number, {@code "mate<N>"} for forced mates, {@code null} when unknown. */
    static JsonNode scoreNode(Score score) {
        if (score == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (score.isMate()) {
            return JsonNodeFactory.instance.textNode(score.mateMarker());
        }
        return JsonNodeFactory.instance.numberNode(score.pawns());
    }

    static JsonNode valueNode(OptionValue value) {
        return switch (value.kind()) {
            case BOOLEAN -> JsonNodeFactory.instance.booleanNode(value.asBoolean());
            case INTEGER -> JsonNodeFactory.instance.numberNode(value.asInteger());
            case STRING -> JsonNodeFactory.instance.textNode(value.asString());
            case NONE -> JsonNodeFactory.instance.nullNode();
        };
    }

    static OptionValue optionValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return OptionValue.none();
        }
        if (node.isBoolean()) {
            return OptionValue.ofBoolean(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return OptionValue.ofInteger(node.longValue());
        }
        return OptionValue.ofString(node.asText());
    }

    private static JsonNode metadataNode(OptionMetadata meta) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", meta.type().token());
        node.set("default", valueNode(meta.defaultValue()));
        if (meta.min() != null) {
            node.put("min", meta.min());
        }
        if (meta.max() != null) {
            node.put("max", meta.max());
        }
        if (!meta.allowedValues().isEmpty()) {
            ArrayNode vars = node.putArray("vars");
            meta.allowedValues().forEach(vars::add);
        }
        return node;
    }

    private record Tool(
            String name,
            String description,
            JsonNode inputSchema,
            JsonSchema schema,
            Function<JsonNode, JsonNode> handler) {}
}
