package io.chessucimcp.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chessucimcp.core.error.EngineNotReadyException;
import io.chessucimcp.core.error.EngineTimeoutException;
import io.chessucimcp.core.model.AnalysisResult;
import io.chessucimcp.core.model.EngineId;
import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionType;
import io.chessucimcp.core.model.OptionValue;
import io.chessucimcp.core.model.OptionsUpdate;
import io.chessucimcp.core.model.Score;
import io.chessucimcp.core.spi.EngineBridge;
import io.chessucimcp.mcp.config.ServerConfig;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

/**
 * Tests for {@link ChessTools}: argument validation, result shapes and the mapping of engine
 * failures to {@code isError} results. The engine is a Mockito mock.
 */
class ChessToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private EngineBridge bridge;
    private ChessTools tools;

    @BeforeEach
    void setUp() {
        bridge = mock(EngineBridge.class);
        ServerConfig config = ServerConfig.builder()
                .enginePath(Path.of("/usr/games/stockfish"))
                .engineOption("Threads", OptionValue.ofInteger(4))
                .defaultThinkTimeMs(1000)
                .build();
        tools = new ChessTools(bridge, config);
    }

    private static JsonNode args(String json) throws Exception {
        return MAPPER.readTree(json);
    }

    @Test
    @DisplayName("tools/list → six tools in registration order with input schemas")
    void listsTools() {
        JsonNode list = tools.list();

        assertThat(list).hasSize(6);
        assertThat(list.findValuesAsText("name"))
                .containsExactly(
                        "analyze",
                        "get_best_move",
                        "set_position",
                        "engine_info",
                        "get_engine_options",
                        "set_engine_options");
        JsonNode analyze = list.get(0);
        assertThat(analyze.get("description").asText()).isNotBlank();
        assertThat(analyze.at("/inputSchema/required/0").asText()).isEqualTo("fen");
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("Result carries depth, pawn score, pv and best move; text mirrors it")
        void success() throws Exception {
            when(bridge.analyze(FEN, 500))
                    .thenReturn(new AnalysisResult(18, Score.centipawns(35), List.of("e2e4", "e7e5"), "e2e4"));

            JsonNode result = tools.call("analyze", args("{\"fen\":\"" + FEN + "\",\"time_ms\":500}"));

            assertThat(result.get("isError").asBoolean()).isFalse();
            JsonNode structured = result.get("structuredContent");
            assertThat(structured.get("depth").asInt()).isEqualTo(18);
            assertThat(structured.get("score").asDouble()).isEqualTo(0.35);
            assertThat(structured.get("pv").toString()).isEqualTo("[\"e2e4\",\"e7e5\"]");
            assertThat(structured.get("best_move").asText()).isEqualTo("e2e4");
            assertThat(MAPPER.readTree(result.at("/content/0/text").asText())).isEqualTo(structured);
        }

        @Test
        @DisplayName("Missing time_ms → configured default think time")
        void defaultThinkTime() throws Exception {
            when(bridge.analyze(FEN, 1000)).thenReturn(new AnalysisResult(0, null, List.of(), null));

            JsonNode result = tools.call("analyze", args("{\"fen\":\"" + FEN + "\"}"));

            verify(bridge).analyze(FEN, 1000);
            assertThat(result.at("/structuredContent/score").isNull()).isTrue();
            assertThat(result.at("/structuredContent/best_move").isNull()).isTrue();
        }

        @Test
        @DisplayName("Mate scores render as mateN")
        void mateScore() throws Exception {
            when(bridge.analyze(any(), anyLong()))
                    .thenReturn(new AnalysisResult(12, Score.mate(-3), List.of("h7h8"), "h7h8"));

            JsonNode result = tools.call("analyze", args("{\"fen\":\"" + FEN + "\"}"));

            assertThat(result.at("/structuredContent/score").asText()).isEqualTo("mate-3");
        }

        @Test
        @DisplayName("Missing fen, wrong type or unknown property → ToolCallException (-32602)")
        void schemaViolations() {
            assertThatThrownBy(() -> tools.call("analyze", args("{}")))
                    .isInstanceOf(ToolCallException.class)
                    .hasMessageContaining("Invalid arguments for tool 'analyze'");
            assertThatThrownBy(() -> tools.call("analyze", args("{\"fen\":\"x\",\"time_ms\":\"fast\"}")))
                    .isInstanceOf(ToolCallException.class);
            assertThatThrownBy(() -> tools.call("analyze", args("{\"fen\":\"x\",\"depth\":10}")))
                    .isInstanceOfSatisfying(
                            ToolCallException.class, e -> assertThat(e.code()).isEqualTo(JsonRpcError.INVALID_PARAMS));
            verify(bridge, never()).analyze(any(), anyLong());
        }

        @Test
        @DisplayName("time_ms above one hour → ToolCallException; the engine is never asked")
        void timeAboveMaximum() {
            assertThatThrownBy(() -> tools.call("analyze", args("{\"fen\":\"x\",\"time_ms\":9223372036854775707}")))
                    .isInstanceOf(ToolCallException.class);
            assertThatThrownBy(() -> tools.call("get_best_move", args("{\"time_ms\":10000000000000}")))
                    .isInstanceOfSatisfying(
                            ToolCallException.class, e -> assertThat(e.code()).isEqualTo(JsonRpcError.INVALID_PARAMS));
            verify(bridge, never()).analyze(any(), anyLong());
            verify(bridge, never()).getBestMove(anyLong());
        }

        @Test
        @DisplayName("time_ms of exactly one hour is accepted")
        void timeAtMaximum() throws Exception {
            when(bridge.getBestMove(ChessTools.MAX_TIME_MS)).thenReturn(Optional.of("e2e4"));

            JsonNode result = tools.call("get_best_move", args("{\"time_ms\":3600000}"));

            assertThat(result.path("isError").asBoolean()).isFalse();
            verify(bridge).getBestMove(ChessTools.MAX_TIME_MS);
        }

        @Test
        @DisplayName("Engine timeout → isError result with the failure message")
        void engineFailure() throws Exception {
            when(bridge.analyze(any(), anyLong()))
                    .thenThrow(new EngineTimeoutException("Engine did not finish its previous search", "sf"));

            JsonNode result = tools.call("analyze", args("{\"fen\":\"" + FEN + "\"}"));

            assertThat(result.get("isError").asBoolean()).isTrue();
            assertThat(result.at("/content/0/text").asText()).contains("previous search");
            assertThat(result.has("structuredContent")).isFalse();
        }

        @Test
        @DisplayName("Malformed FEN rejected by the bridge → isError result")
        void illegalArgument() throws Exception {
            when(bridge.analyze(any(), anyLong())).thenThrow(new IllegalArgumentException("FEN must not contain line breaks"));

            JsonNode result = tools.call("analyze", args("{\"fen\":\"bad\\nquit\"}"));

            assertThat(result.get("isError").asBoolean()).isTrue();
            assertThat(result.at("/content/0/text").asText()).isEqualTo("FEN must not contain line breaks");
        }
    }

    @Nested
    @DisplayName("get_best_move and set_position")
    class Moves {

        @Test
        @DisplayName("get_best_move with fen sets the position first")
        void bestMoveWithFen() throws Exception {
            when(bridge.getBestMove(250)).thenReturn(Optional.of("g1f3"));

            JsonNode result = tools.call("get_best_move", args("{\"fen\":\"" + FEN + "\",\"time_ms\":250}"));

            InOrder order = inOrder(bridge);
            order.verify(bridge).setPosition(FEN, null);
            order.verify(bridge).getBestMove(250);
            assertThat(result.at("/structuredContent/move").asText()).isEqualTo("g1f3");
        }

        @Test
        @DisplayName("get_best_move without fen keeps the current position; no move → null")
        void bestMoveWithoutFen() throws Exception {
            when(bridge.getBestMove(1000)).thenReturn(Optional.empty());

            JsonNode result = tools.call("get_best_move", null);

            verify(bridge, never()).setPosition(any(), any());
            assertThat(result.at("/structuredContent/move").isNull()).isTrue();
        }

        @Test
        @DisplayName("set_position passes fen and moves through")
        void setPosition() throws Exception {
            JsonNode result = tools.call("set_position", args("{\"moves\":[\"e2e4\",\"e7e5\"]}"));

            verify(bridge).setPosition(null, List.of("e2e4", "e7e5"));
            assertThat(result.at("/structuredContent/success").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("Engine not ready → isError result")
        void notReady() throws Exception {
            when(bridge.getBestMove(anyLong())).thenThrow(new EngineNotReadyException("Engine not ready", "sf"));

            JsonNode result = tools.call("get_best_move", args("{}"));

            assertThat(result.get("isError").asBoolean()).isTrue();
        }
    }

    @Nested
    @DisplayName("Engine information and options")
    class Options {

        @Test
        @DisplayName("engine_info reports configured name, path, identity and options")
        void engineInfo() throws Exception {
            when(bridge.getEngineId()).thenReturn(new EngineId("Stockfish 17", "the Stockfish developers"));

            JsonNode info = tools.call("engine_info", args("{}")).get("structuredContent");

            assertThat(info.get("name").asText()).isEqualTo("stockfish");
            assertThat(info.get("path").asText()).isEqualTo(Path.of("/usr/games/stockfish").toString());
            assertThat(info.at("/id/name").asText()).isEqualTo("Stockfish 17");
            assertThat(info.at("/id/author").asText()).isEqualTo("the Stockfish developers");
            assertThat(info.at("/configured_options/Threads").asInt()).isEqualTo(4);
        }

        @Test
        @DisplayName("get_engine_options merges metadata with current or default values")
        void getEngineOptions() throws Exception {
            Map<String, OptionMetadata> available = new LinkedHashMap<>();
            available.put("Hash", new OptionMetadata(
                    "Hash", OptionType.SPIN, OptionValue.ofInteger(16), 1L, 33554432L, List.of()));
            available.put("Style", new OptionMetadata(
                    "Style", OptionType.COMBO, OptionValue.ofString("Normal"), null, null,
                    List.of("Solid", "Normal", "Risky")));
            available.put("Clear Hash", new OptionMetadata("Clear Hash", OptionType.BUTTON, null, null, null, null));
            when(bridge.getAvailableOptions()).thenReturn(available);
            when(bridge.getCurrentOptionValues()).thenReturn(Map.of("Hash", OptionValue.ofInteger(256)));

            JsonNode options = tools.call("get_engine_options", null).at("/structuredContent/options");

            assertThat(options.fieldNames()).toIterable().containsExactly("Hash", "Style", "Clear Hash");
            assertThat(options.at("/Hash/metadata/type").asText()).isEqualTo("spin");
            assertThat(options.at("/Hash/metadata/max").asLong()).isEqualTo(33554432L);
            assertThat(options.at("/Hash/current_value").asInt()).isEqualTo(256);
            assertThat(options.at("/Style/metadata/vars").toString()).isEqualTo("[\"Solid\",\"Normal\",\"Risky\"]");
            assertThat(options.at("/Style/current_value").asText()).isEqualTo("Normal");
            assertThat(options.at("/Clear Hash/metadata").has("min")).isFalse();
            assertThat(options.at("/Clear Hash/current_value").isNull()).isTrue();
        }

        @Test
        @DisplayName("set_engine_options maps JSON values and reports applied and errors")
        void setEngineOptions() throws Exception {
            Map<String, OptionValue> expected = new LinkedHashMap<>();
            expected.put("Hash", OptionValue.ofInteger(64));
            expected.put("Ponder", OptionValue.ofBoolean(true));
            expected.put("Style", OptionValue.ofString("Risky"));
            expected.put("Clear Hash", OptionValue.none());
            when(bridge.setOptions(expected))
                    .thenReturn(new OptionsUpdate(
                            Map.of("Hash", OptionValue.ofInteger(64)),
                            Map.of("Ponder", "Unsupported option: 'Ponder'")));

            JsonNode result = tools.call(
                    "set_engine_options",
                    args("{\"options\":{\"Hash\":64,\"Ponder\":true,\"Style\":\"Risky\",\"Clear Hash\":null}}"));

            JsonNode structured = result.get("structuredContent");
            assertThat(result.get("isError").asBoolean()).isFalse();
            assertThat(structured.get("success").asBoolean()).isFalse();
            assertThat(structured.at("/applied_options/Hash").asInt()).isEqualTo(64);
            assertThat(structured.at("/errors/Ponder").asText()).contains("Unsupported option");
        }

        @Test
        @DisplayName("set_engine_options rejects empty maps and non-scalar values")
        void setEngineOptionsSchema() {
            assertThatThrownBy(() -> tools.call("set_engine_options", args("{\"options\":{}}")))
                    .isInstanceOf(ToolCallException.class);
            assertThatThrownBy(() -> tools.call("set_engine_options", args("{\"options\":{\"Hash\":[1]}}")))
                    .isInstanceOf(ToolCallException.class);
            assertThatThrownBy(() -> tools.call("set_engine_options", args("{\"options\":{\"Hash\":1.5}}")))
                    .isInstanceOf(ToolCallException.class);
        }
    }

    @Test
    @DisplayName("Unknown tool → ToolCallException (-32602)")
    void unknownTool() {
        assertThatThrownBy(() -> tools.call("resign", null))
                .isInstanceOf(ToolCallException.class)
                .hasMessage("Unknown tool: resign");
    }

    @Test
    @DisplayName("optionValue maps JSON scalars to option values")
    void optionValueMapping() throws Exception {
        assertThat(ChessTools.optionValue(args("true"))).isEqualTo(OptionValue.ofBoolean(true));
        assertThat(ChessTools.optionValue(args("42"))).isEqualTo(OptionValue.ofInteger(42));
        assertThat(ChessTools.optionValue(args("\"<empty>\""))).isEqualTo(OptionValue.ofString("<empty>"));
        assertThat(ChessTools.optionValue(args("null"))).isEqualTo(OptionValue.none());
    }
}
