package io.chessucimcp.mcp.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Command line parsing")
class CommandLineArgsTest {

    @Test
    @DisplayName("Bare invocation → everything unset")
    void empty() {
        CommandLineArgs cli = CommandLineArgs.empty();

        assertThat(cli.enginePath()).isNull();
        assertThat(cli.uciOptions()).isEmpty();
        assertThat(cli.thinkTimeMs()).isNull();
        assertThat(cli.debug()).isNull();
        assertThat(cli.configPath()).isNull();
        assertThat(cli.help()).isFalse();
    }

    @Test
    @DisplayName("All flags together")
    void allFlags() {
        CommandLineArgs cli = CommandLineArgs.parse(new String[] {
            "/usr/games/stockfish",
            "-o", "Threads", "4",
            "--uci-option", "SyzygyPath", "/tb/3-4-5",
            "--think-time", "1500",
            "--no-debug",
            "--config", "server.yaml"
        });

        assertThat(cli.enginePath()).isEqualTo("/usr/games/stockfish");
        assertThat(cli.uciOptions())
                .containsExactly(Map.entry("Threads", "4"), Map.entry("SyzygyPath", "/tb/3-4-5"));
        assertThat(cli.thinkTimeMs()).isEqualTo(1500);
        assertThat(cli.debug()).isFalse();
        assertThat(cli.configPath()).isEqualTo(Path.of("server.yaml"));
    }

    @Test
    @DisplayName("Repeated -o for the same name: last one wins")
    void repeatedOption() {
        CommandLineArgs cli = CommandLineArgs.parse(new String[] {"-o", "Hash", "64", "-o", "Hash", "128"});

        assertThat(cli.uciOptions()).containsExactly(Map.entry("Hash", "128"));
    }

    @Test
    @DisplayName("Option values may start with a dash")
    void dashValue() {
        CommandLineArgs cli = CommandLineArgs.parse(new String[] {"-o", "Contempt", "-20"});

        assertThat(cli.uciOptions()).containsEntry("Contempt", "-20");
    }

    @Test
    @DisplayName("--debug and -h")
    void debugAndHelp() {
        CommandLineArgs cli = CommandLineArgs.parse(new String[] {"--debug", "-h"});

        assertThat(cli.debug()).isTrue();
        assertThat(cli.help()).isTrue();
    }

    @Test
    @DisplayName("-o without a value → usage error")
    void incompleteOption() {
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[] {"-o", "Threads"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--uci-option")
                .hasMessageContaining("Usage: chess-uci-mcp");
    }

    @Test
    @DisplayName("--think-time must be a positive integer")
    void badThinkTime() {
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[] {"--think-time", "abc"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'abc'");
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[] {"--think-time", "0"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[] {"--think-time"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--think-time");
    }

    @Test
    @DisplayName("--debug with --no-debug → usage error")
    void conflictingDebugFlags() {
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[] {"--debug", "--no-debug"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mutually exclusive");
    }

    @Test
    @DisplayName("Usage lists every option")
    void usage() {
        assertThat(CommandLineArgs.usage())
                .startsWith("Usage: chess-uci-mcp")
                .contains("ENGINE_PATH", "--uci-option", "--think-time", "--no-debug", "--config", "--help");
    }

    @Test
    @DisplayName("Unknown flag and second positional argument → usage error")
    void unexpectedArguments() {
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[] {"--verbose"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--verbose");
        assertThatThrownBy(() -> CommandLineArgs.parse(new String[] {"/a", "/b"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'/b'");
    }
}
