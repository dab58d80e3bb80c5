package io.chessucimcp.mcp.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine;

/**
 * Parsed command line of {@code chess-uci-mcp}.
 *
 * <pre>
 * chess-uci-mcp [ENGINE_PATH] [-o|--uci-option NAME VALUE]... [--think-time MS]
 *               [--debug|--no-debug] [--config PATH] [--help]
 * </pre>
 *
 * Absent settings are {@code null} so that {@link ConfigLoader} can tell them apart from values
 * that override the YAML file and environment.
 */
@CommandLine.Command(
        name = "chess-uci-mcp",
        description = "Starts an MCP server on stdin/stdout backed by a UCI chess engine.",
        sortOptions = false)
public final class CommandLineArgs {

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "ENGINE_PATH",
            description = "UCI engine executable (overrides engine.path and CHESS_ENGINE_PATH).")
    private String enginePath;

    @CommandLine.Option(
            names = {"-o", "--uci-option"},
            arity = "2",
            paramLabel = "NAME VALUE",
            description = "Set a UCI option (repeatable, e.g. -o Threads 4).")
    private List<String> uciOptionPairs = new ArrayList<>();

    @CommandLine.Option(
            names = "--think-time",
            paramLabel = "MS",
            description = "Default thinking time in milliseconds.")
    private Integer thinkTimeMs;

    @CommandLine.Option(names = "--debug", description = "Enable debug logging.")
    private boolean debugFlag;

    @CommandLine.Option(names = "--no-debug", description = "Disable debug logging.")
    private boolean noDebugFlag;

    @CommandLine.Option(
            names = "--config",
            paramLabel = "PATH",
            description = "YAML configuration file (default: first of ./chess-uci-mcp.yaml, ~/.config/chess-uci-mcp/config.yaml, /etc/chess-uci-mcp/config.yaml).")
    private Path configPath;

    @CommandLine.Option(
            names = {"-h", "--help"},
            usageHelp = true,
            description = "Show this message and exit.")
    private boolean help;

    private Map<String, String> uciOptions = Map.of();

    private CommandLineArgs() {}

    /** Usage text as printed for {@code --help} and appended to parse errors. */
    public static String usage() {
        return new CommandLine(new CommandLineArgs()).getUsageMessage(CommandLine.Help.Ansi.OFF);
    }

    /** Arguments of a bare invocation: everything comes from YAML and environment. */
    public static CommandLineArgs empty() {
        return parse(new String[0]);
    }

    /**
     * Parses {@code args}.
     *
     * @throws IllegalArgumentException with the usage text if the arguments are malformed
     */
    public static CommandLineArgs parse(String[] args) {
        CommandLineArgs parsed = new CommandLineArgs();
        try {
            new CommandLine(parsed).parseArgs(args);
        } catch (CommandLine.ParameterException e) {
            throw usageError(e.getMessage());
        }
        if (parsed.thinkTimeMs != null && parsed.thinkTimeMs <= 0) {
            throw usageError("--think-time must be positive, got " + parsed.thinkTimeMs);
        }
        if (parsed.debugFlag && parsed.noDebugFlag) {
            throw usageError("--debug and --no-debug are mutually exclusive");
        }

        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i + 1 < parsed.uciOptionPairs.size(); i += 2) {
            options.put(parsed.uciOptionPairs.get(i), parsed.uciOptionPairs.get(i + 1));
        }
        parsed.uciOptions = Collections.unmodifiableMap(options);
        return parsed;
    }

    private static IllegalArgumentException usageError(String message) {
        return new IllegalArgumentException(message + System.lineSeparator() + usage());
    }

    /** Engine executable given as the positional argument, or {@code null}. */
    public String enginePath() {
        return enginePath;
    }

    /** {@code -o NAME VALUE} pairs in command-line order; later repeats of a name win. */
    public Map<String, String> uciOptions() {
        return uciOptions;
    }

    public Integer thinkTimeMs() {
        return thinkTimeMs;
    }

    /** {@code TRUE} for {@code --debug}, {@code FALSE} for {@code --no-debug}, else {@code null}. */
    public Boolean debug() {
        if (debugFlag) {
            return Boolean.TRUE;
        }
        return noDebugFlag ? Boolean.FALSE : null;
    }

    public Path configPath() {
        return configPath;
    }

    public boolean help() {
        return help;
    }
}
