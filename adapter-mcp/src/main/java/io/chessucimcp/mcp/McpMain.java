package io.chessucimcp.mcp;

import io.chessucimcp.mcp.config.CommandLineArgs;
import io.chessucimcp.mcp.server.McpServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the chess UCI MCP server.
 *
 * <p>
 * Delegates to {@link McpServerApp#start(CommandLineArgs)} for the startup sequence, then
 * serves standard input and output until the client disconnects. On failure, logs the error
 * and exits with a non-zero status code.
 */
public final class McpMain {

    private static final Logger LOG = LoggerFactory.getLogger(McpMain.class);

    private McpMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code /usr/bin/stockfish -o Threads 4})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CommandLineArgs cli = CommandLineArgs.parse(args);
            if (cli.help()) {
                System.err.println(CommandLineArgs.usage());
                return;
            }
            McpServerApp app = McpServerApp.start(cli);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "chess-uci-mcp-shutdown"));
            app.serve(System.in, System.out);
        } catch (Exception e) {
            LOG.error("Server failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
