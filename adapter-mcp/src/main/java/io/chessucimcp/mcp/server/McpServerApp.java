package io.chessucimcp.mcp.server;

import io.chessucimcp.core.engine.UciEngineBridge;
import io.chessucimcp.core.spi.EngineBridge;
import io.chessucimcp.mcp.config.CommandLineArgs;
import io.chessucimcp.mcp.config.ConfigLoader;
import io.chessucimcp.mcp.config.ServerConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the server startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML, environment and command line</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Start the engine bridge (spawn, handshake, configured options)</li>
 * <li>Serve JSON-RPC on the given streams until end-of-input</li>
 * <li>Stop the engine</li>
 * </ol>
 *
 * <p>
 * This class is separate from {@link io.chessucimcp.mcp.McpMain} to allow clean integration
 * testing without going through {@code main()}.
 */
public final class McpServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(McpServerApp.class);

    public static final String SERVER_NAME = "chess-uci-mcp";
    public static final String SERVER_VERSION = "0.2.0";

    private final ServerConfig config;
    private final EngineBridge bridge;
    private final McpRequestHandler handler;

    McpServerApp(ServerConfig config, EngineBridge bridge) {
        this.config = config;
        this.bridge = bridge;
        this.handler = new McpRequestHandler(new ChessTools(bridge, config), SERVER_NAME, SERVER_VERSION);
    }

    /**
     * Executes the startup sequence and returns an application whose engine is ready.
     *
     * @param cli parsed command line
     * @return a started application
     * @throws io.chessucimcp.mcp.config.ConfigLoadException if configuration is invalid
     * @throws io.chessucimcp.core.error.EngineException      if the engine cannot be started
     */
    public static McpServerApp start(CommandLineArgs cli) {
        long startTime = System.nanoTime();

        // 1. Load configuration
        Optional<Path> configPath = ConfigLoader.resolveConfigPath(cli);
        ServerConfig config = ConfigLoader.load(cli);

        // 2. Configure Logback (stderr only)
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath.map(Path::toString).orElse("defaults"));
        config.engineOptions().forEach((name, value) -> LOG.info("UCI option configured: {} = {}", name, value));

        // 3. Start the engine
        EngineBridge bridge = new UciEngineBridge(config.toEngineSettings());
        bridge.start();

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "{} started: engine={}, path={}, thinkTimeMs={}, options={}, startupMs={}",
                SERVER_NAME,
                config.engineName(),
                config.enginePath(),
                config.defaultThinkTimeMs(),
                bridge.getAvailableOptions().size(),
                elapsedMs);

        return new McpServerApp(config, bridge);
    }

    /**
     * Serves JSON-RPC until {@code input} closes, then stops the engine.
     *
     * @throws IOException if the transport fails
     */
    public void serve(InputStream input, OutputStream output) throws IOException {
        try {
            new StdioTransport(input, output, handler).serve();
        } finally {
            stop();
        }
    }

    /** Stops the engine. Idempotent; safe from a shutdown hook. */
    public void stop() {
        LOG.info("Stopping {}", SERVER_NAME);
        bridge.stop();
    }

    public ServerConfig config() {
        return config;
    }

    public EngineBridge bridge() {
        return bridge;
    }

    McpRequestHandler handler() {
        return handler;
    }
}
