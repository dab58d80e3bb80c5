package io.chessucimcp.mcp.server;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Newline-delimited JSON-RPC over a pair of byte streams, normally the process's standard
 * input and output. One message per line, UTF-8, responses flushed as soon as they are written.
 *
 * <p>
 * Requests are handled one at a time in arrival order.
 */
public final class StdioTransport {

    private static final Logger LOG = LoggerFactory.getLogger(StdioTransport.class);

    private final InputStream input;
    private final OutputStream output;
    private final McpRequestHandler handler;

    public StdioTransport(InputStream input, OutputStream output, McpRequestHandler handler) {
        this.input = input;
        this.output = output;
        this.handler = handler;
    }

    /**
     * Serves until the input reaches end-of-file.
     *
     * @return the number of messages read
     * @throws IOException if reading or writing fails
     */
    public int serve() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        Writer writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        int messages = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            messages++;
            Optional<String> response = handler.handle(line);
            if (response.isPresent()) {
                writer.write(response.get());
                writer.write('\n');
                writer.flush();
            }
        }
        LOG.info("Input closed after {} messages", messages);
        return messages;
    }
}
