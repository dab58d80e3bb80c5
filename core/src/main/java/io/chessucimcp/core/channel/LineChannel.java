package io.chessucimcp.core.channel;

import io.chessucimcp.core.error.EngineInterruptedException;
import io.chessucimcp.core.error.ProcessClosedException;
import io.chessucimcp.core.error.WriteException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-framed, UTF-8 text channel over an engine's standard output and standard input. Lines
 * end at {@code \n}; a {@code \r} is removed only when it directly precedes that terminator.
 *
 * <p>
 * A daemon reader thread blocks on the output stream and queues each framed line; end-of-file
 * queues a single {@link ReadResult#closed()} marker. {@link #readLine(Deadline)} is one timed
 * poll on that queue, so a deadline can fire while the reader thread is still blocked on the
 * pipe without losing or splitting any line: a line that arrives after a timed-out read is
 * simply returned by the next read.
 *
 * <p>
 * Writes are serialized on a lock so concurrent writers never interleave within a line.
 *
 * <p>
 * After {@link #close()}, reads and writes fail fast with {@link ProcessClosedException}, and a
 * read blocked at the time of closing is woken up with the same exception.
 */
public final class LineChannel implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LineChannel.class);

    private final String name;
    private final BlockingQueue<ReadResult> queue = new LinkedBlockingQueue<>();
    private final Writer writer;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a channel and starts its reader thread.
     *
     * @param input  the engine's standard output
     * @param output the engine's standard input
     * @param name   label for the reader thread and log messages (usually the executable)
     */
    public LineChannel(InputStream input, OutputStream output, String name) {
        this.name = name;
        this.writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        Thread readerThread = new Thread(() -> pump(reader), "uci-reader-" + name);
        readerThread.setDaemon(true);
        readerThread.start();
    }

    /**
     * Writes {@code text} followed by a single newline and flushes.
     *
     * @throws ProcessClosedException if the channel was closed
     * @throws WriteException         if the underlying stream rejects the write
     */
    public void writeLine(String text) {
        if (closed.get()) {
            throw new ProcessClosedException("Cannot send '" + text + "': engine channel is closed", name);
        }
        writeLock.lock();
        try {
            LOG.debug("Sending command: {}", text);
            writer.write(text);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            if (closed.get()) {
                // close() skipped the writer while this write was blocked
                closeWriter();
            }
            throw new WriteException("Failed to send '" + text + "' to engine: " + e.getMessage(), e, name);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * {@code true} while another thread holds the write lock, for instance because the engine
     * stopped reading and the pipe is full.
     */
    public boolean isWriteInFlight() {
        return writeLock.isLocked() && !writeLock.isHeldByCurrentThread();
    }

    /**
     * Waits for the next line until {@code deadline}.
     *
     * @return the line, {@link ReadResult#timeout()} if the deadline passed first, or
     *         {@link ReadResult#closed()} once the engine's output reached end-of-file (sticky)
     * @throws ProcessClosedException      if the channel was closed before or during the wait
     * @throws EngineInterruptedException  if the calling thread is interrupted
     */
    public ReadResult readLine(Deadline deadline) {
        ensureOpen();
        ReadResult result;
        try {
            result = deadline.isUnbounded()
                    ? queue.take()
                    : queue.poll(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineInterruptedException("Interrupted while waiting for engine output", e, name);
        }
        if (result == null) {
            return ReadResult.timeout();
        }
        if (result.isClosed()) {
            // keep end-of-stream visible to every later read
            queue.offer(result);
            ensureOpen();
        }
        return result;
    }

    /** {@code true} once {@link #close()} was called. */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the command stream and wakes any waiting reader. Idempotent and never blocks: when a
     * write is in flight the stream is closed by that writer once its write fails. The reader
     * thread ends on its own when the process output reaches end-of-file.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queue.offer(ReadResult.closed());
        if (!writeLock.tryLock()) {
            LOG.debug("Write to {} in flight, deferring close of engine input stream", name);
            return;
        }
        try {
            closeWriter();
        } finally {
            writeLock.unlock();
        }
    }

    private void closeWriter() {
        try {
            writer.close();
        } catch (IOException e) {
            LOG.debug("Error closing engine input stream: {}", e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ProcessClosedException("Engine channel is closed", name);
        }
    }

    private void pump(BufferedReader reader) {
        try {
            String line;
            while ((line = nextLine(reader)) != null) {
                LOG.debug("Engine output: {}", line);
                queue.offer(ReadResult.line(line));
            }
            LOG.debug("Engine output stream ended");
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.warn("Error reading engine output: {}", e.getMessage());
            }
        } finally {
            queue.offer(ReadResult.closed());
        }
    }

    /**
     * Reads up to the next {@code \n} and drops one trailing {@code \r}. A lone {@code \r} is
     * line content, unlike {@link BufferedReader#readLine()}. Returns {@code null} at end-of-file
     * when nothing is pending.
     */
    private static String nextLine(BufferedReader reader) throws IOException {
        StringBuilder line = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1) {
            if (c == '\n') {
                return stripCarriageReturn(line);
            }
            line.append((char) c);
        }
        return line.length() == 0 ? null : stripCarriageReturn(line);
    }

    private static String stripCarriageReturn(StringBuilder line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }
}
