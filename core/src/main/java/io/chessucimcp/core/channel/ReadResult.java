package io.chessucimcp.core.channel;

import java.util.Objects;

/**
 * Outcome of {@link LineChannel#readLine(Deadline)}: a line, a timeout, or end-of-stream.
 * Timeout and end-of-stream are distinct so callers can tell a slow engine from a dead one.
 */
public final class ReadResult {

    /** The kind of read outcome. */
    public enum Type {
        LINE,
        TIMEOUT,
        CLOSED
    }

    private static final ReadResult TIMEOUT = new ReadResult(Type.TIMEOUT, null);
    private static final ReadResult CLOSED = new ReadResult(Type.CLOSED, null);

    private final Type type;
    private final String line;

    private ReadResult(Type type, String line) {
        this.type = type;
        this.line = line;
    }

    public static ReadResult line(String line) {
        Objects.requireNonNull(line, "line must not be null");
        return new ReadResult(Type.LINE, line);
    }

    public static ReadResult timeout() {
        return TIMEOUT;
    }

    public static ReadResult closed() {
        return CLOSED;
    }

    public Type type() {
        return type;
    }

    public boolean isLine() {
        return type == Type.LINE;
    }

    public boolean isTimeout() {
        return type == Type.TIMEOUT;
    }

    public boolean isClosed() {
        return type == Type.CLOSED;
    }

    /** The line without its terminator; {@code null} unless {@link #isLine()}. */
    public String line() {
        return line;
    }

    @Override
    public String toString() {
        return type == Type.LINE ? "LINE[" + line + "]" : type.name();
    }
}
