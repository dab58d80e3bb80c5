package io.chessucimcp.core.channel;

import java.time.Duration;

/**
 * Point in monotonic time after which a wait is abandoned. Backed by {@link System#nanoTime()},
 * so wall-clock adjustments do not shorten or extend it.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, true);

    // longer waits would wrap the nanoTime arithmetic; they are treated as unbounded
    private static final Duration MAX_BOUNDED = Duration.ofNanos(Long.MAX_VALUE / 2);

    private final long deadlineNanos;
    private final boolean unbounded;

    private Deadline(long deadlineNanos, boolean unbounded) {
        this.deadlineNanos = deadlineNanos;
        this.unbounded = unbounded;
    }

    /** A deadline {@code timeout} from now; unbounded when {@code timeout} exceeds about 146 years. */
    public static Deadline after(Duration timeout) {
        if (timeout.compareTo(MAX_BOUNDED) > 0) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + timeout.toNanos(), false);
    }

    /** A deadline {@code millis} milliseconds from now. */
    public static Deadline afterMillis(long millis) {
        return after(Duration.ofMillis(millis));
    }

    /**
     * A deadline {@code millis + extraMillis} milliseconds from now, unbounded when the sum does
     * not fit in a {@code long}.
     */
    public static Deadline afterMillis(long millis, long extraMillis) {
        if (extraMillis > 0 && millis > Long.MAX_VALUE - extraMillis) {
            return NONE;
        }
        return afterMillis(millis + extraMillis);
    }

    /** A deadline that never expires. */
    public static Deadline none() {
        return NONE;
    }

    public boolean isUnbounded() {
        return unbounded;
    }

    /** Nanoseconds left, never negative; {@link Long#MAX_VALUE} when unbounded. */
    public long remainingNanos() {
        if (unbounded) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    public boolean isExpired() {
        return !unbounded && deadlineNanos - System.nanoTime() <= 0;
    }
}
