package io.chessucimcp.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Value of a UCI option. Exactly one of four kinds:
 *
 * <ul>
 * <li>{@link Kind#BOOLEAN}: {@code check} options.
 * <li>{@link Kind#INTEGER}: {@code spin} options.
 * <li>{@link Kind#STRING}: {@code combo} and {@code string} options, and untyped text coming
 * from configuration before it is coerced.
 * <li>{@link Kind#NONE}: no value ({@code button} presses, unset strings).
 * </ul>
 */
public final class OptionValue {

    /** The kind of value held. */
    public enum Kind {
        BOOLEAN,
        INTEGER,
        STRING,
        NONE
    }

    /** Wire placeholder UCI uses for an empty string value. */
    public static final String EMPTY_TOKEN = "<empty>";

    private static final OptionValue NONE = new OptionValue(Kind.NONE, null);
    private static final OptionValue TRUE = new OptionValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final OptionValue FALSE = new OptionValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private OptionValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static OptionValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static OptionValue ofInteger(long value) {
        return new OptionValue(Kind.INTEGER, value);
    }

    public static OptionValue ofString(String value) {
        Objects.requireNonNull(value, "value must not be null; use OptionValue.none()");
        return new OptionValue(Kind.STRING, value);
    }

    public static OptionValue none() {
        return NONE;
    }

    /**
     * Wraps a plain Java value: {@link Boolean}, integral {@link Number}, {@link CharSequence} or
     * {@code null}.
     *
     * @throws IllegalArgumentException for any other type, including fractional numbers
     */
    public static OptionValue of(Object raw) {
        if (raw == null) {
            return NONE;
        }
        if (raw instanceof OptionValue optionValue) {
            return optionValue;
        }
        if (raw instanceof Boolean b) {
            return ofBoolean(b);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ofInteger(((Number) raw).longValue());
        }
        if (raw instanceof CharSequence text) {
            return ofString(text.toString());
        }
        throw new IllegalArgumentException("Unsupported option value type: "
                + raw.getClass().getSimpleName());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /** @throws IllegalStateException if this is not a {@link Kind#BOOLEAN} */
    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    /** @throws IllegalStateException if this is not an {@link Kind#INTEGER} */
    public long asInteger() {
        requireKind(Kind.INTEGER);
        return (Long) value;
    }

    /** @throws IllegalStateException if this is not a {@link Kind#STRING} */
    public String asString() {
        requireKind(Kind.STRING);
        return (String) value;
    }

    /**
     * Text as sent after {@code value} in a {@code setoption} command. Empty and absent strings
     * use the {@code <empty>} placeholder.
     */
    public String toWireValue() {
        return switch (kind) {
            case BOOLEAN, INTEGER -> value.toString();
            case STRING -> ((String) value).isEmpty() ? EMPTY_TOKEN : (String) value;
            case NONE -> EMPTY_TOKEN;
        };
    }

    /**
     * Converts textual configuration input to the kind the option type expects. Text that does
     * not parse is returned unchanged so validation can report it.
     *
     * @param type the advertised option type
     * @return the coerced value, or {@code this} when no coercion applies
     */
    public OptionValue coerceTo(OptionType type) {
        if (kind != Kind.STRING) {
            return this;
        }
        String text = ((String) value).trim();
        return switch (type) {
            case CHECK -> {
                String lower = text.toLowerCase(Locale.ROOT);
                yield "true".equals(lower) || "false".equals(lower) ? ofBoolean(Boolean.parseBoolean(lower)) : this;
            }
            case SPIN -> {
                try {
                    yield ofInteger(Long.parseLong(text));
                } catch (NumberFormatException e) {
                    yield this;
                }
            }
            default -> this;
        };
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Option value is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionValue that)) return false;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.NONE ? "none" : String.valueOf(value);
    }
}
