package io.chessucimcp.core.option;

import io.chessucimcp.core.error.InvalidOptionValueException;
import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionValue;
import java.util.Locale;

/**
 * Type-specific validation of option values against advertised metadata.
 *
 * <ul>
 * <li>{@code check}: boolean</li>
 * <li>{@code spin}: integer within {@code [min, max]} (each bound only if advertised)</li>
 * <li>{@code combo}: one of the advertised {@code var} values (exact match)</li>
 * <li>{@code string}: string or none</li>
 * <li>{@code button}: not validated; always yields none</li>
 * </ul>
 *
 * Thread-safe : stateless.
 */
public final class OptionValidator {

    private OptionValidator() {
        // utility class
    }

    /**
     * Validates {@code value} for {@code meta}.
     *
     * @return the value to send, normalized ({@code button} → none)
     * @throws InvalidOptionValueException if the value does not fit the option
     */
    public static OptionValue validate(OptionMetadata meta, OptionValue value) {
        String name = meta.name();
        return switch (meta.type()) {
            case CHECK -> {
                if (value.kind() != OptionValue.Kind.BOOLEAN) {
                    throw invalid(name, "Option '" + name + "' expects a boolean value, got " + describe(value));
                }
                yield value;
            }
            case SPIN -> {
                if (value.kind() != OptionValue.Kind.INTEGER) {
                    throw invalid(name, "Option '" + name + "' expects an integer value, got " + describe(value));
                }
                long v = value.asInteger();
                if (meta.min() != null && v < meta.min()) {
                    throw invalid(name, "Value " + v + " for option '" + name + "' is below minimum " + meta.min());
                }
                if (meta.max() != null && v > meta.max()) {
                    throw invalid(name, "Value " + v + " for option '" + name + "' is above maximum " + meta.max());
                }
                yield value;
            }
            case COMBO -> {
                if (value.kind() != OptionValue.Kind.STRING || !meta.allowedValues().contains(value.asString())) {
                    throw invalid(
                            name,
                            "Value " + describe(value) + " for option '" + name + "' is not one of "
                                    + meta.allowedValues());
                }
                yield value;
            }
            case STRING -> {
                if (value.kind() != OptionValue.Kind.STRING && !value.isNone()) {
                    throw invalid(name, "Option '" + name + "' expects a string value, got " + describe(value));
                }
                yield value;
            }
            case BUTTON -> OptionValue.none();
        };
    }

    private static InvalidOptionValueException invalid(String name, String message) {
        return new InvalidOptionValueException(message, name);
    }

    private static String describe(OptionValue value) {
        return switch (value.kind()) {
            case STRING -> "'" + value.asString() + "'";
            case NONE -> "no value";
            default -> value.kind().name().toLowerCase(Locale.ROOT) + " " + value;
        };
    }
}
