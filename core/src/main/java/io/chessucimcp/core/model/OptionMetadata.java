package io.chessucimcp.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Metadata of one engine option, parsed from an {@code option} line during the handshake.
 *
 * @param name         option name, case-sensitive
 * @param type         advertised type
 * @param defaultValue advertised default, {@link OptionValue#none()} when absent
 * @param min          lower bound, {@code spin} only; {@code null} when not advertised
 * @param max          upper bound, {@code spin} only; {@code null} when not advertised
 * @param allowedValues allowed values, {@code combo} only; empty otherwise
 */
public record OptionMetadata(
        String name, OptionType type, OptionValue defaultValue, Long min, Long max, List<String> allowedValues) {

    public OptionMetadata {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (defaultValue == null) {
            defaultValue = OptionValue.none();
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }
}
