package io.chessucimcp.core.model;

import java.util.Locale;
import java.util.Optional;

/** UCI option types as advertised in {@code option name <N> type <T>} lines. */
public enum OptionType {
    CHECK("check"),
    SPIN("spin"),
    COMBO("combo"),
    BUTTON("button"),
    STRING("string");

    private final String token;

    OptionType(String token) {
        this.token = token;
    }

    /** The lowercase wire token, e.g. {@code "spin"}. */
    public String token() {
        return token;
    }

    /**
     * Resolves a wire token, case-insensitively.
     *
     * @return the type, or empty for tokens outside the UCI option vocabulary
     */
    public static Optional<OptionType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String lower = token.toLowerCase(Locale.ROOT);
        for (OptionType type : values()) {
            if (type.token.equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
