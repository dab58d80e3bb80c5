package io.chessucimcp.core.protocol;

import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionType;
import io.chessucimcp.core.model.OptionValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses UCI {@code option} lines:
 *
 * <pre>{@code
 * option name <N> type <T> [default <D>] [min <m>] [max <M>] [var <V>]*
 * }</pre>
 *
 * <p>
 * Tokens are consumed left to right. Each keyword collects the tokens up to the next keyword,
 * joined by single spaces, so multi-word names such as {@code Skill Level} survive. {@code var}
 * may repeat; every occurrence adds one allowed value. {@code <empty>} stands for the empty
 * string. Thread-safe; stateless.
 */
public final class OptionLineParser {

    private static final Logger LOG = LoggerFactory.getLogger(OptionLineParser.class);

    private static final Set<String> KEYWORDS = Set.of("name", "type", "default", "min", "max", "var");

    private OptionLineParser() {
        // utility class
    }

    /**
     * Parses one line.
     *
     * @param line a line starting with {@code option}
     * @return the metadata, or empty when the line has no name or no recognized type
     */
    public static Optional<OptionMetadata> parse(String line) {
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length == 0 || !"option".equals(tokens[0])) {
            return Optional.empty();
        }

        String name = null;
        String typeToken = null;
        String defaultText = null;
        String minText = null;
        String maxText = null;
        List<String> vars = new ArrayList<>();

        int i = 1;
        while (i < tokens.length) {
            String keyword = tokens[i];
            if (!KEYWORDS.contains(keyword)) {
                // stray token outside any keyword; skip it
                i++;
                continue;
            }
            int start = ++i;
            while (i < tokens.length && !KEYWORDS.contains(tokens[i])) {
                i++;
            }
            String value = String.join(" ", Arrays.asList(tokens).subList(start, i));
            switch (keyword) {
                case "name" -> name = value;
                case "type" -> typeToken = value;
                case "default" -> defaultText = value;
                case "min" -> minText = value;
                case "max" -> maxText = value;
                case "var" -> vars.add(unescapeEmpty(value));
                default -> throw new IllegalStateException("Unhandled keyword: " + keyword);
            }
        }

        if (name == null || name.isEmpty()) {
            LOG.debug("Ignoring option line without a name: {}", line);
            return Optional.empty();
        }
        Optional<OptionType> type = OptionType.fromToken(typeToken);
        if (type.isEmpty()) {
            LOG.debug("Ignoring option '{}' with unrecognized type '{}'", name, typeToken);
            return Optional.empty();
        }

        OptionType optionType = type.get();
        Long min = optionType == OptionType.SPIN ? parseLong(minText, name, "min") : null;
        Long max = optionType == OptionType.SPIN ? parseLong(maxText, name, "max") : null;
        List<String> allowed = optionType == OptionType.COMBO ? vars : List.of();
        OptionValue defaultValue = parseDefault(optionType, defaultText, name);
        return Optional.of(new OptionMetadata(name, optionType, defaultValue, min, max, allowed));
    }

    private static OptionValue parseDefault(OptionType type, String text, String name) {
        if (text == null) {
            return OptionValue.none();
        }
        return switch (type) {
            case CHECK -> OptionValue.ofBoolean(Boolean.parseBoolean(text));
            case SPIN -> {
                Long value = parseLong(text, name, "default");
                yield value != null ? OptionValue.ofInteger(value) : OptionValue.none();
            }
            case COMBO, STRING -> OptionValue.ofString(unescapeEmpty(text));
            case BUTTON -> OptionValue.none();
        };
    }

    private static Long parseLong(String text, String name, String field) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            LOG.debug("Option '{}' has non-numeric {} '{}'", name, field, text);
            return null;
        }
    }

    private static String unescapeEmpty(String text) {
        return OptionValue.EMPTY_TOKEN.equals(text) ? "" : text;
    }
}
