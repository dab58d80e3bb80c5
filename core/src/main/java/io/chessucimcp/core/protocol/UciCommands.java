package io.chessucimcp.core.protocol;

import io.chessucimcp.core.model.OptionType;
import io.chessucimcp.core.model.OptionValue;
import java.util.List;

/**
 * Formats outbound UCI commands. Every piece of caller text is checked for line breaks first,
 * because a stray newline would smuggle an extra command into the engine's input.
 */
public final class UciCommands {

    public static final String UCI = "uci";
    public static final String IS_READY = "isready";
    public static final String STOP = "stop";
    public static final String QUIT = "quit";

    private UciCommands() {
        // utility class
    }

    /** {@code setoption name <N> value <V>}, or {@code setoption name <N>} for buttons. */
    public static String setOption(String name, OptionType type, OptionValue value) {
        requireSingleLine(name, "option name");
        if (type == OptionType.BUTTON) {
            return "setoption name " + name;
        }
        String wire = value.toWireValue();
        requireSingleLine(wire, "option value");
        return "setoption name " + name + " value " + wire;
    }

    /**
     * {@code position fen <FEN> [moves …]}, or {@code position startpos [moves …]} when
     * {@code fen} is {@code null} or blank.
     */
    public static String position(String fen, List<String> moves) {
        StringBuilder cmd = new StringBuilder("position");
        if (fen == null || fen.isBlank()) {
            cmd.append(" startpos");
        } else {
            requireSingleLine(fen, "FEN");
            cmd.append(" fen ").append(fen.strip());
        }
        if (moves != null && !moves.isEmpty()) {
            cmd.append(" moves");
            for (String move : moves) {
                cmd.append(' ').append(requireMoveToken(move));
            }
        }
        return cmd.toString();
    }

    /** {@code go movetime <ms>}. */
    public static String goMoveTime(long timeMs) {
        if (timeMs <= 0) {
            throw new IllegalArgumentException("Think time must be positive, got " + timeMs);
        }
        return "go movetime " + timeMs;
    }

    /**
     * Checks the shape of a coordinate move ({@code e2e4}, {@code e7e8q}): 4 or 5 characters,
     * no whitespace. Legality is the engine's concern.
     *
     * @return the token unchanged
     */
    public static String requireMoveToken(String move) {
        if (move == null || move.length() < 4 || move.length() > 5 || !move.chars().allMatch(Character::isLetterOrDigit)) {
            throw new IllegalArgumentException("Invalid move token: '" + move + "'");
        }
        return move;
    }

    private static void requireSingleLine(String text, String what) {
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new IllegalArgumentException(what + " must not contain line breaks");
        }
    }
}
