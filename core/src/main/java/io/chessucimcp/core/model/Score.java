package io.chessucimcp.core.model;

/**
 * Engine evaluation from the side to move: either centipawns expressed in pawns, or a forced
 * mate in {@code mateIn} moves (negative when the side to move is getting mated).
 */
public record Score(Kind kind, double pawns, int mateIn) {

    public enum Kind {
        CENTIPAWNS,
        MATE
    }

    /** Score from a {@code score cp <c>} token; stored as {@code c / 100}. */
    public static Score centipawns(int centipawns) {
        return new Score(Kind.CENTIPAWNS, centipawns / 100.0, 0);
    }

    /** Score from a {@code score mate <n>} token. */
    public static Score mate(int moves) {
        return new Score(Kind.MATE, 0.0, moves);
    }

    public boolean isMate() {
        return kind == Kind.MATE;
    }

    /** Mate marker text, e.g. {@code "mate3"} or {@code "mate-2"}. */
    public String mateMarker() {
        return "mate" + mateIn;
    }

    @Override
    public String toString() {
        return isMate() ? mateMarker() : Double.toString(pawns);
    }
}
