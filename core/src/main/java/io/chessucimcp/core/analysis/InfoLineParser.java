package io.chessucimcp.core.analysis;

import io.chessucimcp.core.model.Score;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Folds UCI {@code info} and {@code bestmove} lines into an {@link AnalysisAccumulator}.
 *
 * <p>
 * Only {@code depth}, {@code score cp|mate} and {@code pv} are interpreted. A {@code pv} list
 * runs until the next {@code depth}, {@code score} or {@code time} token or the end of the
 * line. Malformed numbers are skipped without failing the line. {@code info string} lines carry
 * free text and are ignored.
 */
public final class InfoLineParser {

    private static final Set<String> PV_TERMINATORS = Set.of("depth", "score", "time");
    private static final Set<String> NULL_MOVES = Set.of("(none)", "0000");

    private InfoLineParser() {
        // utility class
    }

    /** {@code true} for lines starting with the {@code info} keyword. */
    public static boolean isInfo(String line) {
        return line.equals("info") || line.startsWith("info ");
    }

    /** {@code true} for lines starting with the {@code bestmove} keyword. */
    public static boolean isBestMove(String line) {
        return line.equals("bestmove") || line.startsWith("bestmove ");
    }

    /** Applies one {@code info} line. */
    public static void applyInfo(String line, AnalysisAccumulator acc) {
        String[] parts = line.strip().split("\\s+");
        if (parts.length > 1 && "string".equals(parts[1])) {
            return;
        }
        acc.countInfoLine();
        int i = 1;
        while (i < parts.length) {
            switch (parts[i]) {
                case "depth" -> {
                    if (i + 1 < parts.length) {
                        Integer depth = parseInt(parts[i + 1]);
                        if (depth != null) {
                            acc.offerDepth(depth);
                        }
                        i += 2;
                    } else {
                        i++;
                    }
                }
                case "score" -> {
                    if (i + 2 < parts.length) {
                        Integer value = parseInt(parts[i + 2]);
                        if (value != null && "cp".equals(parts[i + 1])) {
                            acc.score(Score.centipawns(value));
                        } else if (value != null && "mate".equals(parts[i + 1])) {
                            acc.score(Score.mate(value));
                        }
                        i += 3;
                    } else {
                        i++;
                    }
                }
                case "pv" -> {
                    List<String> moves = new ArrayList<>();
                    i++;
                    while (i < parts.length && !PV_TERMINATORS.contains(parts[i])) {
                        moves.add(parts[i]);
                        i++;
                    }
                    acc.pv(moves);
                }
                default -> i++;
            }
        }
    }

    /**
     * Applies a {@code bestmove <move> [ponder <move>]} line and concludes the search. Null
     * moves ({@code (none)}, {@code 0000}) conclude it without a best move.
     */
    public static void applyBestMove(String line, AnalysisAccumulator acc) {
        String[] parts = line.strip().split("\\s+");
        String move = parts.length >= 2 && !NULL_MOVES.contains(parts[1]) ? parts[1] : null;
        String ponder = null;
        if (parts.length >= 4 && "ponder".equals(parts[2]) && !NULL_MOVES.contains(parts[3])) {
            ponder = parts[3];
        }
        acc.conclude(move, ponder);
    }

    private static Integer parseInt(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
