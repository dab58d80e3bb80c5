package io.chessucimcp.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one analysis call.
 *
 * @param depth    deepest search depth reported, {@code 0} if none was reported
 * @param score    latest score reported, or {@code null}
 * @param pv       latest principal variation, empty if none was reported
 * @param bestMove best move from the {@code bestmove} line, or {@code null} when the deadline
 *                 passed first or the engine had no move
 */
public record AnalysisResult(int depth, Score score, List<String> pv, String bestMove) {

    public AnalysisResult {
        pv = pv == null ? List.of() : List.copyOf(pv);
    }

    public Optional<String> bestMoveOpt() {
        return Optional.ofNullable(bestMove);
    }
}
