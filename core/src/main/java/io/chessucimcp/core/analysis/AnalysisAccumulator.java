package io.chessucimcp.core.analysis;

import io.chessucimcp.core.model.AnalysisResult;
import io.chessucimcp.core.model.Score;
import java.util.List;

/**
 * Running state of one search, updated line by line.
 *
 * <ul>
 * <li>depth only ever increases; a smaller or equal depth is ignored.</li>
 * <li>score is overwritten by each new score token.</li>
 * <li>pv is replaced wholesale by each non-empty {@code pv} list.</li>
 * <li>the best move is set by {@code bestmove}, which also concludes the search.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe; owned by one collector call.
 */
public final class AnalysisAccumulator {

    private int depth;
    private Score score;
    private List<String> pv = List.of();
    private String bestMove;
    private String ponder;
    private boolean concluded;
    private int infoLines;

    /** Raises the depth if {@code candidate} is greater than the current one. */
    public void offerDepth(int candidate) {
        if (candidate > depth) {
            depth = candidate;
        }
    }

    public void score(Score score) {
        this.score = score;
    }

    /** Replaces the principal variation; an empty list leaves the previous one in place. */
    public void pv(List<String> moves) {
        if (!moves.isEmpty()) {
            this.pv = List.copyOf(moves);
        }
    }

    /**
     * Records the {@code bestmove} line and concludes the search.
     *
     * @param move   best move, or {@code null} when the engine reported none
     * @param ponder expected reply, or {@code null}
     */
    public void conclude(String move, String ponder) {
        this.bestMove = move;
        this.ponder = ponder;
        this.concluded = true;
    }

    void countInfoLine() {
        infoLines++;
    }

    public int depth() {
        return depth;
    }

    public Score score() {
        return score;
    }

    public List<String> pv() {
        return pv;
    }

    public String bestMove() {
        return bestMove;
    }

    public String ponder() {
        return ponder;
    }

    /** {@code true} once a {@code bestmove} line was consumed. */
    public boolean isConcluded() {
        return concluded;
    }

    public int infoLines() {
        return infoLines;
    }

    public AnalysisResult toResult() {
        return new AnalysisResult(depth, score, pv, bestMove);
    }
}
