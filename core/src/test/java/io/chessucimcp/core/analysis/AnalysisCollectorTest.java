package io.chessucimcp.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chessucimcp.core.channel.Deadline;
import io.chessucimcp.core.channel.LineChannel;
import io.chessucimcp.core.error.EngineTimeoutException;
import io.chessucimcp.core.error.ProcessClosedException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AnalysisCollector")
class AnalysisCollectorTest {

    private static AnalysisCollector scripted(String output) {
        LineChannel channel = new LineChannel(
                new ByteArrayInputStream(output.getBytes(StandardCharsets.UTF_8)), new ByteArrayOutputStream(), "test");
        return new AnalysisCollector(channel, "/opt/engines/test");
    }

    @Test
    @DisplayName("collect() folds info lines until bestmove")
    void collectsUntilBestMove() {
        AnalysisCollector collector = scripted("""
                info depth 1 score cp 20 pv e2e4
                info string NNUE evaluation enabled
                info depth 3 score cp 35 pv e2e4 e7e5 g1f3
                info depth 2 score cp 30 pv d2d4
                bestmove e2e4 ponder e7e5
                info depth 1 score cp 99 pv a2a3
                """);

        AnalysisAccumulator acc = collector.collect(Deadline.afterMillis(2000));

        assertThat(acc.isConcluded()).isTrue();
        assertThat(acc.depth()).isEqualTo(3);
        assertThat(acc.score().pawns()).isEqualTo(0.30);
        assertThat(acc.pv()).containsExactly("d2d4");
        assertThat(acc.bestMove()).isEqualTo("e2e4");
        assertThat(acc.infoLines()).isEqualTo(3);
    }

    @Test
    @DisplayName("collect() returns the partial result when the deadline passes")
    void collectReturnsPartial() throws IOException {
        PipedOutputStream engineOut = new PipedOutputStream();
        LineChannel channel = new LineChannel(new PipedInputStream(engineOut), new ByteArrayOutputStream(), "slow");
        AnalysisCollector collector = new AnalysisCollector(channel, "slow");
        engineOut.write("info depth 7 score cp 12 pv g1f3\n".getBytes(StandardCharsets.UTF_8));
        engineOut.flush();

        long start = System.nanoTime();
        AnalysisAccumulator acc = collector.collect(Deadline.afterMillis(200));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(acc.isConcluded()).isFalse();
        assertThat(acc.depth()).isEqualTo(7);
        assertThat(acc.bestMove()).isNull();
        assertThat(elapsedMs).isLessThan(1500);

        channel.close();
        engineOut.close();
    }

    @Test
    @DisplayName("collect() fails when the engine output closes first")
    void collectFailsOnClose() {
        AnalysisCollector collector = scripted("info depth 1\n");

        assertThatThrownBy(() -> collector.collect(Deadline.afterMillis(2000)))
                .isInstanceOf(ProcessClosedException.class);
    }

    @Test
    @DisplayName("awaitBestMove() discards info and returns the move")
    void awaitBestMove() {
        AnalysisCollector collector = scripted("info depth 9 score cp 1 pv b1c3\nbestmove b1c3\n");

        assertThat(collector.awaitBestMove(Deadline.afterMillis(2000)).bestMove()).isEqualTo("b1c3");
    }

    @Test
    @DisplayName("awaitBestMove() times out with EngineTimeoutException")
    void awaitBestMoveTimesOut() throws IOException {
        PipedOutputStream engineOut = new PipedOutputStream();
        LineChannel channel = new LineChannel(new PipedInputStream(engineOut), new ByteArrayOutputStream(), "silent");
        AnalysisCollector collector = new AnalysisCollector(channel, "silent");

        assertThatThrownBy(() -> collector.awaitBestMove(Deadline.afterMillis(100)))
                .isInstanceOf(EngineTimeoutException.class)
                .hasMessageContaining("bestmove");

        channel.close();
        engineOut.close();
    }
}
