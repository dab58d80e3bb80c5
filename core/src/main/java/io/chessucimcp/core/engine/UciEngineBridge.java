package io.chessucimcp.core.engine;

import io.chessucimcp.core.analysis.AnalysisAccumulator;
import io.chessucimcp.core.analysis.AnalysisCollector;
import io.chessucimcp.core.channel.Deadline;
import io.chessucimcp.core.channel.LineChannel;
import io.chessucimcp.core.error.EngineException;
import io.chessucimcp.core.error.EngineNotReadyException;
import io.chessucimcp.core.error.EngineOptionException;
import io.chessucimcp.core.error.EngineTimeoutException;
import io.chessucimcp.core.error.HandshakeException;
import io.chessucimcp.core.error.ProcessClosedException;
import io.chessucimcp.core.error.WriteException;
import io.chessucimcp.core.model.AnalysisResult;
import io.chessucimcp.core.model.EngineId;
import io.chessucimcp.core.model.EngineSettings;
import io.chessucimcp.core.model.OptionMetadata;
import io.chessucimcp.core.model.OptionValue;
import io.chessucimcp.core.model.OptionsUpdate;
import io.chessucimcp.core.option.OptionRegistry;
import io.chessucimcp.core.option.OptionValidator;
import io.chessucimcp.core.process.EngineProcess;
import io.chessucimcp.core.protocol.HandshakeAccumulator;
import io.chessucimcp.core.protocol.HandshakeState;
import io.chessucimcp.core.protocol.UciCommands;
import io.chessucimcp.core.protocol.UciHandshake;
import io.chessucimcp.core.spi.EngineBridge;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EngineBridge} over a local UCI engine executable.
 *
 * <p>
 * Composes the process supervisor, the line channel, the handshake state machine, the analysis
 * collector and the option registry. Every protocol operation runs under one
 * {@link ReentrantLock}; {@link #stop()} bypasses the lock and closes the channel, which wakes
 * the operation in flight.
 *
 * <p>
 * A search whose deadline expired before {@code bestmove} leaves the engine still thinking. The
 * bridge remembers it and, before the next protocol operation, sends {@code stop} and discards
 * output up to the stray {@code bestmove}, so every command starts on a clean stream.
 */
public final class UciEngineBridge implements EngineBridge {

    private static final Logger LOG = LoggerFactory.getLogger(UciEngineBridge.class);

    private final EngineSettings settings;
    private final String label;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile EngineProcess process;
    private volatile UciHandshake handshake;
    private volatile OptionRegistry registry = OptionRegistry.EMPTY;
    private volatile EngineId engineId = EngineId.UNKNOWN;
    private AnalysisCollector collector;
    private boolean searchPending;

    public UciEngineBridge(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.label = settings.executable().toString();
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine bridge already started: " + label);
        }
        long startNanos = System.nanoTime();
        lock.lock();
        try {
            EngineProcess spawned = EngineProcess.start(settings.executable());
            LineChannel channel = spawned.channel();
            UciHandshake machine = new UciHandshake(channel, label);
            this.process = spawned;
            this.handshake = machine;
            this.collector = new AnalysisCollector(channel, label);

            Deadline deadline = Deadline.afterMillis(settings.handshakeTimeoutMs());
            try {
                machine.sendUci();
                HandshakeAccumulator accumulator = machine.awaitUciOk(deadline);
                engineId = accumulator.engineId();
                registry = new OptionRegistry(accumulator.options());
                applyConfiguredOptions(channel);
                machine.awaitReady(deadline);
            } catch (EngineException e) {
                machine.markStopped();
                spawned.kill();
                throw new HandshakeException("UCI handshake failed: " + e.getMessage(), e, label);
            }

            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.info(
                    "Engine ready: name={}, author={}, options={}, configured={}, elapsedMs={}",
                    engineId.nameOpt().orElse("unknown"),
                    engineId.authorOpt().orElse("unknown"),
                    registry.size(),
                    registry.currentValues().size(),
                    elapsedMs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends the configured options between {@code uciok} and {@code isready}. Textual values
     * are coerced to the advertised type first. A rejected option is logged and skipped.
     */
    private void applyConfiguredOptions(LineChannel channel) {
        for (Map.Entry<String, OptionValue> entry : settings.options().entrySet()) {
            String name = entry.getKey();
            try {
                OptionMetadata meta = registry.require(name);
                OptionValue value = OptionValidator.validate(meta, entry.getValue().coerceTo(meta.type()));
                channel.writeLine(UciCommands.setOption(name, meta.type(), value));
                registry.record(name, value);
                LOG.debug("Configured option applied: {}={}", name, value);
            } catch (EngineOptionException | IllegalArgumentException e) {
                LOG.warn("Configured option '{}' rejected: {}", name, e.getMessage());
            }
        }
    }

    @Override
    public void stop() {
        UciHandshake machine = handshake;
        if (machine != null) {
            machine.markStopped();
        }
        EngineProcess running = process;
        if (running != null) {
            running.stop(Duration.ofMillis(settings.quitGraceMs()));
        }
    }

    @Override
    public HandshakeState state() {
        UciHandshake machine = handshake;
        return machine == null ? HandshakeState.UNINITIALIZED : machine.state();
    }

    @Override
    public EngineSettings settings() {
        return settings;
    }

    @Override
    public AnalysisResult analyze(String fen, long timeMs) {
        String positionCommand = UciCommands.position(fen, List.of());
        String goCommand = UciCommands.goMoveTime(timeMs);
        return withEngine("analyze", () -> {
            LineChannel channel = process.channel();
            channel.writeLine(positionCommand);
            channel.writeLine(goCommand);
            searchPending = true;

            AnalysisAccumulator acc = collector.collect(Deadline.afterMillis(timeMs, settings.analysisSlackMs()));
            if (acc.isConcluded()) {
                searchPending = false;
            }
            AnalysisResult result = acc.toResult();
            LOG.info(
                    "analysis.completed depth={} score={} pvLength={} bestMove={} infoLines={} concluded={}",
                    result.depth(),
                    result.score(),
                    result.pv().size(),
                    result.bestMove(),
                    acc.infoLines(),
                    acc.isConcluded());
            return result;
        });
    }

    @Override
    public void setPosition(String fen, List<String> moves) {
        String command = UciCommands.position(fen, moves);
        withEngine("setPosition", () -> {
            process.channel().writeLine(command);
            return null;
        });
    }

    @Override
    public Optional<String> getBestMove(long timeMs) {
        String goCommand = UciCommands.goMoveTime(timeMs);
        return withEngine("getBestMove", () -> {
            process.channel().writeLine(goCommand);
            searchPending = true;
            AnalysisAccumulator acc =
                    collector.awaitBestMove(Deadline.afterMillis(timeMs, settings.bestMoveGraceMs()));
            searchPending = false;
            LOG.info("bestmove.completed move={} ponder={}", acc.bestMove(), acc.ponder());
            return Optional.ofNullable(acc.bestMove());
        });
    }

    @Override
    public EngineId getEngineId() {
        return engineId;
    }

    @Override
    public Map<String, OptionMetadata> getAvailableOptions() {
        return registry.all();
    }

    @Override
    public OptionsUpdate setOptions(Map<String, OptionValue> values) {
        Objects.requireNonNull(values, "values must not be null");
        return withEngine("setOptions", () -> {
            Map<String, OptionValue> applied = new LinkedHashMap<>();
            Map<String, String> errors = new LinkedHashMap<>();
            List<String> commands = new ArrayList<>();
            for (Map.Entry<String, OptionValue> entry : values.entrySet()) {
                String name = entry.getKey();
                OptionValue raw = entry.getValue() == null ? OptionValue.none() : entry.getValue();
                try {
                    OptionMetadata meta = registry.require(name);
                    OptionValue value = OptionValidator.validate(meta, raw);
                    commands.add(UciCommands.setOption(name, meta.type(), value));
                    applied.put(name, value);
                } catch (EngineOptionException | IllegalArgumentException e) {
                    errors.put(name, e.getMessage());
                }
            }

            LineChannel channel = process.channel();
            for (String command : commands) {
                channel.writeLine(command);
            }
            if (!commands.isEmpty()) {
                try {
                    handshake.synchronize(Deadline.afterMillis(settings.syncTimeoutMs()));
                } catch (EngineTimeoutException e) {
                    LOG.warn("Engine did not confirm option changes: {}", e.getMessage());
                }
            }
            applied.forEach(registry::record);

            LOG.info("options.updated applied={} rejected={}", applied.keySet(), errors.keySet());
            return new OptionsUpdate(applied, errors);
        });
    }

    @Override
    public Map<String, OptionValue> getCurrentOptionValues() {
        return registry.currentValues();
    }

    /**
     * Runs one protocol operation under the bridge lock. Requires {@link HandshakeState#READY}
     * and a clean stream. A stream that closes mid-operation stops the bridge.
     */
    private <T> T withEngine(String operation, Supplier<T> body) {
        lock.lock();
        try {
            UciHandshake machine = handshake;
            if (machine == null) {
                throw new EngineNotReadyException(
                        "Engine not ready for " + operation + " (state " + HandshakeState.UNINITIALIZED + ")",
                        label);
            }
            machine.requireReady(operation);
            try {
                discardAbandonedSearch();
                return body.get();
            } catch (ProcessClosedException | WriteException e) {
                if (machine.state() == HandshakeState.STOPPED) {
                    LOG.debug("{} interrupted by engine shutdown", operation);
                } else {
                    LOG.error("Engine connection lost during {}: {}", operation, e.getMessage());
                    machine.markStopped();
                }
                process.kill();
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private void discardAbandonedSearch() {
        if (!searchPending) {
            return;
        }
        process.channel().writeLine(UciCommands.STOP);
        AnalysisAccumulator tail = collector.drainToBestMove(Deadline.afterMillis(settings.syncTimeoutMs()));
        if (!tail.isConcluded()) {
            throw new EngineTimeoutException(
                    "Engine did not finish its previous search within " + settings.syncTimeoutMs() + " ms", label);
        }
        searchPending = false;
        LOG.debug("Discarded stray bestmove {} from abandoned search", tail.bestMove());
    }
}
