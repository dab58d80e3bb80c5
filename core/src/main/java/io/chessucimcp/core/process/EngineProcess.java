package io.chessucimcp.core.process;

import io.chessucimcp.core.channel.LineChannel;
import io.chessucimcp.core.error.EngineException;
import io.chessucimcp.core.error.SpawnException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervisor of one engine child process and its three standard streams.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>{@link #start(Path)}: validates the executable and spawns it with piped stdio. Standard
 * output becomes a {@link LineChannel}; standard error is drained into the log on a daemon
 * thread so the engine never blocks on a full pipe.</li>
 * <li>{@link #stop(Duration)}: sends {@code quit}, waits for a voluntary exit, then kills.</li>
 * <li>{@link #kill()}: kills immediately, used when startup fails.</li>
 * </ol>
 *
 * <p>
 * {@code stop} and {@code kill} share one idempotence flag: only the first call acts, so the
 * process is terminated at most once and never left running.
 */
public final class EngineProcess {

    private static final Logger LOG = LoggerFactory.getLogger(EngineProcess.class);

    private final Path executable;
    private final Process process;
    private final LineChannel channel;
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private EngineProcess(Path executable, Process process) {
        this.executable = executable;
        this.process = process;
        String label = executable.getFileName() != null ? executable.getFileName().toString() : executable.toString();
        this.channel = new LineChannel(process.getInputStream(), process.getOutputStream(), label);
        startStderrDrain(process.getErrorStream(), label);
    }

    /**
     * Spawns the engine.
     *
     * @param executable path of the engine binary or script
     * @return the running process
     * @throws SpawnException if the path does not exist, is not a regular executable file, or
     *                        the operating system rejects the spawn
     */
    public static EngineProcess start(Path executable) {
        String path = executable.toString();
        if (!Files.exists(executable)) {
            throw new SpawnException("Engine not found at " + path, path);
        }
        if (!Files.isRegularFile(executable)) {
            throw new SpawnException("Engine path is not a regular file: " + path, path);
        }
        if (!Files.isExecutable(executable)) {
            throw new SpawnException("Engine is not executable: " + path, path);
        }

        ProcessBuilder builder = new ProcessBuilder(path);
        Path workDir = executable.toAbsolutePath().getParent();
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SpawnException("Failed to start engine " + path + ": " + e.getMessage(), e, path);
        }
        LOG.info("Engine process started: path={}, pid={}", path, process.pid());
        return new EngineProcess(executable, process);
    }

    /** The line channel over the engine's standard output and input. */
    public LineChannel channel() {
        return channel;
    }

    public Path executable() {
        return executable;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /** {@code true} once {@link #stop(Duration)} or {@link #kill()} has run. */
    public boolean isTerminated() {
        return terminated.get();
    }

    /**
     * Asks the engine to quit and waits up to {@code grace} for it to exit; kills it
     * otherwise. Failures on this path are logged, never thrown. No-op after the first call.
     *
     * @param grace how long to wait for a voluntary exit
     */
    public void stop(Duration grace) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Stopping engine: {}", executable);
        try {
            if (channel.isWriteInFlight()) {
                LOG.warn("Engine {} is not consuming input, skipping quit", executable);
            } else if (process.isAlive()) {
                channel.writeLine("quit");
            }
        } catch (EngineException e) {
            LOG.debug("Could not send quit to engine: {}", e.getMessage());
        }

        boolean exited = false;
        try {
            exited = process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!exited) {
            LOG.warn("Engine {} did not exit within {} ms, forcing termination", executable, grace.toMillis());
            destroyAndReap();
        }
        release();
        LOG.info("Engine stopped: {} (exit code {})", executable, exitCodeOrUnknown());
    }

    /** Kills the engine immediately and reaps it. No-op after {@link #stop} or a prior kill. */
    public void kill() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        LOG.warn("Killing engine: {}", executable);
        destroyAndReap();
        release();
    }

    private void destroyAndReap() {
        process.destroyForcibly();
        boolean interrupted = false;
        while (true) {
            try {
                process.waitFor();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void release() {
        channel.close();
        closeQuietly(process.getInputStream());
        closeQuietly(process.getErrorStream());
    }

    private String exitCodeOrUnknown() {
        return process.isAlive() ? "unknown" : Integer.toString(process.exitValue());
    }

    private static void closeQuietly(InputStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            LOG.debug("Error closing engine stream: {}", e.getMessage());
        }
    }

    private static void startStderrDrain(InputStream stderr, String label) {
        Thread drain = new Thread(
                () -> {
                    try (BufferedReader reader =
                            new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
                        String line;
                        while ((line = reader.readLine()) != null) {
                            LOG.debug("[{} stderr] {}", label, line);
                        }
                    } catch (IOException e) {
                        LOG.debug("Engine stderr closed: {}", e.getMessage());
                    }
                },
                "uci-stderr-" + label);
        drain.setDaemon(true);
        drain.start();
    }
}
