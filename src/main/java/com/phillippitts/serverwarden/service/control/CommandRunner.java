package com.phillippitts.serverwarden.service.control;

import com.phillippitts.serverwarden.exception.CommandExecutionException;
import com.phillippitts.serverwarden.util.ProcessTimeouts;
import com.phillippitts.serverwarden.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (service control, updater) with a hard timeout.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently so a chatty child cannot block on a full pipe
 * - Enforce the timeout and terminate runaway processes (graceful, then forceful)
 * - Report failures to start, interrupts and timeouts as {@link CommandExecutionException}
 *
 * <p>Stateless and thread-safe: every call owns its process and gobbler threads.
 */
@Component
public class CommandRunner {

    private static final Logger LOG = LogManager.getLogger(CommandRunner.class);

    /** Cap for each captured stream. */
    static final int MAX_CAPTURE_CHARS = 262_144;

    private final ProcessFactory processFactory;

    public CommandRunner() {
        this(new DefaultProcessFactory());
    }

    CommandRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs {@code command} and waits at most {@code timeout} for it to finish.
     *
     * @param command    executable followed by its arguments
     * @param workingDir working directory (may be null)
     * @param timeout    upper bound for the whole run
     * @return exit code and captured output of a process that finished in time
     * @throws CommandExecutionException if the process cannot be started, is interrupted or times out
     */
    public CommandResult run(List<String> command, Path workingDir, Duration timeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
        String display = String.join(" ", command);
        long startTime = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(command, workingDir);
            // Start gobblers before waiting to avoid deadlock
            outGobbler = startGobbler(process.getInputStream(), stdout, "cmd-out");
            errGobbler = startGobbler(process.getErrorStream(), stderr, "cmd-err");

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw new CommandExecutionException("Timeout after " + timeout.toSeconds() + "s", display, true);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            CommandResult result = new CommandResult(process.exitValue(), snapshot(stdout), snapshot(stderr),
                    TimeUtils.elapsedMillis(startTime));
            LOG.debug("Command '{}' exited {} in {}ms", display, result.exitCode(), result.durationMs());
            return result;
        } catch (IOException e) {
            throw new CommandExecutionException("Failed to start: " + e.getMessage(), display, false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                destroyProcess(process);
            }
            throw new CommandExecutionException("Interrupted while waiting", display, false, e);
        } finally {
            if (process != null && process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    /**
     * Reads lines into a shared buffer until the cap, then keeps draining without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() + line.length() + 1 > MAX_CAPTURE_CHARS) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {} char cap; discarding further output",
                                        name, MAX_CAPTURE_CHARS);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        sink.append(line);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }
}
