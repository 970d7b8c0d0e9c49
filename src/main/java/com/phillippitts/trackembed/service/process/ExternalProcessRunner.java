package com.phillippitts.trackembed.service.process;

import com.phillippitts.trackembed.exception.ExternalProcessException;
import com.phillippitts.trackembed.exception.ExternalProcessExceptionBuilder;
import com.phillippitts.trackembed.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

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
 * Runs external tools (transcoder, preview resolver, inference runner) for the pipeline.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently, each capped
 * - Enforce a timeout and terminate runaway processes
 * - Destroy the process when the calling thread is interrupted (job cancellation)
 * - Provide structured error context in {@link ExternalProcessException}
 *
 * <p>Stateless: one instance is shared by concurrent jobs.
 */
public class ExternalProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ExternalProcessRunner.class);

    /** Cap for stderr kept for diagnostics. */
    static final int STDERR_MAX_CHARS = 64 * 1024;
    /** Stderr excerpt included in exception messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 512;
    /** Default stdout cap. */
    public static final int DEFAULT_STDOUT_MAX_CHARS = 1024 * 1024;

    /** Reader threads get this long to flush after a normal exit. */
    private static final Duration DRAIN_ON_EXIT = Duration.ofMillis(500);
    /** Shorter wait for readers when the process was killed. */
    private static final Duration DRAIN_ON_KILL = Duration.ofMillis(100);
    private static final Duration DESTROY_GRACE = Duration.ofMillis(500);
    private static final Duration DESTROY_FORCIBLY_GRACE = Duration.ofSeconds(1);

    private final ProcessFactory processFactory;

    public ExternalProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ExternalProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    /**
     * Runs a command to completion.
     *
     * @param tool short tool name for logs and errors (e.g. "ffmpeg")
     * @param command command line, executable first
     * @param workingDir working directory (may be null)
     * @param timeout maximum run time
     * @return captured output of a successful run
     * @throws ExternalProcessException on start failure, timeout, interruption or non-zero exit
     */
    public ProcessResult run(String tool, List<String> command, Path workingDir, Duration timeout) {
        return run(tool, command, workingDir, timeout, DEFAULT_STDOUT_MAX_CHARS);
    }

    /**
     * Runs a command to completion with an explicit stdout cap.
     *
     * @see #run(String, List, Path, Duration)
     */
    public ProcessResult run(String tool, List<String> command, Path workingDir, Duration timeout,
                             int maxStdoutChars) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = start(tool, command, workingDir, maxStdoutChars);
            waitForCompletion(tool, exec, timeout, startTime);
            return handleResult(tool, exec, startTime);
        } catch (IOException e) {
            throw failure(tool, "Failed to start: " + e.getMessage(), -1, null, startTime, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(tool, "Interrupted while waiting for process", -1,
                    exec == null ? null : exec.stderr(), startTime, e);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution start(String tool, List<String> command, Path workingDir, int maxStdoutChars)
            throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        LOG.debug("Starting {}: {}", tool, command);
        Process process = processFactory.start(command, workingDir);

        // Start gobblers before waiting to avoid pipe deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, tool + "-out", maxStdoutChars);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, tool + "-err", STDERR_MAX_CHARS);
        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForCompletion(String tool, ProcessExecution exec, Duration timeout, long startTime)
            throws InterruptedException {
        boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw failure(tool, "Timeout after " + timeout.toSeconds() + "s", -1, exec.stderr(), startTime, null);
        }
        joinQuietly(exec.outGobbler(), DRAIN_ON_EXIT);
        joinQuietly(exec.errGobbler(), DRAIN_ON_EXIT);
    }

    private ProcessResult handleResult(String tool, ProcessExecution exec, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw failure(tool, "Non-zero exit: " + exitCode, exitCode, exec.stderr(), startTime, null);
        }
        long durationMs = TimeUtils.elapsedMillis(startTime);
        String stdout = snapshot(exec.stdout());
        LOG.debug("{} finished in {} ms, stdout={} chars", tool, durationMs, stdout.length());
        return new ProcessResult(stdout, snapshot(exec.stderr()), durationMs);
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxChars), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a StringBuilder until the cap is reached, then keeps draining the stream
     * without accumulating so the child never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxChars;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxChars) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxChars - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(available, 0)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), DRAIN_ON_KILL);
        joinQuietly(exec.errGobbler(), DRAIN_ON_KILL);
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(DESTROY_GRACE.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(DESTROY_FORCIBLY_GRACE.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private ExternalProcessException failure(String tool, String msg, int exitCode, StringBuilder stderr,
                                             long startTime, Throwable cause) {
        String snippet = "";
        if (stderr != null) {
            synchronized (stderr) {
                snippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        ExternalProcessExceptionBuilder builder = ExternalProcessExceptionBuilder.create(msg)
                .tool(tool)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startTime))
                .metadata("stderr", snippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
