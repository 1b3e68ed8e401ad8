package com.phillippitts.clipcast.service.encoding;

import com.phillippitts.clipcast.exception.EncodeError;
import com.phillippitts.clipcast.exception.EncodingExceptionBuilder;
import com.phillippitts.clipcast.service.process.DefaultProcessFactory;
import com.phillippitts.clipcast.service.process.ProcessFactory;
import com.phillippitts.clipcast.service.process.ProcessSupport;
import com.phillippitts.clipcast.util.LogSanitizer;
import com.phillippitts.clipcast.util.ProcessTimeouts;
import com.phillippitts.clipcast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs one ffmpeg invocation to completion or timeout.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Read stderr line by line (progress and diagnostics) and drain stdout concurrently
 * - Enforce the timeout and terminate runaway processes
 * - Report exit code, timeout, abort signature and a stderr tail in {@link RunResult}
 * - Idempotent {@link #close()} that kills whatever is still running
 *
 * <p>Exit codes are not interpreted here; the encoder classifies them.
 */
public final class FfmpegProcessRunner implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(FfmpegProcessRunner.class);

    /** Enough for the final error lines; the banner at the top is never needed. */
    static final int STDERR_TAIL_CHARS = 4096;

    private final ProcessFactory processFactory;
    private final Set<Process> live = ConcurrentHashMap.newKeySet();

    /**
     * Outcome of one run.
     *
     * @param exitCode   process exit code, -1 on timeout
     * @param timedOut   the process exceeded its ceiling and was terminated
     * @param abortSeen  stderr contained an abort signature
     * @param stderrTail last lines of stderr, single-lined
     * @param durationMs wall time
     */
    public record RunResult(int exitCode, boolean timedOut, boolean abortSeen, String stderrTail, long durationMs) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * Holds process execution state including the process and its reader threads.
     */
    private record ProcessExecution(
            Process process,
            Thread errReader,
            Thread outReader,
            StringBuilder stderr,
            AtomicBoolean abortSeen
    ) {}

    public FfmpegProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public FfmpegProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * @param onStderrLine receives every stderr line (progress parsing); may be null
     * @throws com.phillippitts.clipcast.exception.EncodingException of kind IO when the process
     *         cannot be started or the wait is interrupted
     */
    public RunResult run(List<String> command, Path workingDir, Duration timeout, Consumer<String> onStderrLine) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = startWithReaders(command, workingDir, onStderrLine);
            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("ffmpeg exceeded {}s; terminating", timeout.toSeconds());
                ProcessSupport.destroyProcess(exec.process());
                ProcessSupport.joinQuietly(exec.errReader(), ProcessTimeouts.READER_CLEANUP_TIMEOUT);
                return new RunResult(-1, true, exec.abortSeen().get(), tail(exec.stderr()),
                        TimeUtils.elapsedMillis(startTime));
            }
            // Give the readers a moment to flush the last lines
            ProcessSupport.joinQuietly(exec.errReader(), ProcessTimeouts.READER_FLUSH_TIMEOUT);
            ProcessSupport.joinQuietly(exec.outReader(), ProcessTimeouts.READER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            long durationMs = TimeUtils.elapsedMillis(startTime);
            LOG.debug("ffmpeg exited code={} in {}ms", exitCode, durationMs);
            return new RunResult(exitCode, false, exec.abortSeen().get(), tail(exec.stderr()), durationMs);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (exec != null) {
                ProcessSupport.destroyProcess(exec.process());
            }
            throw EncodingExceptionBuilder.create("ffmpeg I/O failure: " + e.getMessage(), EncodeError.IO)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("binary", command.isEmpty() ? null : command.get(0))
                    .build();
        } finally {
            if (exec != null) {
                live.remove(exec.process());
            }
        }
    }

    private ProcessExecution startWithReaders(List<String> command, Path workingDir, Consumer<String> onStderrLine)
            throws IOException {
        StringBuilder stderr = new StringBuilder();
        AtomicBoolean abortSeen = new AtomicBoolean(false);

        Process process = processFactory.start(command, workingDir);
        live.add(process);

        // Start readers before waiting to avoid filling the pipes
        Thread errReader = ProcessSupport.startLineReader(process.getErrorStream(), "ffmpeg-err", line -> {
            if (CrashClassifier.isAbortSignature(line)) {
                LOG.warn("ffmpeg abort signature: {}", LogSanitizer.truncate(line, 200));
                abortSeen.set(true);
            }
            appendBounded(stderr, line);
            if (onStderrLine != null) {
                onStderrLine.accept(line);
            }
        });
        Thread outReader = ProcessSupport.startLineReader(process.getInputStream(), "ffmpeg-out",
                line -> LOG.trace("ffmpeg stdout: {}", line));
        return new ProcessExecution(process, errReader, outReader, stderr, abortSeen);
    }

    private static void appendBounded(StringBuilder sink, String line) {
        synchronized (sink) {
            sink.append(line).append('\n');
            if (sink.length() > STDERR_TAIL_CHARS * 2) {
                sink.delete(0, sink.length() - STDERR_TAIL_CHARS);
            }
        }
    }

    private static String tail(StringBuilder sink) {
        synchronized (sink) {
            return LogSanitizer.tail(sink, STDERR_TAIL_CHARS);
        }
    }

    /**
     * Idempotent cleanup of any process still running.
     */
    @Override
    public void close() {
        for (Process p : live) {
            if (p.isAlive()) {
                ProcessSupport.destroyProcess(p);
            }
        }
        live.clear();
    }
}
