package com.phillippitts.clipcast.service.process;

import com.phillippitts.clipcast.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Subprocess plumbing shared by the encoder and the ffmpeg capture backend: line readers and
 * bounded termination.
 */
public final class ProcessSupport {

    private static final Logger LOG = LogManager.getLogger(ProcessSupport.class);

    private ProcessSupport() {
    }

    /**
     * Starts a daemon thread that reads {@code in} line by line until EOF. ffmpeg terminates
     * progress lines with {@code \r}, so both {@code \r} and {@code \n} end a line.
     */
    public static Thread startLineReader(InputStream in, String name, Consumer<String> onLine) {
        Thread thread = new Thread(() -> readLines(in, name, onLine), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    static void readLines(InputStream in, String name, Consumer<String> onLine) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            StringBuilder line = new StringBuilder();
            int c;
            while ((c = reader.read()) != -1) {
                if (c == '\n' || c == '\r') {
                    if (line.length() > 0) {
                        deliver(onLine, line.toString(), name);
                        line.setLength(0);
                    }
                } else {
                    line.append((char) c);
                }
            }
            if (line.length() > 0) {
                deliver(onLine, line.toString(), name);
            }
        } catch (IOException e) {
            LOG.debug("Reader '{}' stopped: {}", name, e.toString());
        }
    }

    private static void deliver(Consumer<String> onLine, String line, String name) {
        try {
            onLine.accept(line);
        } catch (RuntimeException e) {
            LOG.warn("Line consumer of '{}' failed: {}", name, e.toString());
        }
    }

    public static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * destroy, wait briefly, then destroyForcibly. Returns once the process is gone or the
     * forceful deadline passed.
     */
    public static void destroyProcess(Process process) {
        if (process == null) {
            return;
        }
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
