package com.phillippitts.clipcast.service.capture.ffmpeg;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.CaptureRequest;
import com.phillippitts.clipcast.service.capture.DisplayEnvironment;
import com.phillippitts.clipcast.service.capture.DisplayInfo;
import com.phillippitts.clipcast.service.capture.Platform;
import com.phillippitts.clipcast.service.capture.ScreenCaptureStrategy;
import com.phillippitts.clipcast.service.encoding.FfmpegLocator;
import com.phillippitts.clipcast.service.process.ProcessFactory;
import com.phillippitts.clipcast.service.process.ProcessSupport;
import com.phillippitts.clipcast.util.LogSanitizer;
import com.phillippitts.clipcast.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Point;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Capture backend that lets an ffmpeg screen grabber write the frame sequence.
 *
 * <p>Stop sends {@code q} on stdin so ffmpeg finalizes the last frame, waits up to the quit
 * grace period, then destroys the process.
 */
public final class FfmpegCaptureStrategy implements ScreenCaptureStrategy {

    private static final Logger LOG = LogManager.getLogger(FfmpegCaptureStrategy.class);

    /** A grabber that dies within this window never got hold of the screen. */
    private static final Duration EARLY_EXIT_WINDOW = Duration.ofMillis(250);
    private static final int STDERR_TAIL_CHARS = 2000;

    private final FfmpegLocator locator;
    private final DisplayEnvironment display;
    private final Platform platform;
    private final ProcessFactory processFactory;
    private final Duration quitGrace;
    private final UnaryOperator<String> env;

    private volatile Process current;
    private volatile Thread errReader;
    private final StringBuilder stderr = new StringBuilder();

    public FfmpegCaptureStrategy(FfmpegLocator locator, DisplayEnvironment display, Platform platform,
                                 ProcessFactory processFactory, Duration quitGrace) {
        this(locator, display, platform, processFactory, quitGrace, System::getenv);
    }

    FfmpegCaptureStrategy(FfmpegLocator locator, DisplayEnvironment display, Platform platform,
                          ProcessFactory processFactory, Duration quitGrace, UnaryOperator<String> env) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.display = Objects.requireNonNull(display, "display");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.quitGrace = quitGrace == null ? ProcessTimeouts.CAPTURE_QUIT_TIMEOUT : quitGrace;
        this.env = env;
    }

    @Override
    public String name() {
        return "ffmpeg";
    }

    @Override
    public CaptureMethod method() {
        return CaptureMethod.FFMPEG;
    }

    @Override
    public boolean isAvailable() {
        return platform != Platform.OTHER && locator.locate().isPresent();
    }

    @Override
    public synchronized void start(CaptureRequest request) {
        if (isRunning()) {
            throw CaptureException.startFailed(name(), "Capture already running", null);
        }
        Path ffmpeg = locator.locate()
                .orElseThrow(() -> CaptureException.unavailable(name(), "ffmpeg binary not found"));
        List<String> command = FfmpegCaptureCommandBuilder.build(ffmpeg, platform, request,
                targetDisplay(request), env.apply("DISPLAY"));

        Process process;
        try {
            Files.createDirectories(request.outputDir());
            process = processFactory.start(command, request.outputDir());
        } catch (IOException e) {
            throw CaptureException.startFailed(name(), "Cannot launch ffmpeg", e);
        }
        synchronized (stderr) {
            stderr.setLength(0);
        }
        Thread reader = ProcessSupport.startLineReader(process.getErrorStream(), "ffmpeg-capture-err", this::appendStderr);
        // stdout is unused; drain it so the pipe never fills
        ProcessSupport.startLineReader(process.getInputStream(), "ffmpeg-capture-out", line -> { });

        try {
            if (process.waitFor(EARLY_EXIT_WINDOW.toMillis(), TimeUnit.MILLISECONDS)) {
                ProcessSupport.joinQuietly(reader, ProcessTimeouts.READER_FLUSH_TIMEOUT);
                int code = process.exitValue();
                throw CaptureException.startFailed(name(), code, "ffmpeg exited immediately: " + stderrTail());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessSupport.destroyProcess(process);
            throw CaptureException.startFailed(name(), "Interrupted while starting ffmpeg", e);
        }

        this.current = process;
        this.errReader = reader;
        LOG.info("ffmpeg capture started on {} (fps={}, startIndex={})", platform, request.fps(), request.startIndex());
        LOG.debug("ffmpeg capture command: {}", command);
    }

    private DisplayInfo targetDisplay(CaptureRequest request) {
        List<DisplayInfo> displays = display.displays();
        Point center = request.region() == null ? null
                : new Point(request.region().centerX(), request.region().centerY());
        Optional<Point> pointer = display.pointerLocation();
        return DisplayInfo.pick(displays, center, pointer.orElse(null));
    }

    private void appendStderr(String line) {
        synchronized (stderr) {
            if (stderr.length() > STDERR_TAIL_CHARS * 4) {
                stderr.delete(0, stderr.length() - STDERR_TAIL_CHARS);
            }
            stderr.append(line).append('\n');
        }
        LOG.debug("ffmpeg-capture: {}", line);
    }

    String stderrTail() {
        synchronized (stderr) {
            return LogSanitizer.tail(stderr, STDERR_TAIL_CHARS);
        }
    }

    @Override
    public void stop() {
        Process process;
        Thread reader;
        synchronized (this) {
            process = current;
            reader = errReader;
            current = null;
            errReader = null;
        }
        if (process == null) {
            return;
        }
        requestQuit(process);
        try {
            if (!process.waitFor(quitGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("ffmpeg capture ignored quit for {}ms; terminating", quitGrace.toMillis());
                ProcessSupport.destroyProcess(process);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessSupport.destroyProcess(process);
        }
        ProcessSupport.joinQuietly(reader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        LOG.info("ffmpeg capture stopped");
    }

    private static void requestQuit(Process process) {
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.write("q".getBytes(StandardCharsets.US_ASCII));
            stdin.flush();
            stdin.close();
        } catch (IOException e) {
            // ffmpeg may already be gone; termination below handles the rest
            LOG.debug("Could not send quit to ffmpeg: {}", e.toString());
        }
    }

    @Override
    public boolean isRunning() {
        Process process = current;
        return process != null && process.isAlive();
    }
}
