package com.phillippitts.clipcast.util;

import java.time.Duration;

/**
 * Timeouts for subprocess and worker-thread lifecycle management.
 *
 * <p>Used by the ffmpeg encoder runner, the ffmpeg capture backend and the pixel-grab
 * capture loop.
 *
 * @see com.phillippitts.clipcast.service.encoding.FfmpegProcessRunner
 * @see com.phillippitts.clipcast.service.capture.ffmpeg.FfmpegCaptureStrategy
 */
public final class ProcessTimeouts {

    /** Time for reader threads to drain buffered output after the process exited. */
    public static final Duration READER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join during cleanup; reader threads are daemons. */
    public static final Duration READER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Default wait for an ffmpeg grabber to honour the {@code q} quit command. */
    public static final Duration CAPTURE_QUIT_TIMEOUT = Duration.ofMillis(3000);

    /** Wait for the pixel-grab loop to finish its current frame after stop. */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(2000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
