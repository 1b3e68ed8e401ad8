package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.domain.CaptureRegion;

import java.nio.file.Path;

/**
 * A backend that turns the live screen into a numbered JPEG sequence on disk.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>name files with {@link FrameSequence#fileName(int)} starting at
 *       {@link CaptureRequest#startIndex()}</li>
 *   <li>keep {@link #isRunning()} cheap and free of side effects (it is polled)</li>
 *   <li>make {@link #stop()} idempotent and return only once no further frame will be written</li>
 * </ul>
 */
public interface ScreenCaptureStrategy {

    /** Human-readable name for logs. */
    String name();

    CaptureMethod method();

    /**
     * Availability check on this machine (platform, native bridge, binary present).
     * Must not start anything.
     */
    boolean isAvailable();

    /**
     * Starts writing frames into {@link CaptureRequest#outputDir()}, creating it if needed.
     *
     * @throws com.phillippitts.clipcast.exception.CaptureException if the backend is unavailable
     *         or refuses to start
     */
    void start(CaptureRequest request);

    /** Convenience overload starting a sequence at index 0 with the cursor drawn. */
    default void start(CaptureRegion region, int fps, double scale, int jpegQuality, Path outputDir) {
        start(new CaptureRequest(region, fps, scale, jpegQuality, outputDir, true, 0));
    }

    void stop();

    boolean isRunning();
}
