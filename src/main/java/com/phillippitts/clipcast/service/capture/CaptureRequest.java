package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.CaptureRegion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of one capture run.
 *
 * @param region        rectangle to capture, null for the screen under the pointer
 * @param fps           target frames per second (clamped to 1..60)
 * @param scale         down-scale factor applied to every frame (0.1..1.0)
 * @param jpegQuality   JPEG quality percentage (1..100)
 * @param outputDir     directory receiving the frame sequence
 * @param captureCursor draw the pointer into frames where the backend supports it
 * @param startIndex    index of the first frame file; non-zero when continuing another backend's sequence
 */
public record CaptureRequest(
        CaptureRegion region,
        int fps,
        double scale,
        int jpegQuality,
        Path outputDir,
        boolean captureCursor,
        int startIndex
) {

    public CaptureRequest {
        Objects.requireNonNull(outputDir, "outputDir");
        fps = Math.max(1, Math.min(60, fps));
        scale = scale <= 0 ? 1.0 : Math.min(1.0, scale);
        jpegQuality = Math.max(1, Math.min(100, jpegQuality));
        startIndex = Math.max(0, startIndex);
    }

    public CaptureRequest withStartIndex(int index) {
        return new CaptureRequest(region, fps, scale, jpegQuality, outputDir, captureCursor, index);
    }

    public CaptureRequest withFps(int newFps) {
        return new CaptureRequest(region, newFps, scale, jpegQuality, outputDir, captureCursor, startIndex);
    }

    public boolean isScaled() {
        return Math.abs(scale - 1.0) > 1e-6;
    }
}
