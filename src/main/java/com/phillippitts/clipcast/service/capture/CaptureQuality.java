package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.OutputFormat;

/**
 * Maps the user-facing quality setting onto what capture backends consume.
 */
public final class CaptureQuality {

    /** Frame-rate ceiling for the ScreenCaptureKit bridge, which encodes JPEGs on its callback thread. */
    public static final int NATIVE_STREAM_MAX_FPS = 5;

    private CaptureQuality() {
    }

    /** Settings quality (1..100) to the JPEG percentage frames are written with. */
    public static int jpegPercent(int settingsQuality) {
        if (settingsQuality >= 45) {
            return 92;
        }
        if (settingsQuality >= 35) {
            return 88;
        }
        if (settingsQuality >= 25) {
            return 85;
        }
        if (settingsQuality >= 15) {
            return 80;
        }
        return 75;
    }

    /** JPEG percentage to an {@link javax.imageio.ImageWriteParam} compression quality. */
    public static float jpegCompression(int jpegPercent) {
        if (jpegPercent >= 95) {
            return 0.98f;
        }
        if (jpegPercent >= 85) {
            return 0.96f;
        }
        if (jpegPercent >= 75) {
            return 0.94f;
        }
        if (jpegPercent >= 60) {
            return 0.92f;
        }
        if (jpegPercent >= 45) {
            return 0.90f;
        }
        if (jpegPercent >= 30) {
            return 0.85f;
        }
        if (jpegPercent >= 20) {
            return 0.80f;
        }
        return 0.75f;
    }

    /** JPEG percentage to ffmpeg {@code -q:v} (2 best .. 31 worst). */
    public static int ffmpegQscale(int jpegPercent) {
        int q;
        if (jpegPercent >= 90) {
            q = 2;
        } else if (jpegPercent >= 75) {
            q = 3;
        } else if (jpegPercent >= 60) {
            q = 5;
        } else if (jpegPercent >= 45) {
            q = 7;
        } else if (jpegPercent >= 30) {
            q = 10;
        } else if (jpegPercent >= 20) {
            q = 12;
        } else {
            q = 16;
        }
        return Math.max(2, Math.min(31, q));
    }

    /**
     * Capture rate for a session. GIF output never plays faster than 15 fps, so capturing
     * more only wastes disk and encode time.
     */
    public static int captureFps(OutputFormat format, int requestedFps, int settingsQuality, boolean fastMode) {
        int base = Math.max(1, Math.min(60, requestedFps));
        if (format != OutputFormat.GIF) {
            return base;
        }
        int cap;
        if (fastMode || settingsQuality < 20) {
            cap = 10;
        } else if (settingsQuality <= 40) {
            cap = 12;
        } else {
            cap = 15;
        }
        return Math.min(base, cap);
    }
}
