package com.phillippitts.clipcast.domain;

/**
 * Capture backend identity as reported in {@link AppState.Recording}.
 * {@link #AUTO} means "let the selector decide" and is never the method of a running backend.
 */
public enum CaptureMethod {
    AUTO,
    SCREEN_CAPTURE_KIT,
    ROBOT_API,
    FFMPEG
}
