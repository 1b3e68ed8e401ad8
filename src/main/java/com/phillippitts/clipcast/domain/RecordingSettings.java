package com.phillippitts.clipcast.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings snapshot carried by every non-error {@link AppState} variant.
 *
 * <p>Only the fields the capture and encode pipeline read are modelled; how settings are
 * persisted is the settings collaborator's concern.
 *
 * @param defaultFormat              format used when a session does not request one
 * @param defaultFps                 target capture frame rate (1..60)
 * @param defaultQuality             quality percentage (1..100) mapped per encoder
 * @param defaultMaxDurationSeconds  auto-stop threshold in seconds
 * @param captureScale               capture down-scale factor (0.1..1.0)
 * @param showCountdown              whether triggers go through a countdown first
 * @param countdownSeconds           countdown length
 * @param captureMouseCursor         draw the pointer into frames
 * @param saveLocation               directory for finished files
 * @param fileNamingPattern          file name pattern; {@code {timestamp}} is substituted
 * @param maxRecentItems             cap for the recent recordings list
 * @param tempDirectory              parent directory of per-session frame directories
 * @param fastMode                   trade quality for encode speed
 */
public record RecordingSettings(
        OutputFormat defaultFormat,
        int defaultFps,
        int defaultQuality,
        int defaultMaxDurationSeconds,
        double captureScale,
        boolean showCountdown,
        int countdownSeconds,
        boolean captureMouseCursor,
        Path saveLocation,
        String fileNamingPattern,
        int maxRecentItems,
        Path tempDirectory,
        boolean fastMode
) {

    public static final int MIN_FPS = 1;
    public static final int MAX_FPS = 60;

    public RecordingSettings {
        Objects.requireNonNull(defaultFormat, "defaultFormat");
        Objects.requireNonNull(saveLocation, "saveLocation");
        Objects.requireNonNull(tempDirectory, "tempDirectory");
        if (fileNamingPattern == null || fileNamingPattern.isBlank()) {
            fileNamingPattern = "recording_{timestamp}";
        }
        defaultFps = Math.max(MIN_FPS, Math.min(MAX_FPS, defaultFps));
        defaultQuality = Math.max(1, Math.min(100, defaultQuality));
        defaultMaxDurationSeconds = Math.max(1, defaultMaxDurationSeconds);
        captureScale = Math.max(0.1, Math.min(1.0, captureScale));
        countdownSeconds = Math.max(0, countdownSeconds);
        maxRecentItems = Math.max(1, maxRecentItems);
    }

    /** Built-in defaults used before the settings collaborator has answered. */
    public static RecordingSettings defaults() {
        return new RecordingSettings(
                OutputFormat.GIF,
                15,
                30,
                30,
                1.0,
                true,
                3,
                true,
                Path.of(System.getProperty("user.home"), "Documents", "Recordings"),
                "recording_{timestamp}",
                50,
                Path.of(System.getProperty("java.io.tmpdir")),
                false);
    }

    public RecordingSettings withDefaultFormat(OutputFormat format) {
        return new RecordingSettings(format, defaultFps, defaultQuality, defaultMaxDurationSeconds,
                captureScale, showCountdown, countdownSeconds, captureMouseCursor, saveLocation,
                fileNamingPattern, maxRecentItems, tempDirectory, fastMode);
    }

    public RecordingSettings withDefaultQuality(int quality) {
        return new RecordingSettings(defaultFormat, defaultFps, quality, defaultMaxDurationSeconds,
                captureScale, showCountdown, countdownSeconds, captureMouseCursor, saveLocation,
                fileNamingPattern, maxRecentItems, tempDirectory, fastMode);
    }

    public RecordingSettings withDefaultMaxDurationSeconds(int seconds) {
        return new RecordingSettings(defaultFormat, defaultFps, defaultQuality, seconds,
                captureScale, showCountdown, countdownSeconds, captureMouseCursor, saveLocation,
                fileNamingPattern, maxRecentItems, tempDirectory, fastMode);
    }

    public RecordingSettings withMaxRecentItems(int max) {
        return new RecordingSettings(defaultFormat, defaultFps, defaultQuality, defaultMaxDurationSeconds,
                captureScale, showCountdown, countdownSeconds, captureMouseCursor, saveLocation,
                fileNamingPattern, max, tempDirectory, fastMode);
    }

    public RecordingSettings withDirectories(Path saveLocation, Path tempDirectory) {
        return new RecordingSettings(defaultFormat, defaultFps, defaultQuality, defaultMaxDurationSeconds,
                captureScale, showCountdown, countdownSeconds, captureMouseCursor, saveLocation,
                fileNamingPattern, maxRecentItems, tempDirectory, fastMode);
    }
}
