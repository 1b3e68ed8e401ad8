package com.phillippitts.clipcast.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One recording attempt. Immutable: every progress update produces a new value which the
 * state repository swaps in under its lock.
 *
 * @param id                  {@code session_<epochMillis>}
 * @param startedAt           wall-clock start
 * @param region              captured rectangle, {@code null} for the full screen
 * @param frameCount          frames written so far
 * @param durationSeconds     recorded (non-paused) time
 * @param estimatedSizeBytes  bytes of frame data on disk
 * @param backendDetail       free-form description of the active capture backend, may be null
 * @param outputFormat        target format
 * @param maxDurationSeconds  auto-stop threshold
 * @param frameDirectory      directory frames are written to, {@code null} until capture starts
 */
public record RecordingSession(
        String id,
        Instant startedAt,
        CaptureRegion region,
        int frameCount,
        double durationSeconds,
        long estimatedSizeBytes,
        String backendDetail,
        OutputFormat outputFormat,
        int maxDurationSeconds,
        Path frameDirectory
) {

    public RecordingSession {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(outputFormat, "outputFormat");
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must be >= 0");
        }
        if (maxDurationSeconds <= 0) {
            throw new IllegalArgumentException("maxDurationSeconds must be > 0");
        }
    }

    /** Fresh session with zeroed telemetry. */
    public static RecordingSession start(String id, Instant startedAt, CaptureRegion region,
                                         OutputFormat format, int maxDurationSeconds) {
        return new RecordingSession(id, startedAt, region, 0, 0.0, 0L, null, format, maxDurationSeconds, null);
    }

    public RecordingSession withProgress(int frames, double seconds, long sizeBytes, String detail) {
        return new RecordingSession(id, startedAt, region, frames, seconds, sizeBytes,
                detail != null ? detail : backendDetail, outputFormat, maxDurationSeconds, frameDirectory);
    }

    public RecordingSession withFrameDirectory(Path directory) {
        return new RecordingSession(id, startedAt, region, frameCount, durationSeconds, estimatedSizeBytes,
                backendDetail, outputFormat, maxDurationSeconds, directory);
    }

    public RecordingSession withBackendDetail(String detail) {
        return new RecordingSession(id, startedAt, region, frameCount, durationSeconds, estimatedSizeBytes,
                detail, outputFormat, maxDurationSeconds, frameDirectory);
    }

    public long durationMillis() {
        return Math.round(durationSeconds * 1000.0);
    }

    public boolean reachedMaxDuration() {
        return durationSeconds >= maxDurationSeconds;
    }
}
