package com.phillippitts.clipcast.config.properties;

import com.phillippitts.clipcast.domain.OutputFormat;
import com.phillippitts.clipcast.domain.RecordingSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed recording defaults. These seed the {@link RecordingSettings} snapshot the state
 * repository starts with; the settings collaborator may replace them at runtime.
 *
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "clipcast.recording")
public class RecordingProperties {

    @NotNull
    private final OutputFormat defaultFormat;

    @Min(1)
    @Max(60)
    private final int defaultFps;

    @Min(1)
    @Max(100)
    private final int defaultQuality;

    @Min(1)
    @Max(3600)
    private final int defaultMaxDurationSeconds;

    @DecimalMin("0.1")
    @DecimalMax("1.0")
    private final double captureScale;

    private final boolean showCountdown;

    @Min(0)
    @Max(10)
    private final int countdownSeconds;

    private final boolean captureMouseCursor;

    @NotNull
    private final Path saveLocation;

    /** File name pattern; {@code {timestamp}} becomes {@code yyyyMMdd_HHmmss}. */
    private final String fileNamingPattern;

    @Min(1)
    @Max(500)
    private final int maxRecentItems;

    /** Parent of the per-session {@code gifland_*} frame directories. */
    @NotNull
    private final Path tempDirectory;

    /** Lower GIF tiers for faster encodes. */
    private final boolean fastMode;

    /** Period of the progress tick while recording. */
    @Min(100)
    @Max(5000)
    private final long tickIntervalMs;

    @ConstructorBinding
    public RecordingProperties(OutputFormat defaultFormat,
                               Integer defaultFps,
                               Integer defaultQuality,
                               Integer defaultMaxDurationSeconds,
                               Double captureScale,
                               Boolean showCountdown,
                               Integer countdownSeconds,
                               Boolean captureMouseCursor,
                               Path saveLocation,
                               String fileNamingPattern,
                               Integer maxRecentItems,
                               Path tempDirectory,
                               Boolean fastMode,
                               Long tickIntervalMs) {
        this.defaultFormat = defaultFormat == null ? OutputFormat.GIF : defaultFormat;
        this.defaultFps = defaultFps == null ? 15 : defaultFps;
        this.defaultQuality = defaultQuality == null ? 30 : defaultQuality;
        this.defaultMaxDurationSeconds = defaultMaxDurationSeconds == null ? 30 : defaultMaxDurationSeconds;
        this.captureScale = captureScale == null ? 1.0 : captureScale;
        this.showCountdown = showCountdown == null ? true : showCountdown;
        this.countdownSeconds = countdownSeconds == null ? 3 : countdownSeconds;
        this.captureMouseCursor = captureMouseCursor == null ? true : captureMouseCursor;
        this.saveLocation = saveLocation == null
                ? Path.of(System.getProperty("user.home"), "Documents", "Recordings")
                : saveLocation;
        this.fileNamingPattern = (fileNamingPattern == null || fileNamingPattern.isBlank())
                ? "recording_{timestamp}"
                : fileNamingPattern;
        this.maxRecentItems = maxRecentItems == null ? 50 : maxRecentItems;
        this.tempDirectory = tempDirectory == null ? Path.of(System.getProperty("java.io.tmpdir")) : tempDirectory;
        this.fastMode = fastMode != null && fastMode;
        this.tickIntervalMs = tickIntervalMs == null ? 1000L : tickIntervalMs;
    }

    /** Settings snapshot for the state repository. */
    public RecordingSettings toSettings() {
        return new RecordingSettings(defaultFormat, defaultFps, defaultQuality, defaultMaxDurationSeconds,
                captureScale, showCountdown, countdownSeconds, captureMouseCursor, saveLocation,
                fileNamingPattern, maxRecentItems, tempDirectory, fastMode);
    }

    public OutputFormat getDefaultFormat() {
        return defaultFormat;
    }

    public int getDefaultFps() {
        return defaultFps;
    }

    public int getDefaultQuality() {
        return defaultQuality;
    }

    public int getDefaultMaxDurationSeconds() {
        return defaultMaxDurationSeconds;
    }

    public double getCaptureScale() {
        return captureScale;
    }

    public boolean isShowCountdown() {
        return showCountdown;
    }

    public int getCountdownSeconds() {
        return countdownSeconds;
    }

    public boolean isCaptureMouseCursor() {
        return captureMouseCursor;
    }

    public Path getSaveLocation() {
        return saveLocation;
    }

    public String getFileNamingPattern() {
        return fileNamingPattern;
    }

    public int getMaxRecentItems() {
        return maxRecentItems;
    }

    public Path getTempDirectory() {
        return tempDirectory;
    }

    public boolean isFastMode() {
        return fastMode;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }
}
