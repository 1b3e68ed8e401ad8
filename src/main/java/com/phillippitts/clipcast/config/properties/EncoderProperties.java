package com.phillippitts.clipcast.config.properties;

import com.phillippitts.clipcast.domain.OutputFormat;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the ffmpeg encoder.
 * Binds to properties prefixed with "clipcast.encoder".
 *
 * <p>Example application.properties:
 * <pre>
 * clipcast.encoder.ffmpeg-path=/opt/homebrew/bin/ffmpeg
 * clipcast.encoder.gif-timeout-seconds=600
 * clipcast.encoder.palette-timeout-seconds=240
 * clipcast.encoder.webp-timeout-seconds=540
 * clipcast.encoder.mp4-timeout-seconds=270
 * </pre>
 *
 * @param ffmpegPath            explicit ffmpeg binary; blank means search the usual locations
 * @param gifTimeoutSeconds     ceiling for the GIF encode pass
 * @param paletteTimeoutSeconds ceiling for the GIF palette pass
 * @param webpTimeoutSeconds    ceiling for WebP encodes
 * @param mp4TimeoutSeconds     ceiling for MP4 encodes
 */
@ConfigurationProperties(prefix = "clipcast.encoder")
@Validated
public record EncoderProperties(
        String ffmpegPath,

        @Positive(message = "GIF timeout must be positive")
        @DefaultValue("600")
        int gifTimeoutSeconds,

        @Positive(message = "Palette timeout must be positive")
        @DefaultValue("240")
        int paletteTimeoutSeconds,

        @Positive(message = "WebP timeout must be positive")
        @DefaultValue("540")
        int webpTimeoutSeconds,

        @Positive(message = "MP4 timeout must be positive")
        @DefaultValue("270")
        int mp4TimeoutSeconds
) {

    /** Standard ceilings with auto-detected ffmpeg. */
    public static EncoderProperties defaults() {
        return new EncoderProperties(null, 600, 240, 540, 270);
    }

    public Duration timeoutFor(OutputFormat format) {
        return switch (format) {
            case GIF -> Duration.ofSeconds(gifTimeoutSeconds);
            case WEBP -> Duration.ofSeconds(webpTimeoutSeconds);
            case MP4 -> Duration.ofSeconds(mp4TimeoutSeconds);
        };
    }

    public Duration paletteTimeout() {
        return Duration.ofSeconds(paletteTimeoutSeconds);
    }
}
