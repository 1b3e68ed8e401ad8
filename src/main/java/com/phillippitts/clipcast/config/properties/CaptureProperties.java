package com.phillippitts.clipcast.config.properties;

import com.phillippitts.clipcast.domain.CaptureMethod;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Capture backend selection and supervision.
 *
 * <pre>
 * clipcast.capture.preferred-method=AUTO
 * clipcast.capture.no-frame-timeout-ms=3000
 * clipcast.capture.stall-timeout-ms=2000
 * clipcast.capture.stop-grace-ms=3000
 * </pre>
 *
 * @param preferredMethod  backend tried first when available; AUTO keeps the platform order
 * @param noFrameTimeoutMs switch backend when no frame exists this long after start
 * @param stallTimeoutMs   switch backend when frame production pauses this long
 * @param stopGraceMs      wait for an ffmpeg grabber to quit before killing it
 */
@Validated
@ConfigurationProperties(prefix = "clipcast.capture")
public record CaptureProperties(
        @NotNull @DefaultValue("AUTO") CaptureMethod preferredMethod,
        @Min(500) @Max(30000) @DefaultValue("3000") long noFrameTimeoutMs,
        @Min(500) @Max(30000) @DefaultValue("2000") long stallTimeoutMs,
        @Min(100) @Max(30000) @DefaultValue("3000") long stopGraceMs
) {
}
