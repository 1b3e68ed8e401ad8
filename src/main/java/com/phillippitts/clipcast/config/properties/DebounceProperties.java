package com.phillippitts.clipcast.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Debounce and throttle windows per action class, in milliseconds.
 *
 * @param recordingMs start/stop/toggle/pause/cancel recording
 * @param countdownMs countdown start/cancel
 * @param windowMs    area selection
 * @param uiMs        light UI actions such as opening settings
 * @param heavyMs     expensive actions
 */
@Validated
@ConfigurationProperties(prefix = "clipcast.debounce")
public record DebounceProperties(
        @Min(0) @Max(10000) @DefaultValue("500") long recordingMs,
        @Min(0) @Max(10000) @DefaultValue("300") long countdownMs,
        @Min(0) @Max(10000) @DefaultValue("200") long windowMs,
        @Min(0) @Max(10000) @DefaultValue("100") long uiMs,
        @Min(0) @Max(10000) @DefaultValue("1000") long heavyMs
) {
}
