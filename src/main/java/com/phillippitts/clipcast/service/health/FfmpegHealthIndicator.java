package com.phillippitts.clipcast.service.health;

import com.phillippitts.clipcast.service.encoding.FfmpegLocator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reports whether the ffmpeg binary needed for encoding can be found.
 *
 * <p>Exposed via the /actuator/health endpoint as {@code ffmpeg}.
 */
@Component("ffmpeg")
public class FfmpegHealthIndicator implements HealthIndicator {

    private final FfmpegLocator locator;

    public FfmpegHealthIndicator(FfmpegLocator locator) {
        this.locator = locator;
    }

    @Override
    public Health health() {
        Optional<Path> binary = locator.locate();
        if (binary.isPresent()) {
            return Health.up()
                    .withDetail("binary", binary.get().toString())
                    .build();
        }
        return Health.down()
                .withDetail("status", "ffmpeg not found; recordings cannot be encoded")
                .build();
    }
}
