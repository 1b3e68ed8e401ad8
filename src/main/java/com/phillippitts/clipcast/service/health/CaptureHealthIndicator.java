package com.phillippitts.clipcast.service.health;

import com.phillippitts.clipcast.service.capture.CaptureStrategyChain;
import com.phillippitts.clipcast.service.capture.ScreenCaptureStrategy;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Lists the capture backends usable on this machine, in fallback order. Down when none is.
 */
@Component("capture")
public class CaptureHealthIndicator implements HealthIndicator {

    private final CaptureStrategyChain chain;

    public CaptureHealthIndicator(CaptureStrategyChain chain) {
        this.chain = chain;
    }

    @Override
    public Health health() {
        List<String> backends = chain.candidates().stream()
                .map(ScreenCaptureStrategy::name)
                .toList();
        Health.Builder builder = backends.isEmpty() ? Health.down() : Health.up();
        return builder.withDetail("backends", backends).build();
    }
}
