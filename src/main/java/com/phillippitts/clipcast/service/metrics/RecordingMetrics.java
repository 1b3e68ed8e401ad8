package com.phillippitts.clipcast.service.metrics;

import com.phillippitts.clipcast.service.capture.event.CaptureFallbackEvent;
import com.phillippitts.clipcast.service.orchestration.event.RecordingCompletedEvent;
import com.phillippitts.clipcast.service.orchestration.event.RecordingFailedEvent;
import com.phillippitts.clipcast.service.orchestration.event.RecordingStartedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for recording sessions, fed by the orchestration and capture events.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code clipcast.recording.started} tagged with the capture method</li>
 *   <li>{@code clipcast.recording.completed} tagged with the output format</li>
 *   <li>{@code clipcast.recording.failed} tagged with the failure reason</li>
 *   <li>{@code clipcast.capture.fallback} tagged with the from/to backends</li>
 *   <li>{@code clipcast.encode.latency} timer, tagged with the output format</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RecordingMetrics {

    private static final String METRIC_PREFIX = "clipcast";

    private final MeterRegistry registry;

    public RecordingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onStarted(RecordingStartedEvent e) {
        Counter.builder(METRIC_PREFIX + ".recording.started")
                .description("Recording sessions started")
                .tag("method", e.method().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @EventListener
    public void onCompleted(RecordingCompletedEvent e) {
        String format = e.item().format().extension();
        Counter.builder(METRIC_PREFIX + ".recording.completed")
                .description("Recordings encoded and saved")
                .tag("format", format)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".encode.latency")
                .description("Time spent encoding captured frames")
                .tag("format", format)
                .register(registry)
                .record(e.encodeMs(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    public void onFailed(RecordingFailedEvent e) {
        Counter.builder(METRIC_PREFIX + ".recording.failed")
                .description("Recordings that ended in an error")
                .tag("reason", e.reason())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onFallback(CaptureFallbackEvent e) {
        Counter.builder(METRIC_PREFIX + ".capture.fallback")
                .description("Capture backend switches")
                .tag("from", e.from().name().toLowerCase(Locale.ROOT))
                .tag("to", e.to() == null ? "none" : e.to().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
