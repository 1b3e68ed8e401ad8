package com.phillippitts.clipcast.service.events;

import com.phillippitts.clipcast.service.capture.event.CaptureFallbackEvent;
import com.phillippitts.clipcast.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.clipcast.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.clipcast.service.orchestration.event.RecordingFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns user-facing failure events into actionable log lines. Each distinct problem is logged
 * at most once per minute.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Global hotkey unavailable ({}). On macOS grant Accessibility: "
                    + "System Settings > Privacy & Security > Accessibility, then restart", e.reason());
        }
    }

    @EventListener
    void onHotkeyConflict(HotkeyConflictEvent e) {
        String key = "hotkey-conflict-" + e.key() + '-' + e.modifiers();
        if (shouldLog(key)) {
            LOG.warn("Recording hotkey {}+{} collides with reserved shortcut {}. Update hotkey.* properties.",
                    e.modifiers(), e.key(), e.reserved());
        }
    }

    @EventListener
    void onCaptureFallback(CaptureFallbackEvent e) {
        if (shouldLog("capture-fallback-" + e.from() + '-' + e.to())) {
            LOG.warn("Capture backend {} failed ({}); continuing with {}", e.from(), e.reason(), e.to());
        }
    }

    @EventListener
    void onRecordingFailed(RecordingFailedEvent e) {
        if (shouldLog("recording-failed-" + e.reason())) {
            LOG.warn("Recording {} failed: reason={}, message={}", e.sessionId(), e.reason(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
