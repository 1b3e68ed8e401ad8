package com.phillippitts.clipcast.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a session ends in {@link com.phillippitts.clipcast.domain.AppState.Error}.
 *
 * @param sessionId session identifier, null when capture never started
 * @param reason    low-cardinality tag such as {@code capture_unavailable} or {@code timeout}
 * @param message   the message shown to the user
 * @param at        failure time
 */
public record RecordingFailedEvent(String sessionId, String reason, String message, Instant at) {}
