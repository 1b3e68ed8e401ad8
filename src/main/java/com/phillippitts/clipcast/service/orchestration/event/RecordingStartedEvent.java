package com.phillippitts.clipcast.service.orchestration.event;

import com.phillippitts.clipcast.domain.CaptureMethod;

import java.time.Instant;

/**
 * Emitted once capture is running for a new session.
 *
 * @param sessionId session identifier
 * @param method    backend that accepted the session
 * @param at        when capture started
 */
public record RecordingStartedEvent(String sessionId, CaptureMethod method, Instant at) {}
