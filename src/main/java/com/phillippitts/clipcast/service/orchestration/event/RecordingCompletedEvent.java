package com.phillippitts.clipcast.service.orchestration.event;

import com.phillippitts.clipcast.domain.MediaItem;

import java.time.Instant;

/**
 * Emitted when a session produced a media file and it was handed to the catalog.
 *
 * @param sessionId session identifier
 * @param item      the finished artifact
 * @param encodeMs  wall time spent in the encoder
 * @param at        completion time
 */
public record RecordingCompletedEvent(String sessionId, MediaItem item, long encodeMs, Instant at) {}
