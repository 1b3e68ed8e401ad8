package com.phillippitts.clipcast.service.capture.event;

import com.phillippitts.clipcast.domain.CaptureMethod;

import java.time.Instant;

/**
 * Published when a capture backend fails or stalls and the next one is tried.
 *
 * @param to the backend being tried next, or null when none is left
 */
public record CaptureFallbackEvent(CaptureMethod from, CaptureMethod to, String reason, Instant at) { }
