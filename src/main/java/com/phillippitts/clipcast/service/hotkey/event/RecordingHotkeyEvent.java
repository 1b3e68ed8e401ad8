package com.phillippitts.clipcast.service.hotkey.event;

import com.phillippitts.clipcast.service.hotkey.RecordingAction;

import java.time.Instant;

/**
 * Published when a configured recording hotkey fires.
 */
public record RecordingHotkeyEvent(RecordingAction action, Instant at) { }
