package com.phillippitts.clipcast.service.hotkey.event;

import java.time.Instant;

/**
 * Published when the global key hook cannot be registered, typically because macOS
 * Accessibility permission has not been granted.
 */
public record HotkeyPermissionDeniedEvent(String reason, Instant at) { }
