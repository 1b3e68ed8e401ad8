package com.phillippitts.clipcast.service.hotkey.event;

import java.time.Instant;
import java.util.List;

/**
 * Published when a configured binding equals an OS-reserved shortcut (e.g. Cmd+Tab).
 */
public record HotkeyConflictEvent(String key, List<String> modifiers, String reserved, Instant at) { }
