package com.phillippitts.clipcast.service.hotkey.trigger;

import com.phillippitts.clipcast.service.hotkey.HotkeyTrigger;
import com.phillippitts.clipcast.service.hotkey.KeyNameMapper;
import com.phillippitts.clipcast.service.hotkey.NormalizedKeyEvent;

/**
 * Fires on the second press of the same key within {@code thresholdMs} of the first.
 * A third quick press starts a new cycle rather than firing again.
 */
public final class DoubleTapTrigger implements HotkeyTrigger {

    private final String key;
    private final int thresholdMs;

    private long lastTapAt = -1L;
    private boolean held;

    public DoubleTapTrigger(String key, int thresholdMs) {
        this.key = KeyNameMapper.normalizeKey(key);
        this.thresholdMs = thresholdMs;
    }

    @Override
    public String name() {
        return "double-tap:" + key + "@" + thresholdMs + "ms";
    }

    @Override
    public boolean onKeyPressed(NormalizedKeyEvent e) {
        if (!e.key().equals(key) || held) {
            return false;
        }
        held = true;
        long now = e.whenMillis();
        if (lastTapAt >= 0 && now - lastTapAt <= thresholdMs) {
            lastTapAt = -1L;
            return true;
        }
        lastTapAt = now;
        return false;
    }

    @Override
    public void onKeyReleased(NormalizedKeyEvent e) {
        if (e.key().equals(key)) {
            held = false;
        }
    }
}
