package com.phillippitts.clipcast.service.hotkey.trigger;

import com.phillippitts.clipcast.service.hotkey.HotkeyTrigger;
import com.phillippitts.clipcast.service.hotkey.KeyNameMapper;
import com.phillippitts.clipcast.service.hotkey.NormalizedKeyEvent;

import java.util.List;
import java.util.Set;

/**
 * Matches a single key, optionally with required modifiers. Auto-repeat presses are ignored
 * until the key is released.
 */
public final class SingleKeyTrigger implements HotkeyTrigger {

    private final String key;
    private final Set<String> modifiers;
    private boolean held;

    public SingleKeyTrigger(String key, List<String> modifiers) {
        this.key = KeyNameMapper.normalizeKey(key);
        this.modifiers = KeyNameMapper.normalizeModifiers(modifiers);
    }

    @Override
    public String name() {
        return "single-key:" + (modifiers.isEmpty() ? "" : String.join("+", modifiers) + "+") + key;
    }

    @Override
    public boolean onKeyPressed(NormalizedKeyEvent e) {
        if (held || !e.key().equals(key) || !e.modifiers().containsAll(modifiers)) {
            return false;
        }
        held = true;
        return true;
    }

    @Override
    public void onKeyReleased(NormalizedKeyEvent e) {
        if (e.key().equals(key)) {
            held = false;
        }
    }
}
