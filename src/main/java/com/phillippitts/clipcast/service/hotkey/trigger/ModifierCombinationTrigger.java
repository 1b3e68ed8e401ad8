package com.phillippitts.clipcast.service.hotkey.trigger;

import com.phillippitts.clipcast.service.hotkey.HotkeyTrigger;
import com.phillippitts.clipcast.service.hotkey.KeyNameMapper;
import com.phillippitts.clipcast.service.hotkey.NormalizedKeyEvent;

import java.util.List;
import java.util.Set;

/**
 * Matches a combination like META+SHIFT+R: the primary key pressed while every configured
 * modifier is down. Extra modifiers do not prevent a match.
 */
public final class ModifierCombinationTrigger implements HotkeyTrigger {

    private final String primaryKey;
    private final Set<String> requiredModifiers;
    private boolean held;

    public ModifierCombinationTrigger(List<String> modifiers, String primaryKey) {
        if (modifiers == null || modifiers.isEmpty()) {
            throw new IllegalArgumentException("modifier combination needs at least one modifier");
        }
        this.primaryKey = KeyNameMapper.normalizeKey(primaryKey);
        this.requiredModifiers = KeyNameMapper.normalizeModifiers(modifiers);
    }

    @Override
    public String name() {
        return "combo:" + String.join("+", requiredModifiers) + "+" + primaryKey;
    }

    @Override
    public boolean onKeyPressed(NormalizedKeyEvent e) {
        if (held || !e.key().equals(primaryKey)) {
            return false;
        }
        if (!e.modifiers().containsAll(requiredModifiers)) {
            return false;
        }
        held = true;
        return true;
    }

    @Override
    public void onKeyReleased(NormalizedKeyEvent e) {
        if (e.key().equals(primaryKey)) {
            held = false;
        }
    }
}
