package com.phillippitts.clipcast.service.hotkey;

import java.util.Set;

/**
 * Keyboard event in canonical {@link KeyNameMapper} form, independent of the native hook library.
 */
public record NormalizedKeyEvent(Type type, String key, Set<String> modifiers, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = KeyNameMapper.normalizeKey(key);
        modifiers = KeyNameMapper.normalizeModifiers(modifiers);
    }

    public static NormalizedKeyEvent pressed(String key, Set<String> modifiers, long whenMillis) {
        return new NormalizedKeyEvent(Type.PRESSED, key, modifiers, whenMillis);
    }

    public static NormalizedKeyEvent released(String key, Set<String> modifiers, long whenMillis) {
        return new NormalizedKeyEvent(Type.RELEASED, key, modifiers, whenMillis);
    }
}
