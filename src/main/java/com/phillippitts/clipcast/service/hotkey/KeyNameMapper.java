package com.phillippitts.clipcast.service.hotkey;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical key and modifier names shared by the configuration validator, the triggers and
 * the native hook adapter. Every comparison in the hotkey subsystem goes through here.
 */
public final class KeyNameMapper {

    private static final Set<String> BASE_MODIFIERS = Set.of("META", "SHIFT", "CONTROL", "ALT");

    private static final Set<String> SIDED_MODIFIERS = Set.of(
            "LEFT_META", "RIGHT_META", "LEFT_SHIFT", "RIGHT_SHIFT",
            "LEFT_CONTROL", "RIGHT_CONTROL", "LEFT_ALT", "RIGHT_ALT");

    private static final Set<String> SPECIAL_KEYS = Set.of("ESCAPE", "ENTER", "TAB", "SPACE", "BACKSPACE");

    private KeyNameMapper() {}

    /** Upper-cases, maps spaces to underscores and resolves the Command/Cmd/Ctrl/Option aliases. */
    public static String normalizeKey(String keyText) {
        if (keyText == null) {
            return "UNKNOWN";
        }
        String k = resolveAliases(keyText);
        if (k.equals("ESC")) {
            return "ESCAPE";
        }
        if (k.equals("RETURN")) {
            return "ENTER";
        }
        return k;
    }

    public static String normalizeModifier(String mod) {
        if (mod == null) {
            return "";
        }
        return resolveAliases(mod);
    }

    public static Set<String> normalizeModifiers(Collection<String> mods) {
        if (mods == null) {
            return Set.of();
        }
        return mods.stream()
                .map(KeyNameMapper::normalizeModifier)
                .filter(m -> !m.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static boolean isValidKey(String key) {
        String k = normalizeKey(key);
        if (k.length() == 1) {
            char c = k.charAt(0);
            return (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
        }
        if (k.matches("F([1-9]|1[0-9]|2[0-4])")) {
            return true;
        }
        return SPECIAL_KEYS.contains(k) || SIDED_MODIFIERS.contains(k);
    }

    public static boolean isValidModifier(String mod) {
        String m = normalizeModifier(mod);
        return BASE_MODIFIERS.contains(m) || SIDED_MODIFIERS.contains(m);
    }

    /**
     * Compares a configured binding (modifiers + key) with a reserved combination such as
     * {@code META+TAB}. Modifier sets must be equal; order and case do not matter.
     */
    public static boolean matchesReserved(Collection<String> configuredMods, String configuredKey,
                                          String reservedSpec) {
        if (reservedSpec == null || reservedSpec.isBlank()) {
            return false;
        }
        Set<String> reservedMods = new HashSet<>();
        String reservedKey = null;
        for (String part : List.of(reservedSpec.split("\\+"))) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            if (isValidModifier(p)) {
                reservedMods.add(normalizeModifier(p));
            } else {
                reservedKey = normalizeKey(p);
            }
        }
        return normalizeKey(configuredKey).equals(reservedKey)
                && normalizeModifiers(configuredMods).equals(reservedMods);
    }

    private static String resolveAliases(String raw) {
        String s = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        s = s.replace("COMMAND", "META").replace("CMD", "META");
        if (s.endsWith("CTRL")) {
            s = s.substring(0, s.length() - 4) + "CONTROL";
        }
        if (s.endsWith("OPTION")) {
            s = s.substring(0, s.length() - 6) + "ALT";
        }
        return s;
    }
}
