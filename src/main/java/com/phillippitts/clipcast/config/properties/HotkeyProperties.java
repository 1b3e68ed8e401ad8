package com.phillippitts.clipcast.config.properties;

import com.phillippitts.clipcast.config.hotkey.TriggerType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the global recording hotkeys.
 *
 * The toggle hotkey (start when idle, stop when recording) supports three trigger styles:
 * - single-key
 * - double-tap (same key pressed twice within threshold)
 * - modifier-combination (e.g., META+SHIFT+R)
 *
 * Pause and cancel are bound to single keys that only fire together with the toggle modifiers.
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "hotkey")
public class HotkeyProperties {

    /** Master switch; tests and headless deployments turn the native hook off. */
    private final boolean enabled;

    @NotNull
    private final TriggerType type;

    /** Primary key code name for the toggle action (e.g., R, F13, RIGHT_META). */
    @NotBlank
    private final String key;

    /** Double-tap threshold (ms). Only used when type=double-tap. */
    @Min(100)
    @Max(1000)
    private final int thresholdMs;

    /** Modifiers for the toggle key and the pause/cancel keys (META, SHIFT, CONTROL, ALT). */
    private final List<String> modifiers;

    /** Key that toggles pause while recording; blank disables it. */
    private final String pauseKey;

    /** Key that discards the running recording; blank disables it. */
    private final String cancelKey;

    /** Reserved OS shortcuts to flag as conflicts (e.g., META+TAB, META+L). */
    private final List<String> reserved;

    @ConstructorBinding
    public HotkeyProperties(Boolean enabled,
                            TriggerType type,
                            String key,
                            Integer thresholdMs,
                            List<String> modifiers,
                            String pauseKey,
                            String cancelKey,
                            List<String> reserved) {
        this.enabled = enabled == null || enabled;
        this.type = type == null ? TriggerType.MODIFIER_COMBINATION : type;
        this.key = key == null ? "R" : key;
        this.thresholdMs = thresholdMs == null ? 300 : thresholdMs;
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.pauseKey = pauseKey == null ? "" : pauseKey.trim();
        this.cancelKey = cancelKey == null ? "" : cancelKey.trim();
        this.reserved = (reserved == null || reserved.isEmpty())
                ? List.of("META+TAB", "META+L")
                : List.copyOf(reserved);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public TriggerType getType() {
        return type;
    }

    public String getKey() {
        return key;
    }

    public int getThresholdMs() {
        return thresholdMs;
    }

    public List<String> getModifiers() {
        return modifiers;
    }

    public String getPauseKey() {
        return pauseKey;
    }

    public String getCancelKey() {
        return cancelKey;
    }

    public List<String> getReserved() {
        return reserved;
    }
}
