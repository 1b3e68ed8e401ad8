package com.phillippitts.clipcast.config.hotkey;

import com.phillippitts.clipcast.config.properties.HotkeyProperties;
import com.phillippitts.clipcast.service.hotkey.KeyNameMapper;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/**
 * Validates HotkeyProperties against allow-lists at startup to fail fast with
 * actionable messages. Skipped entirely when hotkeys are disabled.
 */
@Component
class HotkeyConfigurationValidator {

    private final HotkeyProperties props;

    HotkeyConfigurationValidator(HotkeyProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        if (!props.isEnabled()) {
            return;
        }
        if (!KeyNameMapper.isValidKey(props.getKey())) {
            throw new IllegalArgumentException("Invalid hotkey.key: '" + props.getKey()
                    + "'. Must be A-Z, 0-9, F1..F24, or a known special "
                    + "(ESCAPE, ENTER, TAB, SPACE, BACKSPACE, LEFT/RIGHT_*).");
        }
        validateOptionalKey("hotkey.pause-key", props.getPauseKey());
        validateOptionalKey("hotkey.cancel-key", props.getCancelKey());
        for (String m : props.getModifiers()) {
            if (!KeyNameMapper.isValidModifier(m)) {
                throw new IllegalArgumentException("Invalid hotkey.modifiers entry: '" + m
                        + "'. Allowed: META, SHIFT, CONTROL, ALT and LEFT/RIGHT variants.");
            }
        }
        if (props.getType() == TriggerType.MODIFIER_COMBINATION && props.getModifiers().isEmpty()) {
            throw new IllegalArgumentException(
                    "hotkey.type=modifier-combination requires at least one modifier in hotkey.modifiers");
        }
        if (props.getType() == TriggerType.DOUBLE_TAP) {
            int threshold = props.getThresholdMs();
            if (threshold < 100 || threshold > 1000) {
                throw new IllegalArgumentException(
                        "Double-tap threshold must be between 100 and 1000 milliseconds, got: " + threshold);
            }
        }
        String toggle = KeyNameMapper.normalizeKey(props.getKey());
        if (toggle.equals(KeyNameMapper.normalizeKey(props.getPauseKey()))
                || toggle.equals(KeyNameMapper.normalizeKey(props.getCancelKey()))) {
            throw new IllegalArgumentException("hotkey.pause-key and hotkey.cancel-key must differ from hotkey.key");
        }
    }

    private static void validateOptionalKey(String property, String value) {
        if (value.isEmpty()) {
            return;
        }
        if (!KeyNameMapper.isValidKey(value)) {
            throw new IllegalArgumentException("Invalid " + property + ": '" + value + "'.");
        }
    }
}
