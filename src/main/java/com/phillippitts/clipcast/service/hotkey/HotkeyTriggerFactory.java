package com.phillippitts.clipcast.service.hotkey;

import com.phillippitts.clipcast.config.properties.HotkeyProperties;
import com.phillippitts.clipcast.service.hotkey.trigger.DoubleTapTrigger;
import com.phillippitts.clipcast.service.hotkey.trigger.ModifierCombinationTrigger;
import com.phillippitts.clipcast.service.hotkey.trigger.SingleKeyTrigger;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds one {@link HotkeyTrigger} per {@link RecordingAction} from typed properties.
 * Pause and cancel use the toggle's modifiers with their own key and are omitted when blank.
 */
@Component
public class HotkeyTriggerFactory {

    public HotkeyTrigger toggle(HotkeyProperties p) {
        return switch (p.getType()) {
            case SINGLE_KEY -> new SingleKeyTrigger(p.getKey(), p.getModifiers());
            case DOUBLE_TAP -> new DoubleTapTrigger(p.getKey(), p.getThresholdMs());
            case MODIFIER_COMBINATION -> new ModifierCombinationTrigger(p.getModifiers(), p.getKey());
        };
    }

    public Map<RecordingAction, HotkeyTrigger> bindings(HotkeyProperties p) {
        Map<RecordingAction, HotkeyTrigger> map = new EnumMap<>(RecordingAction.class);
        map.put(RecordingAction.TOGGLE, toggle(p));
        if (!p.getPauseKey().isEmpty()) {
            map.put(RecordingAction.PAUSE, new SingleKeyTrigger(p.getPauseKey(), p.getModifiers()));
        }
        if (!p.getCancelKey().isEmpty()) {
            map.put(RecordingAction.CANCEL, new SingleKeyTrigger(p.getCancelKey(), p.getModifiers()));
        }
        return map;
    }
}
