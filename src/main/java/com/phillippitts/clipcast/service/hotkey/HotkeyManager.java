package com.phillippitts.clipcast.service.hotkey;

import com.phillippitts.clipcast.config.properties.HotkeyProperties;
import com.phillippitts.clipcast.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.clipcast.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.clipcast.service.hotkey.event.RecordingHotkeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Registers the global key hook and turns matching presses into {@link RecordingHotkeyEvent}s.
 * Tests inject a fake {@link GlobalKeyHook} and push {@link NormalizedKeyEvent}s into the
 * registered listener.
 */
@Service
@ConditionalOnProperty(prefix = "hotkey", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HotkeyManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HotkeyManager.class);

    private final GlobalKeyHook hook;
    private final Map<RecordingAction, HotkeyTrigger> bindings;
    private final ApplicationEventPublisher publisher;
    private final HotkeyProperties props;

    private volatile boolean running;

    public HotkeyManager(GlobalKeyHook hook,
                         HotkeyTriggerFactory factory,
                         HotkeyProperties props,
                         ApplicationEventPublisher publisher) {
        this.hook = hook;
        this.bindings = factory.bindings(props);
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        try {
            hook.addListener(dispatcher());
            hook.register();
            running = true;
            LOG.info("HotkeyManager started with bindings={}", describeBindings());
            detectReservedConflicts();
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.getMessage());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(se.getMessage(), Instant.now()));
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        hook.unregister();
        LOG.info("HotkeyManager stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private Consumer<NormalizedKeyEvent> dispatcher() {
        return e -> {
            if (e.type() == NormalizedKeyEvent.Type.RELEASED) {
                bindings.values().forEach(t -> t.onKeyReleased(e));
                return;
            }
            for (Map.Entry<RecordingAction, HotkeyTrigger> binding : bindings.entrySet()) {
                if (binding.getValue().onKeyPressed(e)) {
                    LOG.debug("Hotkey {} matched {}", binding.getKey(), binding.getValue().name());
                    publisher.publishEvent(new RecordingHotkeyEvent(binding.getKey(), Instant.now()));
                }
            }
        };
    }

    private void detectReservedConflicts() {
        List<String> keys = List.of(props.getKey(), props.getPauseKey(), props.getCancelKey());
        for (String key : keys) {
            if (key.isEmpty()) {
                continue;
            }
            for (String spec : props.getReserved()) {
                if (KeyNameMapper.matchesReserved(props.getModifiers(), key, spec)) {
                    LOG.warn("Configured hotkey '{}' + {} conflicts with reserved '{}'",
                            key, props.getModifiers(), spec);
                    publisher.publishEvent(new HotkeyConflictEvent(key, props.getModifiers(), spec, Instant.now()));
                }
            }
        }
    }

    private String describeBindings() {
        StringBuilder sb = new StringBuilder();
        bindings.forEach((action, trigger) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(action).append('=').append(trigger.name());
        });
        return sb.toString();
    }
}
