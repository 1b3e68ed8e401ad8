package com.phillippitts.clipcast.service.hotkey;

import com.phillippitts.clipcast.config.hotkey.TriggerType;
import com.phillippitts.clipcast.config.properties.HotkeyProperties;
import com.phillippitts.clipcast.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.clipcast.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.clipcast.service.hotkey.event.RecordingHotkeyEvent;
import com.phillippitts.clipcast.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class HotkeyManagerTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final FakeHook hook = new FakeHook();

    private HotkeyManager manager(HotkeyProperties props) {
        return new HotkeyManager(hook, new HotkeyTriggerFactory(), props, publisher);
    }

    private static HotkeyProperties combo(String key, List<String> mods, String pause, String cancel) {
        return new HotkeyProperties(true, TriggerType.MODIFIER_COMBINATION, key, 300, mods, pause, cancel, null);
    }

    @Test
    void comboPressPublishesToggleOnly() {
        HotkeyManager mgr = manager(combo("R", List.of("META", "SHIFT"), "P", "ESCAPE"));

        mgr.start();
        hook.emit(NormalizedKeyEvent.pressed("R", Set.of("META", "SHIFT"), 0));
        hook.emit(NormalizedKeyEvent.released("R", Set.of("META", "SHIFT"), 40));
        mgr.stop();

        assertThat(publisher.eventsOf(RecordingHotkeyEvent.class))
                .extracting(RecordingHotkeyEvent::action)
                .containsExactly(RecordingAction.TOGGLE);
        assertThat(hook.registered()).isFalse();
    }

    @Test
    void pauseAndCancelUseToggleModifiers() {
        HotkeyManager mgr = manager(combo("R", List.of("META", "SHIFT"), "P", "ESCAPE"));
        mgr.start();

        hook.emit(NormalizedKeyEvent.pressed("P", Set.of(), 0));
        hook.emit(NormalizedKeyEvent.pressed("P", Set.of("META", "SHIFT"), 10));
        hook.emit(NormalizedKeyEvent.pressed("ESC", Set.of("META", "SHIFT"), 20));

        assertThat(publisher.eventsOf(RecordingHotkeyEvent.class))
                .extracting(RecordingHotkeyEvent::action)
                .containsExactly(RecordingAction.PAUSE, RecordingAction.CANCEL);
    }

    @Test
    void deniedHookPublishesPermissionEvent() {
        hook.denyWith(new SecurityException("Accessibility permission not granted"));
        HotkeyManager mgr = manager(combo("R", List.of("META"), null, null));

        mgr.start();

        assertThat(mgr.isRunning()).isFalse();
        assertThat(publisher.first(HotkeyPermissionDeniedEvent.class).reason())
                .contains("Accessibility");
    }

    @Test
    void reservedShortcutIsReportedAsConflict() {
        HotkeyManager mgr = manager(combo("TAB", List.of("cmd"), null, null));

        mgr.start();

        HotkeyConflictEvent conflict = publisher.first(HotkeyConflictEvent.class);
        assertThat(conflict).isNotNull();
        assertThat(conflict.reserved()).isEqualTo("META+TAB");
        assertThat(mgr.isRunning()).isTrue();
    }

    @Test
    void startAndStopAreIdempotent() {
        HotkeyManager mgr = manager(combo("R", List.of("META"), null, null));

        mgr.start();
        mgr.start();
        mgr.stop();
        mgr.stop();

        assertThat(hook.registrations).isEqualTo(1);
        assertThat(mgr.isRunning()).isFalse();
    }

    // Simple fake hook for tests
    static class FakeHook implements GlobalKeyHook {
        private final AtomicBoolean reg = new AtomicBoolean();
        private volatile Consumer<NormalizedKeyEvent> listener;
        private SecurityException denial;
        int registrations;

        void denyWith(SecurityException e) { this.denial = e; }
        boolean registered() { return reg.get(); }

        @Override public void register() {
            if (denial != null) {
                throw denial;
            }
            registrations++;
            reg.set(true);
        }
        @Override public void unregister() { reg.set(false); }
        @Override public void addListener(Consumer<NormalizedKeyEvent> listener) { this.listener = listener; }
        void emit(NormalizedKeyEvent e) { Consumer<NormalizedKeyEvent> l = listener; if (l != null) l.accept(e); }
    }
}
