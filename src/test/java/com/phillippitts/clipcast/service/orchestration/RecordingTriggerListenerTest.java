package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.config.properties.DebounceProperties;
import com.phillippitts.clipcast.domain.AppState;
import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.domain.MediaItem;
import com.phillippitts.clipcast.domain.OutputFormat;
import com.phillippitts.clipcast.domain.RecordingSettings;
import com.phillippitts.clipcast.service.debounce.DebounceManager;
import com.phillippitts.clipcast.service.hotkey.RecordingAction;
import com.phillippitts.clipcast.service.hotkey.event.RecordingHotkeyEvent;
import com.phillippitts.clipcast.service.state.StateBroadcaster;
import com.phillippitts.clipcast.service.state.StateRepository;
import com.phillippitts.clipcast.testutil.MutableClock;
import com.phillippitts.clipcast.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingTriggerListenerTest {

    private static final CaptureRegion AREA = CaptureRegion.of(10, 10, 200, 100);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
    private ScheduledExecutorService scheduler;
    private StateRepository state;
    private FakeRecordingController controller;
    private RecordingCountdown countdown;
    private DebounceManager debounce;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        state = new StateRepository(new StateBroadcaster(new SyncExecutor()));
        controller = new FakeRecordingController();
        countdown = new RecordingCountdown(state, controller, scheduler, 3_600_000L);
        debounce = new DebounceManager(scheduler, clock);
    }

    @AfterEach
    void tearDown() {
        debounce.shutdown();
        scheduler.shutdownNow();
    }

    private RecordingTriggerListener listener(boolean showCountdown) {
        RecordingSettings defaults = RecordingSettings.defaults();
        RecordingSettings settings = new RecordingSettings(defaults.defaultFormat(), defaults.defaultFps(),
                defaults.defaultQuality(), defaults.defaultMaxDurationSeconds(), defaults.captureScale(),
                showCountdown, 3, true, Path.of("out"), null, 10, Path.of("tmp"), false);
        state.initialize(settings, List.of());
        return new RecordingTriggerListener(controller, countdown, state, debounce,
                new DebounceProperties(500, 300, 200, 100, 1000), () -> Optional.of(AREA));
    }

    private static RecordingHotkeyEvent press(RecordingAction action) {
        return new RecordingHotkeyEvent(action, Instant.now());
    }

    @Test
    void toggleFromIdleStartsWithSelectedArea() {
        RecordingTriggerListener l = listener(false);

        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(controller.starts).containsExactly(AREA);
    }

    @Test
    void toggleWithCountdownEntersPreparing() {
        RecordingTriggerListener l = listener(true);

        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(countdown.isActive()).isTrue();
        assertThat(controller.starts).isEmpty();
    }

    @Test
    void toggleDuringCountdownCancelsIt() {
        RecordingTriggerListener l = listener(true);
        l.onHotkey(press(RecordingAction.TOGGLE));
        clock.advance(Duration.ofSeconds(1));

        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(countdown.isActive()).isFalse();
        assertThat(controller.starts).isEmpty();
    }

    @Test
    void toggleWhileRecordingStops() {
        RecordingTriggerListener l = listener(false);
        state.startRecording(null, null, null, CaptureMethod.ROBOT_API, null);

        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(controller.stops).isEqualTo(1);
    }

    @Test
    void repeatedToggleInsideWindowIsThrottled() {
        RecordingTriggerListener l = listener(false);

        l.onHotkey(press(RecordingAction.TOGGLE));
        clock.advance(Duration.ofMillis(100));
        l.onHotkey(press(RecordingAction.TOGGLE));
        clock.advance(Duration.ofMillis(500));
        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(controller.starts).hasSize(2);
    }

    @Test
    void toggleFromRecoverableErrorRecoversThenStarts() {
        RecordingTriggerListener l = listener(false);
        state.handleError("capture failed", null, true);

        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(controller.starts).containsExactly(AREA);
    }

    @Test
    void toggleFromErrorRaisedWhileEditingRecoversWithoutStarting() {
        RecordingTriggerListener l = listener(false);
        MediaItem clip = new MediaItem("media_1", Path.of("out/media_1.gif"), null, OutputFormat.GIF, 1024, 3000,
                null, clock.instant(), null);
        state.startEditing(clip);
        state.handleError("trim failed", null, true);

        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(state.current()).isInstanceOf(AppState.Editing.class);
        assertThat(controller.starts).isEmpty();
        assertThat(countdown.isActive()).isFalse();
    }

    @Test
    void toggleFromFatalErrorIsIgnored() {
        RecordingTriggerListener l = listener(false);
        state.handleError("broken", null, false);

        l.onHotkey(press(RecordingAction.TOGGLE));

        assertThat(controller.starts).isEmpty();
    }

    @Test
    void pauseAndCancelReachController() {
        RecordingTriggerListener l = listener(false);

        l.onHotkey(press(RecordingAction.PAUSE));
        l.onHotkey(press(RecordingAction.CANCEL));

        assertThat(controller.pauses).isEqualTo(1);
        assertThat(controller.cancels).isEqualTo(1);
    }

    @Test
    void cancelPrefersRunningCountdown() {
        RecordingTriggerListener l = listener(true);
        l.onHotkey(press(RecordingAction.TOGGLE));

        l.onHotkey(press(RecordingAction.CANCEL));

        assertThat(countdown.isActive()).isFalse();
        assertThat(controller.cancels).isZero();
    }
}
