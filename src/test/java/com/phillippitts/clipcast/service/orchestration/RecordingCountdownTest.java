package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.domain.AppState;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.domain.RecordingSettings;
import com.phillippitts.clipcast.service.state.StateBroadcaster;
import com.phillippitts.clipcast.service.state.StateRepository;
import com.phillippitts.clipcast.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingCountdownTest {

    private ScheduledExecutorService scheduler;
    private StateRepository state;
    private FakeRecordingController controller;
    private RecordingCountdown countdown;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        state = new StateRepository(new StateBroadcaster(new SyncExecutor()));
        state.initialize(RecordingSettings.defaults(), List.of());
        controller = new FakeRecordingController();
        // steps are driven by the test
        countdown = new RecordingCountdown(state, controller, scheduler, 3_600_000L);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void countsDownThenStarts() {
        CaptureRegion area = CaptureRegion.of(0, 0, 100, 100);

        assertThat(countdown.begin(area, 3)).isTrue();
        assertThat(((AppState.PreparingRecording) state.current()).countdown()).isEqualTo(3);

        countdown.step();
        assertThat(((AppState.PreparingRecording) state.current()).countdown()).isEqualTo(2);
        countdown.step();
        assertThat(((AppState.PreparingRecording) state.current()).countdown()).isEqualTo(1);
        assertThat(controller.starts).isEmpty();

        countdown.step();

        assertThat(controller.starts).containsExactly(area);
        assertThat(countdown.isActive()).isFalse();
    }

    @Test
    void selectedRegionSurvivesTheFinalStep() {
        CaptureRegion area = new CaptureRegion(-1440, 120, 640, 480, "2");
        countdown.begin(area, 1);

        countdown.step();

        assertThat(controller.starts).hasSize(1);
        assertThat(controller.starts.get(0)).isNotNull().isEqualTo(area);
    }

    @Test
    void zeroSecondsStartsImmediately() {
        assertThat(countdown.begin(null, 0)).isTrue();

        assertThat(controller.starts).hasSize(1);
        assertThat(countdown.isActive()).isFalse();
    }

    @Test
    void secondBeginIsRejected() {
        countdown.begin(null, 3);

        assertThat(countdown.begin(null, 3)).isFalse();
    }

    @Test
    void cancelReturnsToIdleWithoutStarting() {
        countdown.begin(null, 3);

        assertThat(countdown.cancel()).isTrue();
        countdown.step();

        assertThat(state.current()).isInstanceOf(AppState.Idle.class);
        assertThat(controller.starts).isEmpty();
        assertThat(countdown.cancel()).isFalse();
    }

    @Test
    void externalStateChangeAbortsCountdown() {
        countdown.begin(null, 3);
        state.cancelCurrentOperation();

        countdown.step();
        countdown.step();
        countdown.step();

        assertThat(controller.starts).isEmpty();
        assertThat(countdown.isActive()).isFalse();
    }

    @Test
    void refusedWhenStateDoesNotAllowCountdown() {
        state.openSettings();

        assertThat(countdown.begin(null, 3)).isFalse();
        assertThat(countdown.isActive()).isFalse();
    }
}
