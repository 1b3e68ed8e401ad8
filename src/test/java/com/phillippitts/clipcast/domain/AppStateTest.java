package com.phillippitts.clipcast.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppStateTest {

    private static final RecordingSettings SETTINGS = RecordingSettings.defaults();

    @Test
    void processingProgressIsClamped() {
        RecordingSession session = RecordingSession.start("session_1", Instant.EPOCH, null, OutputFormat.GIF, 30);

        AppState.Processing over = new AppState.Processing(session, 1.7, null, Duration.ZERO, SETTINGS);
        AppState.Processing nan = new AppState.Processing(session, Double.NaN, ProcessingStage.ENCODING, null, SETTINGS);

        assertThat(over.progress()).isEqualTo(1.0);
        assertThat(over.stage()).isEqualTo(ProcessingStage.COLLECTING_FRAMES);
        assertThat(nan.progress()).isZero();
    }

    @Test
    void recordingDefaultsCaptureMethodToAuto() {
        RecordingSession session = RecordingSession.start("session_1", Instant.EPOCH, null, OutputFormat.GIF, 30);

        AppState.Recording rec = new AppState.Recording(session, false, null, SETTINGS);

        assertThat(rec.captureMethod()).isEqualTo(CaptureMethod.AUTO);
    }

    @Test
    void errorReplacesBlankMessage() {
        AppState.Error err = new AppState.Error("  ", null, true, null);

        assertThat(err.message()).isEqualTo("Unknown error");
        assertThat(err.name()).isEqualTo("Error");
    }

    @Test
    void idleCopiesRecentRecordings() {
        AppState.Idle idle = new AppState.Idle(null, SETTINGS);

        assertThat(idle.recentRecordings()).isEmpty();
        assertThat(idle.quickPanelVisible()).isFalse();
    }

    @Test
    void sessionRejectsNegativeFrameCount() {
        assertThatThrownBy(() -> new RecordingSession("s", Instant.EPOCH, null, -1, 0, 0, null,
                OutputFormat.GIF, 30, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sessionProgressKeepsBackendDetailWhenNoneGiven() {
        RecordingSession s = RecordingSession.start("s", Instant.EPOCH, null, OutputFormat.GIF, 2)
                .withBackendDetail("robot");

        RecordingSession next = s.withProgress(10, 2.0, 1024, null);

        assertThat(next.backendDetail()).isEqualTo("robot");
        assertThat(next.durationMillis()).isEqualTo(2000);
        assertThat(next.reachedMaxDuration()).isTrue();
    }
}
