package com.phillippitts.clipcast.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * What the application is doing right now. Exactly one variant is live at any instant and the
 * only legal way to change it is a transition of
 * {@link com.phillippitts.clipcast.service.state.StateRepository}.
 */
public sealed interface AppState permits AppState.Initializing, AppState.Idle, AppState.PreparingRecording,
        AppState.Recording, AppState.Processing, AppState.Editing, AppState.ConfiguringSettings, AppState.Error {

    /** Short variant name for logs and the REST surface. */
    default String name() {
        return getClass().getSimpleName();
    }

    /** Startup, before settings and recent recordings are loaded. */
    record Initializing() implements AppState { }

    record Idle(List<MediaItem> recentRecordings,
                String lastError,
                boolean quickPanelVisible,
                RecordingSettings settings) implements AppState {

        public Idle {
            recentRecordings = recentRecordings == null ? List.of() : List.copyOf(recentRecordings);
            Objects.requireNonNull(settings, "settings");
        }

        public Idle(List<MediaItem> recentRecordings, RecordingSettings settings) {
            this(recentRecordings, null, false, settings);
        }
    }

    /**
     * Waiting for an area selection or counting down.
     *
     * @param selectedArea null until the user picked an area (full screen otherwise)
     * @param countdown    remaining seconds, null when no countdown is running
     */
    record PreparingRecording(CaptureRegion selectedArea,
                              Integer countdown,
                              RecordingSettings settings) implements AppState {

        public PreparingRecording {
            Objects.requireNonNull(settings, "settings");
        }
    }

    record Recording(RecordingSession session,
                     boolean paused,
                     CaptureMethod captureMethod,
                     RecordingSettings settings) implements AppState {

        public Recording {
            Objects.requireNonNull(session, "session");
            Objects.requireNonNull(settings, "settings");
            captureMethod = captureMethod == null ? CaptureMethod.AUTO : captureMethod;
        }
    }

    /**
     * Frames are being encoded.
     *
     * @param progress fraction in [0, 1]; out-of-range values are clamped
     */
    record Processing(RecordingSession session,
                      double progress,
                      ProcessingStage stage,
                      Duration estimatedTimeRemaining,
                      RecordingSettings settings) implements AppState {

        public Processing {
            Objects.requireNonNull(session, "session");
            Objects.requireNonNull(settings, "settings");
            stage = stage == null ? ProcessingStage.COLLECTING_FRAMES : stage;
            if (Double.isNaN(progress)) {
                progress = 0.0;
            }
            progress = Math.max(0.0, Math.min(1.0, progress));
        }
    }

    record Editing(MediaItem mediaItem,
                   EditState editState,
                   boolean hasUnsavedChanges,
                   RecordingSettings settings) implements AppState {

        public Editing {
            Objects.requireNonNull(mediaItem, "mediaItem");
            Objects.requireNonNull(settings, "settings");
            editState = editState == null ? EditState.initial() : editState;
        }
    }

    /**
     * @param pendingChanges null until the user edits something
     */
    record ConfiguringSettings(RecordingSettings currentSettings,
                               RecordingSettings pendingChanges,
                               SettingsTab activeTab) implements AppState {

        public ConfiguringSettings {
            Objects.requireNonNull(currentSettings, "currentSettings");
            activeTab = activeTab == null ? SettingsTab.GENERAL : activeTab;
        }
    }

    /**
     * @param previousState state to restore on {@code recoverFromError}; null falls back to Idle
     */
    record Error(String message,
                 Throwable cause,
                 boolean recoverable,
                 AppState previousState) implements AppState {

        public Error {
            message = message == null || message.isBlank() ? "Unknown error" : message;
        }
    }
}
