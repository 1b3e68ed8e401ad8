package com.phillippitts.clipcast.service.state;

import com.phillippitts.clipcast.domain.AppState;
import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.domain.EditState;
import com.phillippitts.clipcast.domain.MediaItem;
import com.phillippitts.clipcast.domain.OutputFormat;
import com.phillippitts.clipcast.domain.ProcessingStage;
import com.phillippitts.clipcast.domain.RecordingSession;
import com.phillippitts.clipcast.domain.RecordingSettings;
import com.phillippitts.clipcast.domain.SettingsTab;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Single source of truth for the application state.
 *
 * <p>Holds exactly one {@link AppState} behind a {@link ReentrantLock}. Every public operation
 * is one read-modify-write transaction: lock, inspect the current variant, compute the next
 * variant, publish it, unlock. Readers observe values through {@link #current()} or a
 * {@link #subscribe(Consumer) subscription} with last-value-wins delivery.
 *
 * <p><b>Lenient transitions:</b> an operation issued while the current variant does not allow
 * it is a no-op that returns {@code false} and is logged at DEBUG as
 * {@code StateTransitionIgnored}. Duplicate stop events and similar UI races are expected.
 *
 * <p><b>Transitions:</b>
 * <pre>
 * initialize             Initializing                 → Idle
 * prepareRecording       Idle, Error(prev=Idle)       → PreparingRecording
 * startCountdown...      Idle, PreparingRecording     → PreparingRecording(countdown)
 * startRecording         any                          → Recording (new session)
 * updateRecordingProgress, togglePause, updateCaptureMethod   Recording → Recording
 * stopRecording          Recording                    → Processing
 * updateProcessingProgress  Processing                → Processing
 * completeProcessing     Processing                   → Idle (item prepended to recents)
 * handleError            any                          → Error
 * recoverFromError       Error(recoverable)           → previousState or Idle
 * cancelCurrentOperation any                          → Idle
 * </pre>
 *
 * <p>This class performs no I/O.
 */
public final class StateRepository {

    private static final Logger LOG = LogManager.getLogger(StateRepository.class);

    private final Lock lock = new ReentrantLock();
    private final StateBroadcaster broadcaster;
    private final Clock clock;

    private volatile AppState state = new AppState.Initializing();

    // Guarded by lock
    private RecordingSettings settings = RecordingSettings.defaults();
    private List<MediaItem> recent = List.of();
    private long lastSessionMillis;

    public StateRepository(StateBroadcaster broadcaster) {
        this(broadcaster, Clock.systemUTC());
    }

    public StateRepository(StateBroadcaster broadcaster, Clock clock) {
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Latest published state. Never null. */
    public AppState current() {
        return state;
    }

    /**
     * Subscribes to state changes. The listener is first offered the current state.
     * Close the returned handle to unsubscribe.
     */
    public StateBroadcaster.Subscription subscribe(Consumer<AppState> listener) {
        lock.lock();
        try {
            return broadcaster.subscribe(listener, state);
        } finally {
            lock.unlock();
        }
    }

    public RecordingSettings settings() {
        lock.lock();
        try {
            return settings;
        } finally {
            lock.unlock();
        }
    }

    public List<MediaItem> recentRecordings() {
        lock.lock();
        try {
            return recent;
        } finally {
            lock.unlock();
        }
    }

    // ---- lifecycle ------------------------------------------------------------------------

    public boolean initialize(RecordingSettings initialSettings, List<MediaItem> recentRecordings) {
        Objects.requireNonNull(initialSettings, "initialSettings");
        return transition("initialize", current -> {
            if (!(current instanceof AppState.Initializing)) {
                return null;
            }
            settings = initialSettings;
            recent = cap(recentRecordings == null ? List.of() : recentRecordings);
            return idle(null);
        });
    }

    // ---- preparing ------------------------------------------------------------------------

    public boolean prepareRecording(CaptureRegion area) {
        return transition("prepareRecording", current -> {
            if (current instanceof AppState.Idle || isErrorFromIdle(current)) {
                return new AppState.PreparingRecording(area, null, settings);
            }
            return null;
        });
    }

    /**
     * Enters the countdown. The ticking itself is driven by
     * {@link com.phillippitts.clipcast.service.orchestration.RecordingCountdown}.
     */
    public boolean startCountdownRecording(CaptureRegion area, int seconds) {
        return transition("startCountdownRecording", current -> {
            if (current instanceof AppState.Idle || current instanceof AppState.PreparingRecording) {
                CaptureRegion selected = area;
                if (selected == null && current instanceof AppState.PreparingRecording p) {
                    selected = p.selectedArea();
                }
                return new AppState.PreparingRecording(selected, seconds > 0 ? seconds : null, settings);
            }
            return null;
        });
    }

    public boolean updateCountdown(Integer seconds) {
        return transition("updateCountdown", current -> {
            if (current instanceof AppState.PreparingRecording p) {
                return new AppState.PreparingRecording(p.selectedArea(), seconds, p.settings());
            }
            return null;
        });
    }

    public boolean cancelCountdown() {
        return transition("cancelCountdown", current ->
                current instanceof AppState.PreparingRecording ? idle(null) : null);
    }

    // ---- recording ------------------------------------------------------------------------

    /**
     * Starts a new session from any state.
     *
     * @param area        captured rectangle, null for full screen
     * @param format      requested format, null for the settings default
     * @param maxDuration max duration in seconds, null for the settings default
     * @return the new session
     */
    public RecordingSession startRecording(CaptureRegion area, OutputFormat format, Integer maxDuration) {
        return startRecording(area, format, maxDuration, CaptureMethod.AUTO, null);
    }

    public RecordingSession startRecording(CaptureRegion area, OutputFormat format, Integer maxDuration,
                                           CaptureMethod method, Path frameDirectory) {
        lock.lock();
        try {
            RecordingSession session = RecordingSession.start(
                    nextSessionId(),
                    clock.instant(),
                    area,
                    format != null ? format : settings.defaultFormat(),
                    maxDuration != null && maxDuration > 0 ? maxDuration : settings.defaultMaxDurationSeconds())
                    .withFrameDirectory(frameDirectory);
            publish("startRecording", new AppState.Recording(session, false, method, settings));
            return session;
        } finally {
            lock.unlock();
        }
    }

    public boolean updateRecordingProgress(int frameCount, double durationSeconds, long estimatedSize,
                                           String captureDetail) {
        return transition("updateRecordingProgress", current -> {
            if (current instanceof AppState.Recording r) {
                RecordingSession next = r.session().withProgress(frameCount, durationSeconds, estimatedSize,
                        captureDetail);
                return new AppState.Recording(next, r.paused(), r.captureMethod(), r.settings());
            }
            return null;
        });
    }

    public boolean updateCaptureMethod(CaptureMethod method, String detail) {
        return transition("updateCaptureMethod", current -> {
            if (current instanceof AppState.Recording r) {
                RecordingSession next = detail == null ? r.session() : r.session().withBackendDetail(detail);
                return new AppState.Recording(next, r.paused(), method, r.settings());
            }
            return null;
        });
    }

    public boolean togglePause() {
        return transition("togglePause", current -> {
            if (current instanceof AppState.Recording r) {
                return new AppState.Recording(r.session(), !r.paused(), r.captureMethod(), r.settings());
            }
            return null;
        });
    }

    public boolean stopRecording() {
        return transition("stopRecording", current -> {
            if (current instanceof AppState.Recording r) {
                return new AppState.Processing(r.session(), 0.0, ProcessingStage.COLLECTING_FRAMES, null,
                        r.settings());
            }
            return null;
        });
    }

    // ---- processing -----------------------------------------------------------------------

    /**
     * @param progress fraction in [0, 1]; clamped
     */
    public boolean updateProcessingProgress(double progress, ProcessingStage stage, Duration eta) {
        return transition("updateProcessingProgress", current -> {
            if (current instanceof AppState.Processing p) {
                return new AppState.Processing(p.session(), progress, stage != null ? stage : p.stage(), eta,
                        p.settings());
            }
            return null;
        });
    }

    public boolean setProcessingStage(ProcessingStage stage) {
        return transition("setProcessingStage", current -> {
            if (current instanceof AppState.Processing p) {
                return new AppState.Processing(p.session(), p.progress(), stage, p.estimatedTimeRemaining(),
                        p.settings());
            }
            return null;
        });
    }

    public boolean completeProcessing(MediaItem item) {
        Objects.requireNonNull(item, "item");
        return transition("completeProcessing", current -> {
            if (!(current instanceof AppState.Processing)) {
                return null;
            }
            List<MediaItem> next = new ArrayList<>(recent.size() + 1);
            next.add(item);
            next.addAll(recent);
            recent = cap(next);
            return idle(null);
        });
    }

    // ---- editing --------------------------------------------------------------------------

    public boolean startEditing(MediaItem item) {
        Objects.requireNonNull(item, "item");
        return transition("startEditing", current ->
                current instanceof AppState.Idle
                        ? new AppState.Editing(item, EditState.initial(), false, settings)
                        : null);
    }

    public boolean updateEditState(EditState editState) {
        return transition("updateEditState", current -> {
            if (current instanceof AppState.Editing e) {
                return new AppState.Editing(e.mediaItem(), editState, true, e.settings());
            }
            return null;
        });
    }

    /** Replaces the same-id entry in the recent list, or prepends the item if it is new. */
    public boolean saveEditedMedia(MediaItem updated) {
        Objects.requireNonNull(updated, "updated");
        return transition("saveEditedMedia", current -> {
            if (!(current instanceof AppState.Editing)) {
                return null;
            }
            List<MediaItem> next = new ArrayList<>(recent.size() + 1);
            boolean replaced = false;
            for (MediaItem m : recent) {
                if (m.id().equals(updated.id())) {
                    next.add(updated);
                    replaced = true;
                } else {
                    next.add(m);
                }
            }
            if (!replaced) {
                next.add(0, updated);
            }
            recent = cap(next);
            return idle(null);
        });
    }

    // ---- settings -------------------------------------------------------------------------

    public boolean openSettings() {
        return openSettings(SettingsTab.GENERAL);
    }

    public boolean openSettings(SettingsTab tab) {
        return transition("openSettings", current ->
                current instanceof AppState.Idle ? new AppState.ConfiguringSettings(settings, null, tab) : null);
    }

    public boolean updatePendingSettings(RecordingSettings pending) {
        return transition("updatePendingSettings", current -> {
            if (current instanceof AppState.ConfiguringSettings c) {
                return new AppState.ConfiguringSettings(c.currentSettings(), pending, c.activeTab());
            }
            return null;
        });
    }

    public boolean applySettings() {
        return transition("applySettings", current -> {
            if (current instanceof AppState.ConfiguringSettings c) {
                settings = c.pendingChanges() != null ? c.pendingChanges() : c.currentSettings();
                recent = cap(recent);
                return idle(null);
            }
            return null;
        });
    }

    public boolean cancelSettings() {
        return transition("cancelSettings", current ->
                current instanceof AppState.ConfiguringSettings ? idle(null) : null);
    }

    // ---- idle extras ----------------------------------------------------------------------

    public boolean toggleQuickPanel() {
        return transition("toggleQuickPanel", current -> {
            if (current instanceof AppState.Idle i) {
                return new AppState.Idle(i.recentRecordings(), i.lastError(), !i.quickPanelVisible(), i.settings());
            }
            return null;
        });
    }

    public boolean updateRecentRecordings(List<MediaItem> recordings) {
        return transition("updateRecentRecordings", current -> {
            if (current instanceof AppState.Idle i) {
                recent = cap(recordings == null ? List.of() : recordings);
                return new AppState.Idle(recent, i.lastError(), i.quickPanelVisible(), settings);
            }
            return null;
        });
    }

    // ---- errors ---------------------------------------------------------------------------

    /**
     * Enters {@link AppState.Error}. When already in Error the message is replaced but the
     * original previous state is kept. A session that was recording or processing cannot be
     * resumed, so its Idle equivalent is remembered instead.
     */
    public boolean handleError(String message, Throwable cause, boolean recoverable) {
        return transition("handleError", current -> {
            AppState previous = current instanceof AppState.Error e ? e.previousState() : restorable(current);
            return new AppState.Error(message, cause, recoverable, previous);
        });
    }

    public boolean recoverFromError() {
        return transition("recoverFromError", current -> {
            if (current instanceof AppState.Error e && e.recoverable()) {
                AppState previous = e.previousState();
                if (previous instanceof AppState.Idle i) {
                    // Recent list may have changed while in error
                    return new AppState.Idle(recent, i.lastError(), i.quickPanelVisible(), settings);
                }
                return previous != null ? previous : idle(null);
            }
            return null;
        });
    }

    /** Returns to Idle from any state keeping settings and recent recordings. */
    public boolean cancelCurrentOperation() {
        return transition("cancelCurrentOperation", current -> idle(null));
    }

    // ---- internals ------------------------------------------------------------------------

    private boolean transition(String operation, Function<AppState, AppState> decide) {
        lock.lock();
        try {
            AppState current = state;
            AppState next = decide.apply(current);
            if (next == null) {
                LOG.debug("StateTransitionIgnored: op={} state={}", operation, current.name());
                return false;
            }
            publish(operation, next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void publish(String operation, AppState next) {
        AppState previous = state;
        state = next;
        if (previous.getClass() != next.getClass()) {
            LOG.debug("State {} -> {} via {}", previous.name(), next.name(), operation);
        }
        broadcaster.publish(next);
    }

    private AppState.Idle idle(String lastError) {
        return new AppState.Idle(recent, lastError, false, settings);
    }

    private AppState restorable(AppState current) {
        if (current instanceof AppState.Recording
                || current instanceof AppState.Processing
                || current instanceof AppState.PreparingRecording
                || current instanceof AppState.Initializing) {
            return idle(null);
        }
        return current;
    }

    private static boolean isErrorFromIdle(AppState current) {
        return current instanceof AppState.Error e && e.previousState() instanceof AppState.Idle;
    }

    private List<MediaItem> cap(List<MediaItem> items) {
        int max = settings.maxRecentItems();
        return items.size() <= max ? List.copyOf(items) : List.copyOf(items.subList(0, max));
    }

    // Monotonic so two sessions started in the same millisecond still differ
    private String nextSessionId() {
        long millis = Math.max(clock.millis(), lastSessionMillis + 1);
        lastSessionMillis = millis;
        return "session_" + millis;
    }
}
