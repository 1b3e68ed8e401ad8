package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.config.properties.DebounceProperties;
import com.phillippitts.clipcast.domain.AppState;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.domain.RecordingSettings;
import com.phillippitts.clipcast.service.area.AreaSelector;
import com.phillippitts.clipcast.service.debounce.DebounceKeys;
import com.phillippitts.clipcast.service.debounce.DebounceManager;
import com.phillippitts.clipcast.service.hotkey.event.RecordingHotkeyEvent;
import com.phillippitts.clipcast.service.state.StateRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;

/**
 * Turns hotkey events into recording commands. Every action is throttled per key so key
 * repeat and double presses cannot start and immediately stop a session.
 *
 * <p>Handling runs on the {@code eventExecutor} pool because stopping capture blocks until the
 * backend has written its last frame.
 */
public class RecordingTriggerListener {

    private static final Logger LOG = LogManager.getLogger(RecordingTriggerListener.class);

    private final RecordingController controller;
    private final RecordingCountdown countdown;
    private final StateRepository stateRepository;
    private final DebounceManager debounceManager;
    private final DebounceProperties debounceProperties;
    private final AreaSelector areaSelector;

    public RecordingTriggerListener(RecordingController controller,
                                    RecordingCountdown countdown,
                                    StateRepository stateRepository,
                                    DebounceManager debounceManager,
                                    DebounceProperties debounceProperties,
                                    AreaSelector areaSelector) {
        this.controller = controller;
        this.countdown = countdown;
        this.stateRepository = stateRepository;
        this.debounceManager = debounceManager;
        this.debounceProperties = debounceProperties;
        this.areaSelector = areaSelector;
    }

    @EventListener
    @Async("eventExecutor")
    public void onHotkey(RecordingHotkeyEvent event) {
        long window = debounceProperties.recordingMs();
        boolean ran = switch (event.action()) {
            case TOGGLE -> debounceManager.throttle(DebounceKeys.TOGGLE_RECORDING, window, this::toggle);
            case PAUSE -> debounceManager.throttle(DebounceKeys.PAUSE_RECORDING, window, controller::pauseRecording);
            case CANCEL -> debounceManager.throttle(DebounceKeys.CANCEL_RECORDING, window, this::cancel);
        };
        if (!ran) {
            LOG.debug("Hotkey {} throttled", event.action());
        }
    }

    void toggle() {
        AppState state = stateRepository.current();
        if (state instanceof AppState.Recording) {
            controller.stopRecording();
            return;
        }
        if (state instanceof AppState.PreparingRecording && countdown.isActive()) {
            countdown.cancel();
            return;
        }
        if (state instanceof AppState.Error) {
            if (!stateRepository.recoverFromError()) {
                LOG.debug("Toggle ignored: error is not recoverable");
                return;
            }
            state = stateRepository.current();
        }
        if (!(state instanceof AppState.Idle || state instanceof AppState.PreparingRecording)) {
            LOG.debug("Toggle ignored in state {}", state.name());
            return;
        }
        CaptureRegion area = areaSelector.selectArea().orElse(null);
        RecordingSettings settings = stateRepository.settings();
        if (settings.showCountdown() && settings.countdownSeconds() > 0) {
            countdown.begin(area, settings.countdownSeconds());
        } else {
            controller.startRecording(area);
        }
    }

    void cancel() {
        if (!countdown.cancel()) {
            controller.cancelRecording();
        }
    }
}
