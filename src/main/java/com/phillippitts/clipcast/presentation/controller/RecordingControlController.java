package com.phillippitts.clipcast.presentation.controller;

import com.phillippitts.clipcast.domain.AppState;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.service.orchestration.RecordingController;
import com.phillippitts.clipcast.service.state.StateRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.BooleanSupplier;

/**
 * Local control surface for the recorder, mirroring what the hotkeys do.
 *
 * <p>Commands answer 202 when the transition was accepted and 409 when the current state
 * does not allow it; the body always carries the state after the call.
 */
@RestController
@RequestMapping("/api/recording")
class RecordingControlController {

    private static final Logger LOG = LogManager.getLogger(RecordingControlController.class);

    private final RecordingController recorder;
    private final StateRepository stateRepository;

    RecordingControlController(RecordingController recorder, StateRepository stateRepository) {
        this.recorder = recorder;
        this.stateRepository = stateRepository;
    }

    @GetMapping("/state")
    ResponseEntity<StateView> state() {
        return ResponseEntity.ok(StateView.of(true, stateRepository.current()));
    }

    /** Starts immediately, without countdown. No body means full screen. */
    @PostMapping("/start")
    ResponseEntity<StateView> start(@RequestBody(required = false) CaptureRegion region) {
        LOG.info("Start requested via API (region={})", region);
        return command(() -> recorder.startRecording(region));
    }

    @PostMapping("/pause")
    ResponseEntity<StateView> pause() {
        return command(recorder::pauseRecording);
    }

    @PostMapping("/stop")
    ResponseEntity<StateView> stop() {
        return command(recorder::stopRecording);
    }

    @PostMapping("/cancel")
    ResponseEntity<StateView> cancel() {
        return command(recorder::cancelRecording);
    }

    @PostMapping("/recover")
    ResponseEntity<StateView> recover() {
        return command(stateRepository::recoverFromError);
    }

    private ResponseEntity<StateView> command(BooleanSupplier action) {
        boolean accepted = action.getAsBoolean();
        HttpStatus status = accepted ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(StateView.of(accepted, stateRepository.current()));
    }

    /**
     * @param accepted whether the command changed anything
     * @param state    variant name of the current state
     * @param snapshot the full state
     */
    record StateView(boolean accepted, String state, AppState snapshot) {
        static StateView of(boolean accepted, AppState current) {
            return new StateView(accepted, current.name(), current);
        }
    }
}
