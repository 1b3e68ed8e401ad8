package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.service.state.StateRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Counts down before a recording starts: publishes the remaining seconds through
 * {@link StateRepository#updateCountdown(Integer)} once per step and calls
 * {@link RecordingController#startRecording(CaptureRegion)} when it reaches zero.
 *
 * <p>If something else moves the state out of {@code PreparingRecording} meanwhile, the
 * countdown stops without starting a recording.
 */
public class RecordingCountdown {

    private static final Logger LOG = LogManager.getLogger(RecordingCountdown.class);

    private final StateRepository stateRepository;
    private final RecordingController controller;
    private final ScheduledExecutorService scheduler;
    private final long stepMs;

    // Guarded by this
    private ScheduledFuture<?> future;
    private int remaining;
    private CaptureRegion area;

    public RecordingCountdown(StateRepository stateRepository, RecordingController controller,
                              ScheduledExecutorService scheduler) {
        this(stateRepository, controller, scheduler, 1000L);
    }

    RecordingCountdown(StateRepository stateRepository, RecordingController controller,
                       ScheduledExecutorService scheduler, long stepMs) {
        this.stateRepository = stateRepository;
        this.controller = controller;
        this.scheduler = scheduler;
        this.stepMs = stepMs;
    }

    /**
     * Starts counting down from {@code seconds}; with zero seconds the recording starts at once.
     *
     * @return false if a countdown is already running or the state does not allow one
     */
    public boolean begin(CaptureRegion area, int seconds) {
        synchronized (this) {
            if (future != null) {
                LOG.debug("Countdown already running; ignoring");
                return false;
            }
            if (seconds > 0) {
                if (!stateRepository.startCountdownRecording(area, seconds)) {
                    return false;
                }
                this.area = area;
                this.remaining = seconds;
                this.future = scheduler.scheduleAtFixedRate(this::step, stepMs, stepMs, TimeUnit.MILLISECONDS);
                LOG.info("Recording starts in {}s", seconds);
                return true;
            }
        }
        return controller.startRecording(area);
    }

    /** @return true if a running countdown was aborted */
    public synchronized boolean cancel() {
        if (future == null) {
            return false;
        }
        finish();
        stateRepository.cancelCountdown();
        LOG.info("Countdown cancelled");
        return true;
    }

    public synchronized boolean isActive() {
        return future != null;
    }

    void step() {
        CaptureRegion target;
        synchronized (this) {
            if (future == null) {
                return;
            }
            remaining--;
            if (remaining > 0) {
                if (!stateRepository.updateCountdown(remaining)) {
                    LOG.debug("Countdown interrupted by a state change");
                    finish();
                }
                return;
            }
            target = area;
            finish();
        }
        controller.startRecording(target);
    }

    // Caller holds this
    private void finish() {
        future.cancel(false);
        future = null;
        area = null;
    }
}
