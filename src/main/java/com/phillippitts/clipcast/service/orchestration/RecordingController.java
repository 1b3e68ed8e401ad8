package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.domain.CaptureRegion;

/**
 * The four user-facing recording commands.
 *
 * <p><b>Thread Safety:</b> implementations accept calls from any thread, in any application
 * state. A call that does not fit the current state is a logged no-op returning {@code false};
 * duplicate stop presses and similar UI races are expected.
 */
public interface RecordingController {

    /**
     * Starts capturing with the current settings.
     *
     * @param area rectangle to record, {@code null} for the full screen
     * @return {@code true} if a session started; {@code false} if one is already recording or
     *         encoding, or if no capture backend could start (the state then shows the error)
     */
    boolean startRecording(CaptureRegion area);

    /** Toggles pause. Paused time does not count towards the recorded duration. */
    boolean pauseRecording();

    /**
     * Stops capture and hands the frames to the encoder. Returns once capture has fully
     * stopped; encoding continues in the background.
     */
    boolean stopRecording();

    /** Stops capture and discards the frames without producing a media file. */
    boolean cancelRecording();

    boolean isRecording();
}
