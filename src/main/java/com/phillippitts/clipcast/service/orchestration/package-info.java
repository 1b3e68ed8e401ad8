/**
 * Recording session orchestration: from a start trigger to a finished media file.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.clipcast.service.orchestration.DefaultRecordingOrchestrator} -
 *       runs capture, supervises backends, hands frames to the encoder</li>
 *   <li>{@link com.phillippitts.clipcast.service.orchestration.RecordingCountdown} - optional
 *       countdown before capture starts</li>
 *   <li>{@link com.phillippitts.clipcast.service.orchestration.RecordingTriggerListener} -
 *       maps hotkey events to controller calls through the debounce manager</li>
 * </ul>
 *
 * <p>Workflow: HotkeyManager → RecordingHotkeyEvent → RecordingTriggerListener →
 * RecordingController → StateRepository transitions and RecordingStarted/Completed/Failed events.
 */
package com.phillippitts.clipcast.service.orchestration;
