package com.phillippitts.clipcast.service.hotkey;

/** What a recording hotkey asks the recording controller to do. */
public enum RecordingAction {
    /** Start when idle, stop when recording. */
    TOGGLE,
    PAUSE,
    CANCEL
}
