package com.phillippitts.clipcast.service.debounce;

/**
 * Action identifiers used as debounce/throttle keys by trigger sources (hotkeys, REST, tray).
 */
public final class DebounceKeys {

    public static final String START_RECORDING = "start_recording";
    public static final String STOP_RECORDING = "stop_recording";
    public static final String TOGGLE_RECORDING = "toggle_recording";
    public static final String PAUSE_RECORDING = "pause_recording";
    public static final String CANCEL_RECORDING = "cancel_recording";
    public static final String COUNTDOWN_START = "countdown_start";
    public static final String COUNTDOWN_CANCEL = "countdown_cancel";
    public static final String AREA_SELECT = "area_select";
    public static final String SETTINGS_OPEN = "settings_open";

    private DebounceKeys() {
    }
}
