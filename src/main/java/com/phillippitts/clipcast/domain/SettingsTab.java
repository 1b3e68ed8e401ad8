package com.phillippitts.clipcast.domain;

/** Section of the settings screen that is currently open. */
public enum SettingsTab {
    GENERAL,
    RECORDING,
    OUTPUT,
    SHORTCUTS,
    ADVANCED
}
