package com.phillippitts.clipcast.service.settings;

import com.phillippitts.clipcast.domain.RecordingSettings;

/**
 * Supplies the settings the application starts with. Runtime changes go through
 * {@link com.phillippitts.clipcast.service.state.StateRepository#applySettings()}.
 */
@FunctionalInterface
public interface SettingsProvider {

    RecordingSettings load();
}
