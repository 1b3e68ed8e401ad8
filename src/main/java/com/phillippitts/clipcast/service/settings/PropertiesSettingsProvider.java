package com.phillippitts.clipcast.service.settings;

import com.phillippitts.clipcast.config.properties.RecordingProperties;
import com.phillippitts.clipcast.domain.RecordingSettings;

import java.util.Objects;

/**
 * Reads the initial settings from {@code clipcast.recording.*}.
 */
public class PropertiesSettingsProvider implements SettingsProvider {

    private final RecordingProperties properties;

    public PropertiesSettingsProvider(RecordingProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public RecordingSettings load() {
        return properties.toSettings();
    }
}
