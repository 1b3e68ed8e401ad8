package com.phillippitts.clipcast.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingSettingsTest {

    @Test
    void clampsOutOfRangeValues() {
        RecordingSettings s = new RecordingSettings(OutputFormat.MP4, 240, 0, 0, 5.0, true, -3, true,
                Path.of("/out"), " ", 0, Path.of("/tmp"), false);

        assertThat(s.defaultFps()).isEqualTo(RecordingSettings.MAX_FPS);
        assertThat(s.defaultQuality()).isEqualTo(1);
        assertThat(s.defaultMaxDurationSeconds()).isEqualTo(1);
        assertThat(s.captureScale()).isEqualTo(1.0);
        assertThat(s.countdownSeconds()).isZero();
        assertThat(s.maxRecentItems()).isEqualTo(1);
        assertThat(s.fileNamingPattern()).isEqualTo("recording_{timestamp}");
    }

    @Test
    void defaultsMatchDocumentedValues() {
        RecordingSettings s = RecordingSettings.defaults();

        assertThat(s.defaultFormat()).isEqualTo(OutputFormat.GIF);
        assertThat(s.defaultFps()).isEqualTo(15);
        assertThat(s.defaultQuality()).isEqualTo(30);
        assertThat(s.defaultMaxDurationSeconds()).isEqualTo(30);
        assertThat(s.showCountdown()).isTrue();
        assertThat(s.countdownSeconds()).isEqualTo(3);
        assertThat(s.maxRecentItems()).isEqualTo(50);
    }

    @Test
    void withersChangeOnlyTheirField() {
        RecordingSettings base = RecordingSettings.defaults();

        RecordingSettings changed = base.withDefaultFormat(OutputFormat.WEBP).withDefaultQuality(80);

        assertThat(changed.defaultFormat()).isEqualTo(OutputFormat.WEBP);
        assertThat(changed.defaultQuality()).isEqualTo(80);
        assertThat(changed.defaultFps()).isEqualTo(base.defaultFps());
        assertThat(changed.saveLocation()).isEqualTo(base.saveLocation());
    }

    @Test
    void formatParseIsLenient() {
        assertThat(OutputFormat.parse(" webp ")).isEqualTo(OutputFormat.WEBP);
        assertThat(OutputFormat.MP4.extension()).isEqualTo("mp4");
    }
}
