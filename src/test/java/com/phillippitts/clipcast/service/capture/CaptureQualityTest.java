package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class CaptureQualityTest {

    @ParameterizedTest
    @CsvSource({"100,92", "45,92", "44,88", "35,88", "30,85", "20,80", "14,75", "1,75"})
    void jpegPercentFollowsSettingsBands(int settings, int expected) {
        assertThat(CaptureQuality.jpegPercent(settings)).isEqualTo(expected);
    }

    @Test
    void compressionIsMonotonicInPercent() {
        float previous = 0f;
        for (int pct = 1; pct <= 100; pct++) {
            float c = CaptureQuality.jpegCompression(pct);
            assertThat(c).isGreaterThanOrEqualTo(previous).isBetween(0.75f, 0.98f);
            previous = c;
        }
    }

    @Test
    void qscaleStaysInFfmpegRange() {
        assertThat(CaptureQuality.ffmpegQscale(100)).isEqualTo(2);
        assertThat(CaptureQuality.ffmpegQscale(80)).isEqualTo(3);
        assertThat(CaptureQuality.ffmpegQscale(1)).isEqualTo(16);
    }

    @Test
    void gifCaptureRateIsCapped() {
        assertThat(CaptureQuality.captureFps(OutputFormat.GIF, 30, 50, false)).isEqualTo(15);
        assertThat(CaptureQuality.captureFps(OutputFormat.GIF, 30, 30, false)).isEqualTo(12);
        assertThat(CaptureQuality.captureFps(OutputFormat.GIF, 30, 10, false)).isEqualTo(10);
        assertThat(CaptureQuality.captureFps(OutputFormat.GIF, 30, 90, true)).isEqualTo(10);
        assertThat(CaptureQuality.captureFps(OutputFormat.GIF, 8, 90, false)).isEqualTo(8);
    }

    @Test
    void videoFormatsKeepRequestedRate() {
        assertThat(CaptureQuality.captureFps(OutputFormat.MP4, 30, 10, true)).isEqualTo(30);
        assertThat(CaptureQuality.captureFps(OutputFormat.WEBP, 90, 50, false)).isEqualTo(60);
    }
}
