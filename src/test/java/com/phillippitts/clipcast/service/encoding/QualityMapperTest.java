package com.phillippitts.clipcast.service.encoding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QualityMapperTest {

    @Test
    void webpQualityTiers() {
        assertThat(QualityMapper.webpQuality(100)).isEqualTo(75);
        assertThat(QualityMapper.webpQuality(35)).isEqualTo(60);
        assertThat(QualityMapper.webpQuality(30)).isEqualTo(45);
        assertThat(QualityMapper.webpQuality(15)).isEqualTo(30);
        assertThat(QualityMapper.webpQuality(10)).isEqualTo(20);
        assertThat(QualityMapper.webpQuality(1)).isEqualTo(10);
    }

    @Test
    void mp4CrfDecreasesWithQuality() {
        assertThat(QualityMapper.mp4Crf(50)).isZero();
        assertThat(QualityMapper.mp4Crf(30)).isEqualTo(18);
        assertThat(QualityMapper.mp4Crf(20)).isEqualTo(23);
        assertThat(QualityMapper.mp4Crf(5)).isEqualTo(35);
    }

    @Test
    void gifQualityTiers() {
        assertThat(QualityMapper.gifQuality(40)).isEqualTo(80);
        assertThat(QualityMapper.gifQuality(30)).isEqualTo(60);
        assertThat(QualityMapper.gifQuality(15)).isEqualTo(40);
        assertThat(QualityMapper.gifQuality(1)).isEqualTo(25);
    }

    @Test
    void effectiveFpsReplaysRealDuration() {
        assertThat(QualityMapper.effectiveFps(30, 3000, 15)).isEqualTo(10);
        assertThat(QualityMapper.effectiveFps(1000, 1000, 15)).isEqualTo(60);
        assertThat(QualityMapper.effectiveFps(1, 10_000, 15)).isEqualTo(1);
    }

    @Test
    void effectiveFpsFallsBackToTargetWithoutDuration() {
        assertThat(QualityMapper.effectiveFps(30, 0, 15)).isEqualTo(15);
        assertThat(QualityMapper.effectiveFps(0, 1000, 90)).isEqualTo(60);
    }

    @Test
    void gifParametersPerTier() {
        assertThat(GifParameters.forQuality(80, true).tier()).isEqualTo(GifParameters.Tier.FAST);
        assertThat(GifParameters.forQuality(25, false).maxColors()).isEqualTo(64);
        assertThat(GifParameters.forQuality(60, false).dither()).isEqualTo("sierra2_4a");

        GifParameters high = GifParameters.forQuality(80, false);
        assertThat(high.tier()).isEqualTo(GifParameters.Tier.HIGH);
        assertThat(high.scale()).isEqualTo(1.0);
        assertThat(high.fps(30)).isEqualTo(15);
        assertThat(high.fps(8)).isEqualTo(8);
    }
}
