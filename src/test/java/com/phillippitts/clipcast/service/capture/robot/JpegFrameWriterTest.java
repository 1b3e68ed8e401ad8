package com.phillippitts.clipcast.service.capture.robot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JpegFrameWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesScaledRgbJpegWithoutLeavingPartFile() throws Exception {
        JpegFrameWriter writer = new JpegFrameWriter(92, 0.5);
        Path target = dir.resolve("ffcap_000000.jpg");

        writer.write(new BufferedImage(200, 100, BufferedImage.TYPE_INT_ARGB), target);

        BufferedImage read = ImageIO.read(target.toFile());
        assertThat(read.getWidth()).isEqualTo(100);
        assertThat(read.getHeight()).isEqualTo(50);
        assertThat(Files.exists(dir.resolve("ffcap_000000.jpg.part"))).isFalse();
    }

    @Test
    void tinyFramesKeepTwoPixelMinimum() throws Exception {
        Path target = dir.resolve("f.jpg");

        new JpegFrameWriter(75, 0.1).write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), target);

        assertThat(ImageIO.read(target.toFile()).getWidth()).isEqualTo(2);
    }

    @Test
    void compressionComesFromJpegPercent() {
        assertThat(new JpegFrameWriter(95, 1.0).compression()).isEqualTo(0.98f);
        assertThat(new JpegFrameWriter(10, 1.0).compression()).isEqualTo(0.75f);
    }
}
