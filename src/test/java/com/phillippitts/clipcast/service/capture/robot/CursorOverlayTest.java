package com.phillippitts.clipcast.service.capture.robot;

import org.junit.jupiter.api.Test;

import java.awt.Point;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class CursorOverlayTest {

    private final Rectangle area = new Rectangle(100, 100, 50, 50);

    @Test
    void drawsArrowAtPointerOffset() {
        BufferedImage frame = new BufferedImage(50, 50, BufferedImage.TYPE_INT_RGB);

        boolean drawn = CursorOverlay.draw(frame, area, new Point(110, 110));

        assertThat(drawn).isTrue();
        assertThat(litPixels(frame, 0, 0, 10, 10)).isZero();
        assertThat(litPixels(frame, 8, 8, 16, 24)).isPositive();
    }

    @Test
    void pointerOutsideAreaIsSkipped() {
        BufferedImage frame = new BufferedImage(50, 50, BufferedImage.TYPE_INT_RGB);

        assertThat(CursorOverlay.draw(frame, area, new Point(5, 5))).isFalse();
        assertThat(CursorOverlay.draw(frame, area, null)).isFalse();
        assertThat(litPixels(frame, 0, 0, 50, 50)).isZero();
    }

    private static int litPixels(BufferedImage frame, int x0, int y0, int w, int h) {
        int lit = 0;
        for (int x = x0; x < x0 + w; x++) {
            for (int y = y0; y < y0 + h; y++) {
                if ((frame.getRGB(x, y) & 0xFFFFFF) != 0) {
                    lit++;
                }
            }
        }
        return lit;
    }
}
