package com.phillippitts.clipcast.service.capture.robot;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Point;
import java.awt.Polygon;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Draws an arrow pointer into grabbed frames; {@link java.awt.Robot} captures never include it.
 */
final class CursorOverlay {

    private static final int[] XS = {0, 0, 4, 8, 10, 6, 12};
    private static final int[] YS = {0, 16, 12, 20, 18, 10, 10};

    private CursorOverlay() {
    }

    /**
     * @return true if the pointer was inside {@code area} and got drawn
     */
    static boolean draw(BufferedImage frame, Rectangle area, Point pointer) {
        if (pointer == null || !area.contains(pointer)) {
            return false;
        }
        double sx = frame.getWidth() / (double) area.width;
        double sy = frame.getHeight() / (double) area.height;
        int ox = (int) Math.round((pointer.x - area.x) * sx);
        int oy = (int) Math.round((pointer.y - area.y) * sy);

        Polygon arrow = new Polygon();
        for (int i = 0; i < XS.length; i++) {
            arrow.addPoint(ox + (int) Math.round(XS[i] * sx), oy + (int) Math.round(YS[i] * sy));
        }
        Graphics2D g = frame.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillPolygon(arrow);
            g.setColor(Color.WHITE);
            g.setStroke(new BasicStroke((float) Math.max(1.0, sx)));
            g.drawPolygon(arrow);
        } finally {
            g.dispose();
        }
        return true;
    }
}
