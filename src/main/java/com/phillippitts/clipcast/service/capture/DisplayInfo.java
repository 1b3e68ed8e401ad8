package com.phillippitts.clipcast.service.capture;

import java.awt.Point;
import java.awt.Rectangle;
import java.util.List;

/**
 * One physical display in virtual-desktop coordinates (logical points).
 *
 * @param index  position in the platform's display list
 * @param bounds logical bounds
 * @param scaleX points to device pixels, horizontally (2.0 on Retina)
 * @param scaleY points to device pixels, vertically
 */
public record DisplayInfo(int index, Rectangle bounds, double scaleX, double scaleY) {

    public DisplayInfo {
        bounds = new Rectangle(bounds);
        scaleX = scaleX > 0 ? scaleX : 1.0;
        scaleY = scaleY > 0 ? scaleY : 1.0;
    }

    public boolean contains(Point p) {
        return p != null && bounds.contains(p);
    }

    /**
     * Display to capture from: the one containing {@code preferred} (region center), else the
     * one under the pointer, else the first.
     */
    public static DisplayInfo pick(List<DisplayInfo> displays, Point preferred, Point pointer) {
        if (displays.isEmpty()) {
            return null;
        }
        if (preferred != null) {
            for (DisplayInfo d : displays) {
                if (d.contains(preferred)) {
                    return d;
                }
            }
        }
        if (pointer != null) {
            for (DisplayInfo d : displays) {
                if (d.contains(pointer)) {
                    return d;
                }
            }
        }
        return displays.get(0);
    }
}
