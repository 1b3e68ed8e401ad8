package com.phillippitts.clipcast.domain;

/**
 * Rectangle in absolute (virtual desktop) screen coordinates, optionally pinned to a display.
 *
 * @param x         left edge; may be negative on multi-monitor layouts
 * @param y         top edge; may be negative on multi-monitor layouts
 * @param width     positive width
 * @param height    positive height
 * @param displayId platform display identifier, or {@code null} to resolve from the center point
 */
public record CaptureRegion(int x, int y, int width, int height, String displayId) {

    public CaptureRegion {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Capture region must have positive size, got "
                    + width + "x" + height);
        }
    }

    public static CaptureRegion of(int x, int y, int width, int height) {
        return new CaptureRegion(x, y, width, height, null);
    }

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }

    public Dimensions dimensions() {
        return new Dimensions(width, height);
    }

    /**
     * Intersection with another rectangle, or {@code null} when they do not overlap.
     */
    public CaptureRegion intersect(int ox, int oy, int ow, int oh) {
        int left = Math.max(x, ox);
        int top = Math.max(y, oy);
        int right = Math.min(x + width, ox + ow);
        int bottom = Math.min(y + height, oy + oh);
        if (right <= left || bottom <= top) {
            return null;
        }
        return new CaptureRegion(left, top, right - left, bottom - top, displayId);
    }
}
