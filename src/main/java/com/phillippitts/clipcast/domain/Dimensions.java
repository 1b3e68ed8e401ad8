package com.phillippitts.clipcast.domain;

/**
 * Pixel size of a capture or media file.
 *
 * @param width  width in pixels (positive)
 * @param height height in pixels (positive)
 */
public record Dimensions(int width, int height) {

    public Dimensions {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive, got " + width + "x" + height);
        }
    }

    /**
     * Returns a copy whose sides are even, decrementing odd sides by one (H.264 needs even sizes).
     * Sides of 1 pixel are kept as 2.
     */
    public Dimensions evenSized() {
        int w = width % 2 == 0 ? width : Math.max(2, width - 1);
        int h = height % 2 == 0 ? height : Math.max(2, height - 1);
        return new Dimensions(w, h);
    }

    public Dimensions scaled(double factor) {
        return new Dimensions(Math.max(1, (int) Math.round(width * factor)),
                Math.max(1, (int) Math.round(height * factor)));
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
