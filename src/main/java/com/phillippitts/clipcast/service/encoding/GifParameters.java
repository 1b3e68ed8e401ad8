package com.phillippitts.clipcast.service.encoding;

/**
 * GIF encode knobs derived from a quality tier.
 *
 * @param tier      chosen tier
 * @param fpsCap    upper bound for the output frame rate
 * @param scale     output scale relative to the frames
 * @param maxColors palette size
 * @param dither    ffmpeg {@code paletteuse} dither expression
 */
public record GifParameters(Tier tier, int fpsCap, double scale, int maxColors, String dither) {

    public enum Tier { FAST, LOW, MID, HIGH }

    /**
     * @param gifQuality encoder quality, see {@link QualityMapper#gifQuality(int)}; &le;30 low,
     *                   31..60 mid, above high
     * @param fastMode   forces the fast tier
     */
    public static GifParameters forQuality(int gifQuality, boolean fastMode) {
        if (fastMode) {
            return new GifParameters(Tier.FAST, 10, 0.5, 64, "bayer:bayer_scale=5");
        }
        if (gifQuality <= 30) {
            return new GifParameters(Tier.LOW, 10, 0.6, 64, "bayer:bayer_scale=5");
        }
        if (gifQuality <= 60) {
            return new GifParameters(Tier.MID, 12, 0.75, 128, "sierra2_4a");
        }
        return new GifParameters(Tier.HIGH, 15, 1.0, 256, "floyd_steinberg");
    }

    public int fps(int requested) {
        return Math.max(1, Math.min(requested, fpsCap));
    }
}
