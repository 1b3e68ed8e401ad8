package com.phillippitts.clipcast.service.encoding;

/**
 * Maps the settings quality (1..100) onto each encoder's native scale.
 */
public final class QualityMapper {

    private QualityMapper() {
    }

    /** libwebp {@code -quality} (0..100). */
    public static int webpQuality(int settingsQuality) {
        if (settingsQuality >= 45) {
            return 75;
        }
        if (settingsQuality >= 35) {
            return 60;
        }
        if (settingsQuality >= 25) {
            return 45;
        }
        if (settingsQuality >= 15) {
            return 30;
        }
        if (settingsQuality >= 10) {
            return 20;
        }
        return 10;
    }

    /** Quality handed to {@link GifParameters#forQuality(int, boolean)}. */
    public static int gifQuality(int settingsQuality) {
        if (settingsQuality >= 40) {
            return 80;
        }
        if (settingsQuality >= 25) {
            return 60;
        }
        if (settingsQuality >= 15) {
            return 40;
        }
        return 25;
    }

    /** libx264 CRF; lower is better. 0 is clamped to 1 by the MP4 argument builder. */
    public static int mp4Crf(int settingsQuality) {
        int[][] table = {{50, 0}, {45, 5}, {40, 10}, {35, 14}, {30, 18}, {25, 20}, {20, 23}, {15, 26}, {10, 30}};
        for (int[] row : table) {
            if (settingsQuality >= row[0]) {
                return row[1];
            }
        }
        return 35;
    }

    /**
     * Frame rate that replays {@code frames} in {@code durationMs}, clamped to 1..60. Falls back
     * to {@code targetFps} when the duration is unknown.
     */
    public static int effectiveFps(int frames, long durationMs, int targetFps) {
        if (durationMs <= 0 || frames <= 0) {
            return Math.max(1, Math.min(60, targetFps));
        }
        int fps = (int) (frames * 1000.0 / durationMs);
        return Math.max(1, Math.min(60, fps));
    }
}
