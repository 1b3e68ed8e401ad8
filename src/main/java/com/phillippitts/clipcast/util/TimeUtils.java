package com.phillippitts.clipcast.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Time conversions used for process timing and file naming.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    /** Timestamp format for frame directories and output files ({@code yyyyMMdd_HHmmss}). */
    public static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    public static String fileStamp(LocalDateTime time) {
        return FILE_STAMP.format(time);
    }
}
