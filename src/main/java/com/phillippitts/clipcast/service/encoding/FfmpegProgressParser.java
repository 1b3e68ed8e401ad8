package com.phillippitts.clipcast.service.encoding;

import java.util.function.IntConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns ffmpeg {@code frame=  N} status lines into percentages within {@code [base, base+span]}
 * and forwards only strictly increasing values.
 */
final class FfmpegProgressParser {

    private static final Pattern FRAME = Pattern.compile("frame=\\s*(\\d+)");

    private final int totalFrames;
    private final int base;
    private final int span;
    private final IntConsumer sink;
    private int last;

    /**
     * @param base percentage already reported before this pass (0, or 30 after the palette pass)
     * @param span percentage points this pass may add on top of {@code base}
     */
    FfmpegProgressParser(int totalFrames, int base, int span, IntConsumer sink) {
        this.totalFrames = totalFrames;
        this.base = base;
        this.span = span;
        this.sink = sink;
        this.last = base;
    }

    void accept(String line) {
        Matcher m = FRAME.matcher(line);
        if (!m.find()) {
            return;
        }
        long frame;
        try {
            frame = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return;
        }
        int progress = percentFor(frame);
        synchronized (this) {
            if (progress <= last) {
                return;
            }
            last = progress;
            sink.accept(progress);
        }
    }

    /** Stops forwarding; late status lines from a still-draining reader are dropped. */
    synchronized void finish() {
        last = Integer.MAX_VALUE;
    }

    int percentFor(long frame) {
        if (totalFrames <= 0) {
            return base;
        }
        long added = Math.max(0, Math.min(span, frame * span / totalFrames));
        return (int) Math.max(0, Math.min(100, base + added));
    }

    synchronized int last() {
        return last;
    }
}
