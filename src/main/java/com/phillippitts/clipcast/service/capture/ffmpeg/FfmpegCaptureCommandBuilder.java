package com.phillippitts.clipcast.service.capture.ffmpeg;

import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.CaptureQuality;
import com.phillippitts.clipcast.service.capture.CaptureRequest;
import com.phillippitts.clipcast.service.capture.DisplayInfo;
import com.phillippitts.clipcast.service.capture.FrameSequence;
import com.phillippitts.clipcast.service.capture.Platform;

import java.awt.Rectangle;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the ffmpeg screen-grab command line for each platform's input device.
 *
 * <pre>
 * macOS:   -f avfoundation -capture_cursor 1 -framerate F -i "N:none"   + crop in device pixels
 * Windows: -f gdigrab -draw_mouse 1 -framerate F [-offset_x X -offset_y Y -video_size WxH] -i desktop
 * Linux:   -f x11grab -framerate F -draw_mouse 1 -video_size WxH -i $DISPLAY+X,Y
 * </pre>
 * followed by {@code -vf [crop,]scale=iw*s:ih*s,fps=F -vsync cfr -q:v Q -start_number N -f image2 dir/ffcap_%06d.jpg}.
 */
final class FfmpegCaptureCommandBuilder {

    private FfmpegCaptureCommandBuilder() {
    }

    /**
     * @param display    display to grab from; required on macOS, and on Linux when there is no region
     * @param x11Display value of {@code $DISPLAY}; {@code :0.0} when null
     */
    static List<String> build(Path ffmpeg, Platform platform, CaptureRequest request, DisplayInfo display,
                              String x11Display) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpeg.toString());
        cmd.add("-hide_banner");
        cmd.add("-loglevel");
        cmd.add("warning");
        cmd.add("-y");

        String crop = null;
        switch (platform) {
            case MAC -> crop = macInput(cmd, request, display);
            case WINDOWS -> windowsInput(cmd, request);
            case LINUX -> linuxInput(cmd, request, display, x11Display);
            default -> throw CaptureException.unavailable("ffmpeg", "No screen grabber for " + platform);
        }

        StringBuilder vf = new StringBuilder();
        if (crop != null) {
            vf.append(crop).append(',');
        }
        vf.append("scale=iw*").append(fmt(request.scale())).append(":ih*").append(fmt(request.scale()));
        vf.append(",fps=").append(request.fps());

        cmd.add("-vf");
        cmd.add(vf.toString());
        cmd.add("-vsync");
        cmd.add("cfr");
        cmd.add("-q:v");
        cmd.add(String.valueOf(CaptureQuality.ffmpegQscale(request.jpegQuality())));
        cmd.add("-start_number");
        cmd.add(String.valueOf(request.startIndex()));
        cmd.add("-f");
        cmd.add("image2");
        cmd.add(request.outputDir().resolve(FrameSequence.FFMPEG_PATTERN).toString());
        return cmd;
    }

    private static String macInput(List<String> cmd, CaptureRequest request, DisplayInfo display) {
        if (display == null) {
            throw CaptureException.unavailable("ffmpeg", "No display found for avfoundation");
        }
        cmd.add("-f");
        cmd.add("avfoundation");
        cmd.add("-capture_cursor");
        cmd.add(request.captureCursor() ? "1" : "0");
        cmd.add("-framerate");
        cmd.add(String.valueOf(request.fps()));
        cmd.add("-i");
        // avfoundation lists cameras first; screens follow
        cmd.add((display.index() + 1) + ":none");

        CaptureRegion region = request.region();
        if (region == null) {
            return null;
        }
        Rectangle b = display.bounds();
        CaptureRegion visible = region.intersect(b.x, b.y, b.width, b.height);
        if (visible == null) {
            throw CaptureException.unavailable("ffmpeg", "Region lies outside display " + display.index());
        }
        int x = (int) Math.round((visible.x() - b.x) * display.scaleX());
        int y = (int) Math.round((visible.y() - b.y) * display.scaleY());
        int w = Math.max(2, (int) Math.round(visible.width() * display.scaleX()));
        int h = Math.max(2, (int) Math.round(visible.height() * display.scaleY()));
        return "crop=" + w + ":" + h + ":" + x + ":" + y;
    }

    private static void windowsInput(List<String> cmd, CaptureRequest request) {
        cmd.add("-f");
        cmd.add("gdigrab");
        cmd.add("-draw_mouse");
        cmd.add(request.captureCursor() ? "1" : "0");
        cmd.add("-framerate");
        cmd.add(String.valueOf(request.fps()));
        CaptureRegion r = request.region();
        if (r != null) {
            cmd.add("-offset_x");
            cmd.add(String.valueOf(r.x()));
            cmd.add("-offset_y");
            cmd.add(String.valueOf(r.y()));
            cmd.add("-video_size");
            cmd.add(r.width() + "x" + r.height());
        }
        cmd.add("-i");
        cmd.add("desktop");
    }

    private static void linuxInput(List<String> cmd, CaptureRequest request, DisplayInfo display, String x11Display) {
        Rectangle area;
        CaptureRegion r = request.region();
        if (r != null) {
            area = new Rectangle(r.x(), r.y(), r.width(), r.height());
        } else if (display != null) {
            area = display.bounds();
        } else {
            throw CaptureException.unavailable("ffmpeg", "No region and no display bounds for x11grab");
        }
        String dpy = x11Display == null || x11Display.isBlank() ? ":0.0" : x11Display;
        cmd.add("-f");
        cmd.add("x11grab");
        cmd.add("-framerate");
        cmd.add(String.valueOf(request.fps()));
        cmd.add("-draw_mouse");
        cmd.add(request.captureCursor() ? "1" : "0");
        cmd.add("-video_size");
        cmd.add(area.width + "x" + area.height);
        cmd.add("-i");
        cmd.add(dpy + "+" + area.x + "," + area.y);
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }
}
