package com.phillippitts.clipcast.service.capture.sck;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.CaptureQuality;
import com.phillippitts.clipcast.service.capture.CaptureRequest;
import com.phillippitts.clipcast.service.capture.DisplayEnvironment;
import com.phillippitts.clipcast.service.capture.DisplayInfo;
import com.phillippitts.clipcast.service.capture.Platform;
import com.phillippitts.clipcast.service.capture.ScreenCaptureStrategy;
import com.phillippitts.clipcast.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.awt.Rectangle;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * macOS capture backend streaming a display through ScreenCaptureKit. The native bridge writes
 * the JPEGs itself; this class only picks the display and tracks progress.
 */
public final class ScreenCaptureKitStrategy implements ScreenCaptureStrategy {

    private static final Logger LOG = LogManager.getLogger(ScreenCaptureKitStrategy.class);

    /** Native display id (CGDirectDisplayID) with its pixel size. */
    record NativeDisplay(int id, int width, int height) { }

    private final Supplier<Optional<NativeCaptureBridge>> bridgeSupplier;
    private final DisplayEnvironment display;
    private final Platform platform;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger lastFrameIndex = new AtomicInteger(-1);

    private volatile NativeCaptureBridge bridge;
    private boolean bridgeResolved;

    public ScreenCaptureKitStrategy(Supplier<Optional<NativeCaptureBridge>> bridgeSupplier,
                                    DisplayEnvironment display, Platform platform) {
        this.bridgeSupplier = Objects.requireNonNull(bridgeSupplier, "bridgeSupplier");
        this.display = Objects.requireNonNull(display, "display");
        this.platform = Objects.requireNonNull(platform, "platform");
    }

    @Override
    public String name() {
        return "screencapturekit";
    }

    @Override
    public CaptureMethod method() {
        return CaptureMethod.SCREEN_CAPTURE_KIT;
    }

    @Override
    public boolean isAvailable() {
        return platform == Platform.MAC && bridge().isPresent();
    }

    private synchronized Optional<NativeCaptureBridge> bridge() {
        if (!bridgeResolved) {
            bridgeResolved = true;
            bridge = bridgeSupplier.get().orElse(null);
        }
        return Optional.ofNullable(bridge);
    }

    @Override
    public synchronized void start(CaptureRequest request) {
        if (platform != Platform.MAC) {
            throw CaptureException.unavailable(name(), "ScreenCaptureKit is macOS-only");
        }
        NativeCaptureBridge b = bridge()
                .orElseThrow(() -> CaptureException.unavailable(name(), "Native bridge not loaded"));
        if (running.get()) {
            throw CaptureException.startFailed(name(), "Capture already running", null);
        }
        if (request.startIndex() > 0) {
            // The bridge always numbers from 0
            throw CaptureException.unavailable(name(), "Cannot continue an existing frame sequence");
        }
        try {
            Files.createDirectories(request.outputDir());
        } catch (IOException e) {
            throw CaptureException.startFailed(name(), "Cannot create " + request.outputDir(), e);
        }

        CaptureRegion r = request.region();
        int x = r == null ? -1 : r.x();
        int y = r == null ? -1 : r.y();
        int w = r == null ? 0 : r.width();
        int h = r == null ? 0 : r.height();
        int fps = Math.min(request.fps(), CaptureQuality.NATIVE_STREAM_MAX_FPS);
        String outDir = request.outputDir().toAbsolutePath().toString();

        lastFrameIndex.set(-1);
        int displayId = pickDisplayId(b, r);
        int rc = b.startDisplayCapture(displayId, fps, x, y, w, h, outDir, request.jpegQuality(),
                (float) request.scale(), this::onFrame);
        if (rc == NativeCaptureBridge.RC_DISPLAY_NOT_FOUND || rc == NativeCaptureBridge.RC_NO_DISPLAYS) {
            int fallbackId = pickDisplayId(b, null);
            LOG.info("ScreenCaptureKit start rc={} on display {}; retrying with display {}", rc, displayId, fallbackId);
            if (fallbackId != 0) {
                displayId = fallbackId;
                rc = b.startDisplayCapture(displayId, fps, x, y, w, h, outDir, request.jpegQuality(),
                        (float) request.scale(), this::onFrame);
            }
        }
        if (rc != 0) {
            throw CaptureException.startFailed(name(), rc, "ScreenCaptureKit refused to start");
        }
        running.set(true);
        LOG.info("ScreenCaptureKit capture started on display {} at {} fps", displayId, fps);
    }

    private void onFrame(int frameIndex) {
        lastFrameIndex.set(frameIndex);
        if (frameIndex % 10 == 0) {
            LOG.debug("ScreenCaptureKit wrote frame {}", frameIndex);
        }
    }

    /**
     * Display whose pixel size is closest to the region (or the screen under the pointer).
     * Returns 0 when the bridge lists nothing usable.
     */
    int pickDisplayId(NativeCaptureBridge b, CaptureRegion region) {
        List<NativeDisplay> displays = parseDisplays(b.listDisplaysJson());
        if (displays.isEmpty()) {
            return 0;
        }
        Rectangle target;
        if (region != null) {
            target = new Rectangle(region.x(), region.y(), region.width(), region.height());
        } else {
            DisplayInfo d = DisplayInfo.pick(display.displays(), null, display.pointerLocation().orElse(null));
            target = d == null ? null : d.bounds();
        }
        if (target == null) {
            return displays.get(0).id();
        }
        NativeDisplay best = displays.get(0);
        int bestScore = Integer.MAX_VALUE;
        for (NativeDisplay d : displays) {
            int score = Math.abs(d.width() - target.width) + Math.abs(d.height() - target.height);
            if (score < bestScore) {
                bestScore = score;
                best = d;
            }
        }
        return best.id();
    }

    /** Accepts a bare array or an object with a {@code displays} array; malformed entries are skipped. */
    static List<NativeDisplay> parseDisplays(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JSONArray arr;
        try {
            String trimmed = json.trim();
            arr = trimmed.startsWith("[") ? new JSONArray(trimmed) : new JSONObject(trimmed).optJSONArray("displays");
        } catch (JSONException e) {
            LOG.debug("Unparseable display list '{}': {}", LogSanitizer.truncate(json, 256), e.getMessage());
            return List.of();
        }
        if (arr == null) {
            return List.of();
        }
        List<NativeDisplay> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject o = arr.optJSONObject(i);
            if (o != null && o.has("id") && o.has("width") && o.has("height")) {
                out.add(new NativeDisplay(o.optInt("id"), o.optInt("width"), o.optInt("height")));
            }
        }
        return out;
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        NativeCaptureBridge b = bridge;
        if (b != null) {
            try {
                b.stopCapture();
            } catch (RuntimeException | LinkageError e) {
                LOG.warn("ScreenCaptureKit stop failed: {}", e.toString());
            }
        }
        LOG.info("ScreenCaptureKit capture stopped after frame {}", lastFrameIndex.get());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
