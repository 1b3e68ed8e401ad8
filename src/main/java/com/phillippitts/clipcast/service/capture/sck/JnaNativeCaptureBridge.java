package com.phillippitts.clipcast.service.capture.sck;

import com.sun.jna.Callback;
import com.sun.jna.Library;
import com.sun.jna.Native;
import com.sun.jna.Pointer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.IntConsumer;

/**
 * {@link NativeCaptureBridge} over JNA. The active callback is kept in a field: JNA only holds
 * a weak reference, and a collected callback crashes the native stream.
 */
public final class JnaNativeCaptureBridge implements NativeCaptureBridge {

    private static final Logger LOG = LogManager.getLogger(JnaNativeCaptureBridge.class);

    /** Exported C symbols of the bridge dylib. */
    public interface SckLibrary extends Library {

        interface FrameCallback extends Callback {
            void invoke(int frameIndex, Pointer user);
        }

        int sck_start_display_capture(int displayId, int fps, int x, int y, int w, int h, String outputDir,
                                      int jpegQuality, float scale, FrameCallback cb, Pointer user);

        void sck_stop_capture();

        Pointer sck_list_displays_json();
    }

    private final SckLibrary library;
    private volatile SckLibrary.FrameCallback activeCallback;

    JnaNativeCaptureBridge(SckLibrary library) {
        this.library = library;
    }

    /**
     * Loads the bridge through {@code loader}; empty on non-macOS hosts or when loading fails.
     */
    public static Optional<NativeCaptureBridge> load(NativeLibraryLoader loader) {
        Optional<Path> path = loader.load();
        if (path.isEmpty()) {
            return Optional.empty();
        }
        try {
            SckLibrary lib = Native.load(path.get().toString(), SckLibrary.class);
            return Optional.of(new JnaNativeCaptureBridge(lib));
        } catch (UnsatisfiedLinkError e) {
            LOG.warn("ScreenCaptureKit bridge symbols not found: {}", e.toString());
            return Optional.empty();
        }
    }

    @Override
    public int startDisplayCapture(int displayId, int fps, int x, int y, int w, int h, String outputDir,
                                   int jpegQuality, float scale, IntConsumer onFrame) {
        SckLibrary.FrameCallback cb = new SckLibrary.FrameCallback() {
            @Override
            public void invoke(int frameIndex, Pointer user) {
                try {
                    onFrame.accept(frameIndex);
                } catch (RuntimeException e) {
                    // Never let an exception unwind into native code
                    LOG.warn("Frame callback failed: {}", e.toString());
                }
            }
        };
        activeCallback = cb;
        return library.sck_start_display_capture(displayId, fps, x, y, w, h, outputDir, jpegQuality, scale, cb, null);
    }

    @Override
    public void stopCapture() {
        library.sck_stop_capture();
        activeCallback = null;
    }

    @Override
    public String listDisplaysJson() {
        Pointer p = library.sck_list_displays_json();
        return p == null ? null : p.getString(0);
    }
}
