package com.phillippitts.clipcast.service.capture.sck;

import java.util.function.IntConsumer;

/**
 * Calls into the ScreenCaptureKit bridge library. The native side encodes each frame as a JPEG
 * named {@code ffcap_%06d.jpg} (from index 0) and then reports its index.
 */
public interface NativeCaptureBridge {

    /** Display not found. */
    int RC_DISPLAY_NOT_FOUND = -2;
    /** The stream service listed no displays at all. */
    int RC_NO_DISPLAYS = -4;

    /**
     * Starts a display stream. Pass x=-1, y=-1, w=0, h=0 to capture the whole display.
     *
     * @param onFrame called on a native thread with the index of each written frame
     * @return 0 on success, a negative native code otherwise
     */
    int startDisplayCapture(int displayId, int fps, int x, int y, int w, int h, String outputDir,
                            int jpegQuality, float scale, IntConsumer onFrame);

    void stopCapture();

    /** JSON describing the displays ({@code id}, {@code width}, {@code height}), or null. */
    String listDisplaysJson();
}
