package com.phillippitts.clipcast.service.capture;

import java.awt.Point;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the screens and the pointer. Keeps backends testable without a display.
 */
public interface DisplayEnvironment {

    /** Attached displays; empty when headless. */
    List<DisplayInfo> displays();

    /** Current pointer position in virtual-desktop coordinates, if it can be read. */
    Optional<Point> pointerLocation();
}
