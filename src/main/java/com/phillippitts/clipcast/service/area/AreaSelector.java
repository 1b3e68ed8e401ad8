package com.phillippitts.clipcast.service.area;

import com.phillippitts.clipcast.domain.CaptureRegion;

import java.util.Optional;

/**
 * Asks the user which part of the screen to record.
 */
@FunctionalInterface
public interface AreaSelector {

    /** @return the chosen rectangle, or empty for the full screen */
    Optional<CaptureRegion> selectArea();
}
