package com.phillippitts.clipcast.service.area;

import com.phillippitts.clipcast.domain.CaptureRegion;

import java.util.Optional;

/** Selector used when no selection UI is attached: always records the whole screen. */
public class FullScreenAreaSelector implements AreaSelector {

    @Override
    public Optional<CaptureRegion> selectArea() {
        return Optional.empty();
    }
}
