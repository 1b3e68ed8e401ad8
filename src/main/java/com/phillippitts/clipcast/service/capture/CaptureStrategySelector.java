package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.CaptureMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Orders capture methods for a platform. Pure function of its inputs.
 *
 * <p>Base priority: ScreenCaptureKit (macOS only), then Robot, then ffmpeg. Methods the availability check
 * reported unavailable are dropped. A concrete preferred method that survives the filter is
 * moved to the front.
 */
public final class CaptureStrategySelector {

    private CaptureStrategySelector() {
    }

    public static List<CaptureMethod> order(Platform platform, Set<CaptureMethod> available,
                                            CaptureMethod preferred) {
        List<CaptureMethod> base = new ArrayList<>(3);
        if (platform == Platform.MAC) {
            base.add(CaptureMethod.SCREEN_CAPTURE_KIT);
        }
        base.add(CaptureMethod.ROBOT_API);
        if (platform != Platform.OTHER) {
            base.add(CaptureMethod.FFMPEG);
        }

        List<CaptureMethod> ordered = new ArrayList<>(base.size());
        for (CaptureMethod m : base) {
            if (available.contains(m)) {
                ordered.add(m);
            }
        }
        if (preferred != null && preferred != CaptureMethod.AUTO && ordered.remove(preferred)) {
            ordered.add(0, preferred);
        }
        return List.copyOf(ordered);
    }
}
