package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.CaptureMethod;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static com.phillippitts.clipcast.domain.CaptureMethod.FFMPEG;
import static com.phillippitts.clipcast.domain.CaptureMethod.ROBOT_API;
import static com.phillippitts.clipcast.domain.CaptureMethod.SCREEN_CAPTURE_KIT;
import static org.assertj.core.api.Assertions.assertThat;

class CaptureStrategySelectorTest {

    private static final Set<CaptureMethod> ALL = EnumSet.of(SCREEN_CAPTURE_KIT, ROBOT_API, FFMPEG);

    @Test
    void macPrefersNativeThenRobotThenFfmpeg() {
        assertThat(CaptureStrategySelector.order(Platform.MAC, ALL, CaptureMethod.AUTO))
                .containsExactly(SCREEN_CAPTURE_KIT, ROBOT_API, FFMPEG);
    }

    @Test
    void nativeBackendIsNeverOfferedOffMac() {
        assertThat(CaptureStrategySelector.order(Platform.LINUX, ALL, CaptureMethod.AUTO))
                .containsExactly(ROBOT_API, FFMPEG);
        assertThat(CaptureStrategySelector.order(Platform.WINDOWS, ALL, SCREEN_CAPTURE_KIT))
                .containsExactly(ROBOT_API, FFMPEG);
    }

    @Test
    void unknownPlatformOnlyGetsRobot() {
        assertThat(CaptureStrategySelector.order(Platform.OTHER, ALL, FFMPEG)).containsExactly(ROBOT_API);
    }

    @Test
    void unavailableMethodsAreDropped() {
        assertThat(CaptureStrategySelector.order(Platform.MAC, EnumSet.of(FFMPEG), CaptureMethod.AUTO))
                .containsExactly(FFMPEG);
        assertThat(CaptureStrategySelector.order(Platform.MAC, EnumSet.noneOf(CaptureMethod.class), null))
                .isEmpty();
    }

    @Test
    void preferredMethodMovesToFront() {
        assertThat(CaptureStrategySelector.order(Platform.MAC, ALL, FFMPEG))
                .containsExactly(FFMPEG, SCREEN_CAPTURE_KIT, ROBOT_API);
    }

    @Test
    void preferredButUnavailableMethodIsIgnored() {
        assertThat(CaptureStrategySelector.order(Platform.MAC, EnumSet.of(ROBOT_API, FFMPEG), SCREEN_CAPTURE_KIT))
                .containsExactly(ROBOT_API, FFMPEG);
    }
}
