package com.phillippitts.clipcast.service.health;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.service.capture.CaptureStrategyChain;
import com.phillippitts.clipcast.service.capture.Platform;
import com.phillippitts.clipcast.testutil.EventCapturingPublisher;
import com.phillippitts.clipcast.testutil.FakeCaptureStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CaptureHealthIndicatorTest {

    @Test
    void listsUsableBackends() {
        FakeCaptureStrategy robot = new FakeCaptureStrategy("robot", CaptureMethod.ROBOT_API);
        FakeCaptureStrategy sck = new FakeCaptureStrategy("sck", CaptureMethod.SCREEN_CAPTURE_KIT).unavailable();
        CaptureStrategyChain chain = new CaptureStrategyChain(List.of(robot, sck), Platform.MAC,
                CaptureMethod.AUTO, new EventCapturingPublisher());

        Health health = new CaptureHealthIndicator(chain).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("backends")).isEqualTo(List.of("robot"));
    }

    @Test
    void downWhenNothingCanCapture() {
        FakeCaptureStrategy robot = new FakeCaptureStrategy("robot", CaptureMethod.ROBOT_API).unavailable();
        CaptureStrategyChain chain = new CaptureStrategyChain(List.of(robot), Platform.LINUX,
                CaptureMethod.AUTO, new EventCapturingPublisher());

        Health health = new CaptureHealthIndicator(chain).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("backends")).isEqualTo(List.of());
    }
}
