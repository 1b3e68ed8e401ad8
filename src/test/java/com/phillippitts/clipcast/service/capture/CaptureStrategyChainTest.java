package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.event.CaptureFallbackEvent;
import com.phillippitts.clipcast.testutil.EventCapturingPublisher;
import com.phillippitts.clipcast.testutil.FakeCaptureStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaptureStrategyChainTest {

    @TempDir
    Path frames;

    private EventCapturingPublisher publisher;
    private FakeCaptureStrategy sck;
    private FakeCaptureStrategy robot;
    private FakeCaptureStrategy ffmpeg;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        sck = new FakeCaptureStrategy("sck", CaptureMethod.SCREEN_CAPTURE_KIT);
        robot = new FakeCaptureStrategy("robot", CaptureMethod.ROBOT_API);
        ffmpeg = new FakeCaptureStrategy("ffmpeg", CaptureMethod.FFMPEG);
    }

    private CaptureStrategyChain chain(Platform platform, CaptureMethod preferred) {
        return new CaptureStrategyChain(List.of(ffmpeg, robot, sck), platform, preferred, publisher);
    }

    private CaptureRequest request() {
        return new CaptureRequest(null, 10, 1.0, 85, frames, true, 0);
    }

    @Test
    void startsFirstCandidateInPlatformOrder() {
        ScreenCaptureStrategy started = chain(Platform.MAC, CaptureMethod.AUTO).start(request());

        assertThat(started).isSameAs(sck);
        assertThat(robot.requests()).isEmpty();
        assertThat(publisher.events()).isEmpty();
    }

    @Test
    void failedAvailabilityCheckRemovesCandidate() {
        sck.unavailable();

        assertThat(chain(Platform.MAC, CaptureMethod.AUTO).candidates()).containsExactly(robot, ffmpeg);
    }

    @Test
    void primaryRefusalFallsBackToRobot() {
        sck.failsToStart(CaptureException.unavailable("sck", "bridge missing"));

        ScreenCaptureStrategy started = chain(Platform.MAC, CaptureMethod.AUTO).start(request());

        assertThat(started).isSameAs(robot);
        assertThat(sck.stopCalls()).isEqualTo(1);
        CaptureFallbackEvent event = publisher.first(CaptureFallbackEvent.class);
        assertThat(event.from()).isEqualTo(CaptureMethod.SCREEN_CAPTURE_KIT);
        assertThat(event.to()).isEqualTo(CaptureMethod.ROBOT_API);
        assertThat(event.reason()).isEqualTo("UNAVAILABLE");
    }

    @Test
    void everyBackendFailingIsUnavailable() {
        sck.refusesPermission();
        robot.failsToStart(new IllegalStateException("boom"));
        ffmpeg.failsToStart(CaptureException.startFailed("ffmpeg", 1, "exited"));

        assertThatThrownBy(() -> chain(Platform.MAC, CaptureMethod.AUTO).start(request()))
                .isInstanceOf(CaptureException.class)
                .extracting(e -> ((CaptureException) e).getKind())
                .isEqualTo(CaptureException.Kind.UNAVAILABLE);

        List<CaptureFallbackEvent> events = publisher.eventsOf(CaptureFallbackEvent.class);
        assertThat(events).hasSize(3);
        assertThat(events.get(1).reason()).isEqualTo("IllegalStateException");
        assertThat(events.get(2).to()).isNull();
    }

    @Test
    void preferredMethodIsTriedFirst() {
        ScreenCaptureStrategy started = chain(Platform.MAC, CaptureMethod.FFMPEG).start(request());

        assertThat(started).isSameAs(ffmpeg);
    }

    @Test
    void fallbackContinuesFrameSequence() {
        CaptureStrategyChain chain = chain(Platform.MAC, CaptureMethod.AUTO);
        sck.writesOnStart(4);
        chain.start(request());
        sck.crash();

        Optional<ScreenCaptureStrategy> next = chain.fallbackFrom(sck, request(), "stalled");

        assertThat(next).containsSame(robot);
        assertThat(robot.requests()).singleElement()
                .extracting(CaptureRequest::startIndex).isEqualTo(4);
        CaptureFallbackEvent event = publisher.first(CaptureFallbackEvent.class);
        assertThat(event.reason()).isEqualTo("stalled");
        assertThat(event.to()).isEqualTo(CaptureMethod.ROBOT_API);
    }

    @Test
    void fallbackFromLastBackendLeavesNothing() {
        CaptureStrategyChain chain = chain(Platform.LINUX, CaptureMethod.AUTO);

        Optional<ScreenCaptureStrategy> next = chain.fallbackFrom(ffmpeg, request(), "exited");

        assertThat(next).isEmpty();
        assertThat(ffmpeg.stopCalls()).isEqualTo(1);
        assertThat(publisher.first(CaptureFallbackEvent.class).to()).isNull();
    }
}
