package com.phillippitts.clipcast.service.capture.ffmpeg;

import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.CaptureRequest;
import com.phillippitts.clipcast.service.capture.Platform;
import com.phillippitts.clipcast.service.encoding.FfmpegLocator;
import com.phillippitts.clipcast.testutil.FakeDisplayEnvironment;
import com.phillippitts.clipcast.testutil.StubProcessFactory;
import com.phillippitts.clipcast.testutil.TestProcess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegCaptureStrategyTest {

    @TempDir
    Path tmp;

    private FfmpegLocator locator;
    private StubProcessFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        Path binary = Files.createFile(tmp.resolve("ffmpeg"));
        binary.toFile().setExecutable(true);
        locator = new FfmpegLocator(binary.toString());
        factory = new StubProcessFactory();
    }

    private FfmpegCaptureStrategy strategy(Platform platform) {
        return new FfmpegCaptureStrategy(locator, FakeDisplayEnvironment.retina(), platform, factory,
                Duration.ofMillis(200), key -> "DISPLAY".equals(key) ? ":7" : null);
    }

    private CaptureRequest request() {
        return new CaptureRequest(CaptureRegion.of(0, 0, 320, 200), 10, 1.0, 85, tmp.resolve("frames"), true, 0);
    }

    @Test
    void stopAsksFfmpegToQuit() {
        factory.then(TestProcess.Behavior.runsUntilQuit());
        FfmpegCaptureStrategy capture = strategy(Platform.LINUX);

        capture.start(request());
        assertThat(capture.isRunning()).isTrue();
        assertThat(Files.isDirectory(tmp.resolve("frames"))).isTrue();
        assertThat(factory.commands().get(0)).contains("x11grab", ":7+0,0");

        capture.stop();

        TestProcess process = factory.started().get(0);
        assertThat(process.stdinText()).isEqualTo("q");
        assertThat(process.wasDestroyCalled()).isFalse();
        assertThat(capture.isRunning()).isFalse();
    }

    @Test
    void unresponsiveGrabberIsDestroyedAfterGrace() {
        factory.then(TestProcess.Behavior.ignoresQuit());
        FfmpegCaptureStrategy capture = strategy(Platform.LINUX);
        capture.start(request());

        capture.stop();

        assertThat(factory.started().get(0).wasDestroyCalled()).isTrue();
    }

    @Test
    void immediateExitIsStartFailureWithCode() {
        factory.then(TestProcess.Behavior.exitsWith(1, "x11grab: Cannot open display :7\n"));
        FfmpegCaptureStrategy capture = strategy(Platform.LINUX);

        assertThatThrownBy(() -> capture.start(request()))
                .isInstanceOfSatisfying(CaptureException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(CaptureException.Kind.START_FAILED);
                    assertThat(e.getCode()).isEqualTo(1);
                    assertThat(e.getMessage()).contains("Cannot open display");
                });
        assertThat(capture.isRunning()).isFalse();
    }

    @Test
    void launchFailureIsStartFailure() {
        factory.failWith(new IOException("No such file"));

        assertThatThrownBy(() -> strategy(Platform.LINUX).start(request()))
                .isInstanceOf(CaptureException.class)
                .hasMessageContaining("Cannot launch ffmpeg");
    }

    @Test
    void secondStartWhileRunningIsRejected() {
        factory.then(TestProcess.Behavior.runsUntilQuit());
        FfmpegCaptureStrategy capture = strategy(Platform.LINUX);
        capture.start(request());
        try {
            assertThatThrownBy(() -> capture.start(request())).isInstanceOf(CaptureException.class);
        } finally {
            capture.stop();
        }
    }

    @Test
    void stopWithoutStartIsNoop() {
        FfmpegCaptureStrategy capture = strategy(Platform.WINDOWS);

        capture.stop();
        capture.stop();

        assertThat(factory.started()).isEmpty();
    }

    @Test
    void unknownPlatformIsUnavailable() {
        assertThat(strategy(Platform.OTHER).isAvailable()).isFalse();
        assertThat(strategy(Platform.MAC).isAvailable()).isTrue();
    }
}
