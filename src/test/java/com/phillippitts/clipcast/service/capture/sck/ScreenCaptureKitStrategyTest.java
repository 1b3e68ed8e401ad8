package com.phillippitts.clipcast.service.capture.sck;

import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.CaptureRequest;
import com.phillippitts.clipcast.service.capture.Platform;
import com.phillippitts.clipcast.testutil.FakeDisplayEnvironment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.IntConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScreenCaptureKitStrategyTest {

    @TempDir
    Path frames;

    /** Records start calls and answers with scripted return codes. */
    static final class FakeBridge implements NativeCaptureBridge {
        final List<int[]> starts = new ArrayList<>();
        final Deque<Integer> codes = new ArrayDeque<>();
        String displaysJson = "[{\"id\":69733378,\"width\":1440,\"height\":900},{\"id\":2,\"width\":1920,\"height\":1080}]";
        int stops;
        IntConsumer onFrame;

        @Override
        public int startDisplayCapture(int displayId, int fps, int x, int y, int w, int h, String outputDir,
                                       int jpegQuality, float scale, IntConsumer onFrame) {
            starts.add(new int[]{displayId, fps, x, y, w, h});
            this.onFrame = onFrame;
            return codes.isEmpty() ? 0 : codes.poll();
        }

        @Override
        public void stopCapture() {
            stops++;
        }

        @Override
        public String listDisplaysJson() {
            return displaysJson;
        }
    }

    private final FakeBridge bridge = new FakeBridge();

    private ScreenCaptureKitStrategy strategy(Platform platform) {
        return new ScreenCaptureKitStrategy(() -> Optional.of(bridge), FakeDisplayEnvironment.retina(), platform);
    }

    private CaptureRequest request(CaptureRegion region) {
        return new CaptureRequest(region, 30, 1.0, 85, frames, true, 0);
    }

    @Test
    void startsFullDisplayClampedToNativeRate() {
        ScreenCaptureKitStrategy capture = strategy(Platform.MAC);

        capture.start(request(null));

        assertThat(capture.isRunning()).isTrue();
        assertThat(bridge.starts).singleElement()
                .satisfies(s -> assertThat(s).containsExactly(69733378, 5, -1, -1, 0, 0));
        bridge.onFrame.accept(0);
    }

    @Test
    void regionPicksClosestDisplayBySize() {
        ScreenCaptureKitStrategy capture = strategy(Platform.MAC);

        capture.start(request(CaptureRegion.of(0, 0, 1900, 1000)));

        assertThat(bridge.starts.get(0)[0]).isEqualTo(2);
        assertThat(bridge.starts.get(0)[4]).isEqualTo(1900);
    }

    @Test
    void displayNotFoundRetriesOnPointerDisplay() {
        bridge.codes.add(NativeCaptureBridge.RC_DISPLAY_NOT_FOUND);
        ScreenCaptureKitStrategy capture = strategy(Platform.MAC);

        capture.start(request(CaptureRegion.of(0, 0, 1900, 1000)));

        assertThat(bridge.starts).hasSize(2);
        assertThat(bridge.starts.get(1)[0]).isEqualTo(69733378);
        assertThat(capture.isRunning()).isTrue();
    }

    @Test
    void negativeCodeIsStartFailure() {
        bridge.codes.add(-3801);
        ScreenCaptureKitStrategy capture = strategy(Platform.MAC);

        assertThatThrownBy(() -> capture.start(request(null)))
                .isInstanceOfSatisfying(CaptureException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(CaptureException.Kind.START_FAILED);
                    assertThat(e.getCode()).isEqualTo(-3801);
                });
        assertThat(capture.isRunning()).isFalse();
    }

    @Test
    void cannotContinueAnotherBackendsSequence() {
        assertThatThrownBy(() -> strategy(Platform.MAC).start(request(null).withStartIndex(12)))
                .isInstanceOf(CaptureException.class);
        assertThat(bridge.starts).isEmpty();
    }

    @Test
    void unavailableOffMacOrWithoutBridge() {
        assertThat(strategy(Platform.LINUX).isAvailable()).isFalse();
        ScreenCaptureKitStrategy noBridge = new ScreenCaptureKitStrategy(Optional::empty,
                FakeDisplayEnvironment.retina(), Platform.MAC);
        assertThat(noBridge.isAvailable()).isFalse();
        assertThatThrownBy(() -> noBridge.start(request(null)))
                .isInstanceOfSatisfying(CaptureException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CaptureException.Kind.UNAVAILABLE));
    }

    @Test
    void stopCallsBridgeOnce() {
        ScreenCaptureKitStrategy capture = strategy(Platform.MAC);
        capture.start(request(null));

        capture.stop();
        capture.stop();

        assertThat(bridge.stops).isEqualTo(1);
        assertThat(capture.isRunning()).isFalse();
    }

    @Test
    void parsesBothDisplayListShapes() {
        assertThat(ScreenCaptureKitStrategy.parseDisplays("{\"displays\":[{\"id\":1,\"width\":10,\"height\":20}]}"))
                .containsExactly(new ScreenCaptureKitStrategy.NativeDisplay(1, 10, 20));
        assertThat(ScreenCaptureKitStrategy.parseDisplays("[{\"id\":3},{\"id\":4,\"width\":1,\"height\":2}]"))
                .extracting(ScreenCaptureKitStrategy.NativeDisplay::id).containsExactly(4);
        assertThat(ScreenCaptureKitStrategy.parseDisplays("not json")).isEmpty();
        assertThat(ScreenCaptureKitStrategy.parseDisplays(null)).isEmpty();
    }
}
