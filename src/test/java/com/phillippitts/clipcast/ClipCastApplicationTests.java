package com.phillippitts.clipcast;

import com.phillippitts.clipcast.domain.AppState;
import com.phillippitts.clipcast.service.capture.CaptureStrategyChain;
import com.phillippitts.clipcast.service.state.StateRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(properties = {
        "hotkey.enabled=false", // no native hook in tests
        "clipcast.recording.show-countdown=false"
})
class ClipCastApplicationTests {

    @Autowired
    private StateRepository stateRepository;

    @Autowired
    private CaptureStrategyChain captureStrategyChain;

    @DynamicPropertySource
    static void directories(DynamicPropertyRegistry registry) throws IOException {
        Path root = Files.createTempDirectory("clipcast-it");
        registry.add("clipcast.recording.save-location", () -> root.resolve("saved").toString());
        registry.add("clipcast.recording.temp-directory", () -> root.resolve("frames").toString());
    }

    @Test
    void contextLoadsAndReachesIdle() {
        await().untilAsserted(() -> assertThat(stateRepository.current()).isInstanceOf(AppState.Idle.class));
        assertThat(captureStrategyChain.candidates()).isNotNull();
    }
}
