package com.phillippitts.clipcast.service.encoding;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FrameInputPatternTest {

    private static final Path DIR = Path.of("/tmp/gifland_20240101_120000");

    @Test
    void numberedFramesUseSequenceWithStartNumber() {
        List<String> args = FrameInputPattern.inputArgs(DIR.resolve("ffcap_000007.jpg"), 12);

        assertThat(args).containsExactly("-framerate", "12", "-pattern_type", "sequence",
                "-start_number", "7", "-i", DIR.resolve("ffcap_%06d.jpg").toString());
    }

    @Test
    void sequenceStartingAtOneOmitsStartNumber() {
        List<String> args = FrameInputPattern.inputArgs(DIR.resolve("frame_0001.png"), 10);

        assertThat(args).doesNotContain("-start_number");
        assertThat(args).endsWith(DIR.resolve("frame_%04d.png").toString());
    }

    @Test
    void unnumberedNamesFallBackToGlob() {
        List<String> args = FrameInputPattern.inputArgs(DIR.resolve("shot_final.jpg"), 10);

        assertThat(args).containsSubsequence("-pattern_type", "glob");
        assertThat(args).endsWith(DIR.resolve("shot_*.jpg").toString());
    }
}
