package com.phillippitts.clipcast.service.capture;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PlatformTest {

    @ParameterizedTest
    @CsvSource({
            "Mac OS X, MAC",
            "Darwin, MAC",
            "Windows 11, WINDOWS",
            "Linux, LINUX",
            "FreeBSD, LINUX",
            "SunOS, OTHER"
    })
    void mapsOsNames(String osName, Platform expected) {
        assertThat(Platform.fromOsName(osName)).isEqualTo(expected);
    }
}
