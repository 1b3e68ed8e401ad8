package com.phillippitts.clipcast.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(100_000_000L)).isEqualTo(100L);
    }

    @Test
    void shouldTruncateNanosToMillis() {
        // 2.999 milliseconds truncates to 2 milliseconds
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1000L);
        assertThat(elapsedMs).isLessThan(2000L);
    }

    @Test
    void fileStampIsSortableAndPathSafe() {
        LocalDateTime t = LocalDateTime.of(2024, 3, 9, 7, 5, 4);

        assertThat(TimeUtils.fileStamp(t)).isEqualTo("20240309_070504");
    }
}
