package com.phillippitts.clipcast.service.encoding;

import com.phillippitts.clipcast.domain.OutputFormat;

import java.util.Objects;

/**
 * What to encode a frame sequence into.
 *
 * @param format   output container/codec
 * @param fps      playback frame rate of the frames (1..60)
 * @param quality  settings quality (1..100), mapped per format by {@link QualityMapper}
 * @param fastMode favour speed over quality (GIF only)
 */
public record EncodeParameters(OutputFormat format, int fps, int quality, boolean fastMode) {

    public EncodeParameters {
        Objects.requireNonNull(format, "format");
        fps = Math.max(1, Math.min(60, fps));
        quality = Math.max(1, Math.min(100, quality));
    }
}
