package com.phillippitts.clipcast.service.encoding;

import java.nio.file.Path;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Turns a frame sequence into a finished media file.
 *
 * <p>Progress contract: values are in 0..100 and non-decreasing for one call. A successful call
 * reports 100 exactly once, as its last value. A failed call never reports 100.
 */
public interface MediaEncoder {

    /**
     * @param frames     frame files in order, all in one directory and named by one numeric pattern
     * @param output     file to create; replaced if it exists
     * @param params     format and quality
     * @param onProgress progress sink, may be null
     * @return the written file and its pixel size
     * @throws com.phillippitts.clipcast.exception.EncodingException classified by
     *         {@link com.phillippitts.clipcast.exception.EncodeError}
     * @throws com.phillippitts.clipcast.exception.EncoderNotFoundException when no transcoder exists
     */
    EncodedMedia encode(List<Path> frames, Path output, EncodeParameters params, IntConsumer onProgress);
}
