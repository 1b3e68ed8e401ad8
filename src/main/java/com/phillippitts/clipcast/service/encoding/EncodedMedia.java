package com.phillippitts.clipcast.service.encoding;

import com.phillippitts.clipcast.domain.Dimensions;

import java.nio.file.Path;

/**
 * A finished encode.
 *
 * @param file       written file
 * @param dimensions output pixel size
 * @param sizeBytes  file size
 * @param encodeMs   wall time spent in ffmpeg
 */
public record EncodedMedia(Path file, Dimensions dimensions, long sizeBytes, long encodeMs) { }
