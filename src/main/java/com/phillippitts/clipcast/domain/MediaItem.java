package com.phillippitts.clipcast.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Finished artifact produced by one successful encode. Ownership passes to the media catalog.
 *
 * @param id            {@code media_<epochMillis>_<random>}
 * @param filePath      absolute path of the encoded file
 * @param thumbnailPath optional preview image
 * @param format        encoded format
 * @param sizeBytes     file size on disk
 * @param durationMs    recorded duration
 * @param dimensions    output pixel size
 * @param createdAt     creation time
 * @param metadata      free-form details (frame count, capture method, ...)
 */
public record MediaItem(
        String id,
        Path filePath,
        Path thumbnailPath,
        OutputFormat format,
        long sizeBytes,
        long durationMs,
        Dimensions dimensions,
        Instant createdAt,
        Map<String, String> metadata
) {

    public MediaItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(createdAt, "createdAt");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String fileName() {
        Path name = filePath.getFileName();
        return name == null ? filePath.toString() : name.toString();
    }
}
