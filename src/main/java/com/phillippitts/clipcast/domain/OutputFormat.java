package com.phillippitts.clipcast.domain;

import java.util.Locale;

/**
 * Target container/codec of a recording. Determines the encoder branch.
 */
public enum OutputFormat {
    GIF("gif"),
    WEBP("webp"),
    MP4("mp4");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    /** File extension without the leading dot. */
    public String extension() {
        return extension;
    }

    /**
     * Lenient parse used by the REST surface and properties ("gif", "WebP", ...).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Output format must not be blank");
        }
        return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
