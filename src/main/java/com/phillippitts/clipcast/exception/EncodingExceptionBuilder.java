package com.phillippitts.clipcast.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link EncodingException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw EncodingExceptionBuilder.create("ffmpeg failed", EncodeError.EXIT_CODE)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("format", "gif")
 *         .metadata("stderr", tail)
 *         .build();
 * </pre>
 */
public final class EncodingExceptionBuilder {

    private final String message;
    private final EncodeError error;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private EncodingExceptionBuilder(String message, EncodeError error) {
        this.message = message;
        this.error = error;
    }

    /**
     * @param message base error message (must not be null or empty)
     * @param error   failure classification
     */
    public static EncodingExceptionBuilder create(String message, EncodeError error) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new EncodingExceptionBuilder(message, error);
    }

    public EncodingExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public EncodingExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public EncodingExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** Adds a detail; null keys or values are skipped. */
    public EncodingExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Final message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public EncodingException build() {
        return new EncodingException(error, buildDetailedMessage(), exitCode == null ? -1 : exitCode, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
