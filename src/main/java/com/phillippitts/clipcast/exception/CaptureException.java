package com.phillippitts.clipcast.exception;

/**
 * Thrown when a capture backend cannot be used or fails to start.
 */
public class CaptureException extends ClipCastException {

    public enum Kind {
        /** Native bridge missing, platform unsupported, or no matching display. */
        UNAVAILABLE,
        /** Backend was usable but refused to start; see {@link #getCode()}. */
        START_FAILED
    }

    private final Kind kind;
    private final String backend;
    private final Integer code;

    private CaptureException(Kind kind, String backend, Integer code, String message, Throwable cause) {
        super(message + " (backend: " + backend + ")", cause);
        this.kind = kind;
        this.backend = backend;
        this.code = code;
    }

    public static CaptureException unavailable(String backend, String reason) {
        return new CaptureException(Kind.UNAVAILABLE, backend, null, reason, null);
    }

    public static CaptureException unavailable(String backend, String reason, Throwable cause) {
        return new CaptureException(Kind.UNAVAILABLE, backend, null, reason, cause);
    }

    public static CaptureException startFailed(String backend, int code, String reason) {
        return new CaptureException(Kind.START_FAILED, backend, code, reason + " (code=" + code + ")", null);
    }

    public static CaptureException startFailed(String backend, String reason, Throwable cause) {
        return new CaptureException(Kind.START_FAILED, backend, null, reason, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getBackend() {
        return backend;
    }

    /** Native/process return code for {@link Kind#START_FAILED}, otherwise null. */
    public Integer getCode() {
        return code;
    }
}
