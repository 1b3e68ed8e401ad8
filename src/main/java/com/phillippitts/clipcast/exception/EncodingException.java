package com.phillippitts.clipcast.exception;

/**
 * Thrown when turning a frame sequence into a media file fails.
 * Prefer {@link EncodingExceptionBuilder} so messages carry exit code, duration and stderr tail.
 */
public class EncodingException extends ClipCastException {

    private final EncodeError error;
    private final int exitCode;

    public EncodingException(EncodeError error, String message) {
        this(error, message, -1, null);
    }

    public EncodingException(EncodeError error, String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.exitCode = exitCode;
    }

    public EncodeError getError() {
        return error;
    }

    /** Process exit code, or -1 when the process did not exit normally (timeout, I/O). */
    public int getExitCode() {
        return exitCode;
    }
}
