package com.phillippitts.clipcast.exception;

/**
 * Base exception for all ClipCast application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ClipCastException extends RuntimeException {

    public ClipCastException(String message) {
        super(message);
    }

    public ClipCastException(String message, Throwable cause) {
        super(message, cause);
    }

    public ClipCastException(Throwable cause) {
        super(cause);
    }
}
