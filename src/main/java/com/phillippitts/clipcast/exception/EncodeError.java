package com.phillippitts.clipcast.exception;

import java.util.Locale;

/**
 * Classification of a failed encode. The user-facing hint is appended to error messages.
 */
public enum EncodeError {
    NO_FRAMES("No frames were captured"),
    TIMEOUT("Encoding took too long; try a shorter recording or lower quality"),
    CRASH_SIGNATURE_ABORT("ffmpeg was aborted by the system (code signature or security policy); "
            + "reinstall ffmpeg or allow it in security settings"),
    CRASH_SYSTEM_KILL("ffmpeg was killed by the system, usually under memory pressure; "
            + "try a lower quality or a smaller area"),
    EXIT_CODE("ffmpeg exited with an error"),
    OUTPUT_MISSING("Output file was not created"),
    IO("I/O failure while encoding");

    private final String userHint;

    EncodeError(String userHint) {
        this.userHint = userHint;
    }

    public String userHint() {
        return userHint;
    }

    /** Lower-case tag for metrics. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
