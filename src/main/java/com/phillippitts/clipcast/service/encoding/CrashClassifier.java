package com.phillippitts.clipcast.service.encoding;

import com.phillippitts.clipcast.exception.EncodeError;

/**
 * Classifies an abnormal ffmpeg exit.
 *
 * <ul>
 *   <li>exit 134 or an abort line on stderr: the binary was aborted, typically a code signature
 *       or security policy rejection</li>
 *   <li>exit 137: killed by the system, usually memory pressure</li>
 *   <li>anything else non-zero: a plain error exit</li>
 * </ul>
 */
final class CrashClassifier {

    static final int EXIT_SIGABRT = 134;
    static final int EXIT_SIGKILL = 137;

    private CrashClassifier() {
    }

    static boolean isAbortSignature(String line) {
        return line != null
                && (line.contains("signal 6") || line.contains("SIGABRT") || line.contains("Abort trap"));
    }

    static EncodeError classify(int exitCode, boolean abortSeen) {
        if (exitCode == EXIT_SIGABRT || abortSeen) {
            return EncodeError.CRASH_SIGNATURE_ABORT;
        }
        if (exitCode == EXIT_SIGKILL) {
            return EncodeError.CRASH_SYSTEM_KILL;
        }
        return EncodeError.EXIT_CODE;
    }
}
