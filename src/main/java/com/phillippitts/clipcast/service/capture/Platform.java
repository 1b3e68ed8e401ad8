package com.phillippitts.clipcast.service.capture;

import java.util.Locale;

/** Operating system family; selects backend priority and ffmpeg grabber grammar. */
public enum Platform {
    MAC,
    WINDOWS,
    LINUX,
    OTHER;

    public static Platform current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static Platform fromOsName(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return MAC;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("nux") || os.contains("nix") || os.contains("bsd")) {
            return LINUX;
        }
        return OTHER;
    }
}
