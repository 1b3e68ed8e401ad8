package com.phillippitts.clipcast.service.encoding;

import com.phillippitts.clipcast.exception.EncoderNotFoundException;
import com.phillippitts.clipcast.service.capture.Platform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Finds the ffmpeg binary: explicit path first, then the usual install locations, then PATH.
 * The first successful lookup is cached.
 */
public class FfmpegLocator {

    private static final Logger LOG = LogManager.getLogger(FfmpegLocator.class);

    private static final List<String> UNIX_DIRS = List.of("/opt/homebrew/bin", "/usr/local/bin", "/usr/bin");

    private final String explicitPath;
    private final Platform platform;
    private final UnaryOperator<String> env;

    private volatile Path cached;

    public FfmpegLocator(String explicitPath) {
        this(explicitPath, Platform.current(), System::getenv);
    }

    // Package-private for tests
    FfmpegLocator(String explicitPath, Platform platform, UnaryOperator<String> env) {
        this.explicitPath = explicitPath;
        this.platform = platform;
        this.env = env;
    }

    /** Resolved binary, or empty when none of the candidates is executable. */
    public Optional<Path> locate() {
        Path hit = cached;
        if (hit != null) {
            return Optional.of(hit);
        }
        for (Path candidate : candidates()) {
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                cached = candidate;
                LOG.info("Using ffmpeg at {}", candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws EncoderNotFoundException listing every location searched
     */
    public Path require() {
        return locate().orElseThrow(() -> new EncoderNotFoundException(
                candidates().stream().map(Path::toString).toList()));
    }

    List<Path> candidates() {
        List<Path> out = new ArrayList<>();
        String exe = platform == Platform.WINDOWS ? "ffmpeg.exe" : "ffmpeg";
        if (explicitPath != null && !explicitPath.isBlank()) {
            out.add(Path.of(explicitPath.trim()));
        }
        if (platform == Platform.WINDOWS) {
            String programFiles = env.apply("ProgramFiles");
            if (programFiles != null && !programFiles.isBlank()) {
                out.add(Path.of(programFiles, "ffmpeg", "bin", exe));
            }
        } else {
            for (String dir : UNIX_DIRS) {
                out.add(Path.of(dir, exe));
            }
        }
        String path = env.apply("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                if (!dir.isBlank()) {
                    Path p = Path.of(dir, exe);
                    if (!out.contains(p)) {
                        out.add(p);
                    }
                }
            }
        }
        return out;
    }
}
