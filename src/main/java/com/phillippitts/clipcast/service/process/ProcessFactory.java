package com.phillippitts.clipcast.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so ffmpeg-driven components can be tested without
 * spawning real processes.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub returning a fake
 * {@link Process} with controlled output and exit behavior.
 */
public interface ProcessFactory {
    /**
     * @param command    full command line, executable first
     * @param workingDir working directory (may be null)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
