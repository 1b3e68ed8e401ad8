package com.phillippitts.clipcast.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ProcessFactory} backed by {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // ffmpeg reports progress on stderr; keep the streams apart
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
