package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.exception.ClipCastException;
import com.phillippitts.clipcast.service.capture.FrameSequence;
import com.phillippitts.clipcast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the per-session frame directories ({@code gifland_yyyyMMdd_HHmmss}) under the configured
 * temp directory.
 */
public class FrameDirectoryManager {

    private static final Logger LOG = LogManager.getLogger(FrameDirectoryManager.class);

    public static final String DIRECTORY_PREFIX = "gifland_";

    /**
     * Creates a fresh, empty directory for one session.
     *
     * @throws ClipCastException if the directory cannot be created
     */
    public Path createSessionDirectory(Path tempRoot, LocalDateTime time) {
        String base = DIRECTORY_PREFIX + TimeUtils.fileStamp(time);
        try {
            Files.createDirectories(tempRoot);
            Path dir = tempRoot.resolve(base);
            for (int n = 1; ; n++) {
                try {
                    return Files.createDirectory(dir);
                } catch (FileAlreadyExistsException e) {
                    dir = tempRoot.resolve(base + "_" + n);
                }
            }
        } catch (IOException e) {
            throw new ClipCastException("Cannot create frame directory under " + tempRoot, e);
        }
    }

    /**
     * Frames currently in {@code dir}, in index order.
     *
     * @throws java.io.UncheckedIOException if the directory cannot be read
     */
    public List<Path> listFrames(Path dir) {
        return FrameSequence.list(dir);
    }

    /**
     * Deletes a directory tree. Missing directories count as deleted.
     *
     * @return {@code true} when nothing is left behind
     */
    public boolean deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return true;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Cannot walk {} for deletion: {}", dir, e.toString());
            return false;
        }
        boolean clean = true;
        for (Path p : paths) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                clean = false;
                LOG.debug("Could not delete {}: {}", p, e.toString());
            }
        }
        return clean;
    }

    /**
     * Removes frame directories left behind by sessions that never finished, e.g. after a crash.
     *
     * @return number of directories removed
     */
    public int purgeStale(Path tempRoot) {
        if (tempRoot == null || !Files.isDirectory(tempRoot)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(tempRoot, DIRECTORY_PREFIX + "*")) {
            for (Path p : stream) {
                if (Files.isDirectory(p) && deleteRecursively(p)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            LOG.warn("Cannot scan {} for stale frame directories: {}", tempRoot, e.toString());
        }
        if (removed > 0) {
            LOG.info("Removed {} stale frame directories from {}", removed, tempRoot);
        }
        return removed;
    }
}
