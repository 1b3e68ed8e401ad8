package com.phillippitts.clipcast.service.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File convention shared by all capture backends and the encoder: {@code ffcap_%06d.jpg}.
 * Fixed-width indices make lexical order equal to frame order.
 */
public final class FrameSequence {

    private static final Logger LOG = LogManager.getLogger(FrameSequence.class);

    public static final String PREFIX = "ffcap_";
    public static final String EXTENSION = ".jpg";
    public static final int INDEX_WIDTH = 6;

    /** Output pattern understood by ffmpeg's image2 muxer. */
    public static final String FFMPEG_PATTERN = PREFIX + "%0" + INDEX_WIDTH + "d" + EXTENSION;

    private FrameSequence() {
    }

    public static String fileName(int index) {
        return String.format("%s%0" + INDEX_WIDTH + "d%s", PREFIX, index, EXTENSION);
    }

    public static Path frame(Path dir, int index) {
        return dir.resolve(fileName(index));
    }

    public static boolean isFrame(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().endsWith(EXTENSION) && Files.isRegularFile(file);
    }

    /**
     * Frame files in {@code dir} in frame order; empty when the directory does not exist.
     */
    public static List<Path> list(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(FrameSequence::isFrame)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list frames in " + dir, e);
        }
    }

    /** Index following the highest existing frame, or 0 for an empty directory. */
    public static int nextIndex(Path dir) {
        List<Path> frames = list(dir);
        int max = -1;
        for (Path p : frames) {
            max = Math.max(max, parseIndex(p.getFileName().toString()));
        }
        return max + 1;
    }

    /** Index encoded in a frame file name, or -1 if it does not follow the convention. */
    public static int parseIndex(String fileName) {
        if (!fileName.startsWith(PREFIX) || !fileName.endsWith(EXTENSION)) {
            return -1;
        }
        String digits = fileName.substring(PREFIX.length(), fileName.length() - EXTENSION.length());
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public static long totalBytes(List<Path> frames) {
        long total = 0L;
        for (Path p : frames) {
            try {
                total += Files.size(p);
            } catch (IOException e) {
                LOG.debug("Frame {} vanished before it could be sized: {}", p, e.toString());
            }
        }
        return total;
    }
}
