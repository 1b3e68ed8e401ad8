package com.phillippitts.clipcast.service.encoding;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives ffmpeg image-sequence input arguments from the first frame's file name.
 *
 * <p>{@code ffcap_000007.jpg} becomes
 * {@code -framerate F -pattern_type sequence -start_number 7 -i dir/ffcap_%06d.jpg}. Names
 * without a trailing number fall back to a glob over {@code <prefix>_*.<ext>}.
 */
final class FrameInputPattern {

    private static final Pattern NUMBERED = Pattern.compile("^(.*?)(\\d+)(\\.[A-Za-z0-9]+)$");

    private FrameInputPattern() {
    }

    static List<String> inputArgs(Path firstFrame, int fps) {
        Path dir = firstFrame.toAbsolutePath().getParent();
        String name = firstFrame.getFileName().toString();
        Matcher m = NUMBERED.matcher(name);
        if (m.matches()) {
            String prefix = m.group(1);
            String digits = m.group(2);
            String ext = m.group(3);
            String pattern = dir.resolve(prefix + "%0" + digits.length() + "d" + ext).toString();
            int start = parseStart(digits);
            if (start != 1) {
                return List.of("-framerate", String.valueOf(fps), "-pattern_type", "sequence",
                        "-start_number", String.valueOf(start), "-i", pattern);
            }
            return List.of("-framerate", String.valueOf(fps), "-pattern_type", "sequence", "-i", pattern);
        }
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot + 1) : "jpg";
        int underscore = base.lastIndexOf('_');
        String prefix = underscore > 0 ? base.substring(0, underscore) : base;
        return List.of("-framerate", String.valueOf(fps), "-pattern_type", "glob",
                "-i", dir.resolve(prefix + "_*." + ext).toString());
    }

    private static int parseStart(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}
