package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.domain.OutputFormat;
import com.phillippitts.clipcast.domain.RecordingSettings;
import com.phillippitts.clipcast.util.TimeUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Resolves where a finished recording is written:
 * {@code <saveLocation>/<pattern with {timestamp}>.<ext>}, with {@code _1}, {@code _2}, ...
 * appended when that file already exists.
 */
public class OutputFileNamer {

    static final String TIMESTAMP_TOKEN = "{timestamp}";

    public Path resolve(RecordingSettings settings, OutputFormat format, LocalDateTime time) {
        String base = settings.fileNamingPattern().replace(TIMESTAMP_TOKEN, TimeUtils.fileStamp(time));
        base = base.replace('/', '_').replace('\\', '_').trim();
        if (base.isEmpty()) {
            base = "recording_" + TimeUtils.fileStamp(time);
        }
        Path dir = settings.saveLocation();
        Path candidate = dir.resolve(base + "." + format.extension());
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = dir.resolve(base + "_" + n + "." + format.extension());
        }
        return candidate;
    }
}
