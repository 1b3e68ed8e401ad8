package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.domain.MediaItem;
import com.phillippitts.clipcast.domain.OutputFormat;
import com.phillippitts.clipcast.service.encoding.EncodedMedia;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds the {@link MediaItem} for an encoded file. Ids look like {@code media_<epochMillis>_<6 hex>}.
 */
public class MediaItemFactory {

    private final Clock clock;

    public MediaItemFactory(Clock clock) {
        this.clock = clock;
    }

    public MediaItem create(String sessionId, EncodedMedia media, OutputFormat format, long durationMs,
                            int frameCount, int fps, CaptureMethod captureMethod) {
        Instant now = clock.instant();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", sessionId);
        metadata.put("frames", Integer.toString(frameCount));
        metadata.put("fps", Integer.toString(fps));
        metadata.put("captureMethod", captureMethod.name());
        metadata.put("encodeMs", Long.toString(media.encodeMs()));
        return new MediaItem(
                newId(now),
                media.file().toAbsolutePath(),
                null,
                format,
                media.sizeBytes(),
                durationMs,
                media.dimensions(),
                now,
                metadata);
    }

    static String newId(Instant now) {
        int random = ThreadLocalRandom.current().nextInt(0x1000000);
        return "media_" + now.toEpochMilli() + "_" + String.format(Locale.ROOT, "%06x", random);
    }
}
