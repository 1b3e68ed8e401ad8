package com.phillippitts.clipcast.domain;

/**
 * Pending edits of a media item. Only carried through the state machine; editing itself
 * happens outside the recording core.
 *
 * @param trimStartMs  start offset to keep
 * @param trimEndMs    end offset to keep, {@code null} for the full length
 * @param speed        playback speed multiplier
 * @param crop         crop rectangle in media pixels, may be null
 */
public record EditState(long trimStartMs, Long trimEndMs, double speed, CaptureRegion crop) {

    public static EditState initial() {
        return new EditState(0L, null, 1.0, null);
    }
}
