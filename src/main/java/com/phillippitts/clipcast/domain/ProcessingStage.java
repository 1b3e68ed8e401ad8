package com.phillippitts.clipcast.domain;

/** Progress markers shown while a session is being turned into a media file. */
public enum ProcessingStage {
    COLLECTING_FRAMES,
    ENCODING,
    OPTIMIZING,
    SAVING,
    GENERATING_THUMBNAIL,
    UPDATING_INDEX
}
