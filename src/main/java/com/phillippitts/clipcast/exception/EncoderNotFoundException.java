package com.phillippitts.clipcast.exception;

import java.util.List;

/**
 * Thrown when no ffmpeg executable could be located. This is a setup error: the user has to
 * install ffmpeg or point {@code clipcast.encoder.ffmpeg-path} at it.
 */
public class EncoderNotFoundException extends ClipCastException {

    private final List<String> searched;

    public EncoderNotFoundException(List<String> searched) {
        super("ffmpeg not found. Searched: " + String.join(", ", searched));
        this.searched = List.copyOf(searched);
    }

    public List<String> getSearched() {
        return searched;
    }
}
