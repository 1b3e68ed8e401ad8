package com.phillippitts.clipcast.service.media;

import com.phillippitts.clipcast.domain.MediaItem;

import java.util.List;
import java.util.Optional;

/**
 * Receives every finished {@link MediaItem}. How items are persisted or indexed is up to the
 * implementation; the state repository keeps its own capped recent list.
 */
public interface MediaCatalog {

    void add(MediaItem item);

    /** Newest first, at most {@code limit} items. */
    List<MediaItem> recent(int limit);

    Optional<MediaItem> find(String id);
}
