package com.phillippitts.clipcast.service.media;

import com.phillippitts.clipcast.domain.MediaItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local catalog. Items added with an id already present replace the old entry.
 */
public class InMemoryMediaCatalog implements MediaCatalog {

    private static final Logger LOG = LogManager.getLogger(InMemoryMediaCatalog.class);

    private final Deque<MediaItem> items = new ArrayDeque<>();

    @Override
    public synchronized void add(MediaItem item) {
        Objects.requireNonNull(item, "item");
        items.removeIf(existing -> existing.id().equals(item.id()));
        items.addFirst(item);
        LOG.debug("Catalogued {} ({} items)", item.fileName(), items.size());
    }

    @Override
    public synchronized List<MediaItem> recent(int limit) {
        List<MediaItem> out = new ArrayList<>(Math.min(Math.max(limit, 0), items.size()));
        for (MediaItem item : items) {
            if (out.size() >= limit) {
                break;
            }
            out.add(item);
        }
        return List.copyOf(out);
    }

    @Override
    public synchronized Optional<MediaItem> find(String id) {
        return items.stream().filter(m -> m.id().equals(id)).findFirst();
    }
}
