package com.phillippitts.clipcast.service.media;

import com.phillippitts.clipcast.domain.Dimensions;
import com.phillippitts.clipcast.domain.MediaItem;
import com.phillippitts.clipcast.domain.OutputFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMediaCatalogTest {

    private final InMemoryMediaCatalog catalog = new InMemoryMediaCatalog();

    @Test
    void recentIsNewestFirstAndCapped() {
        catalog.add(item("media_1", "a.gif"));
        catalog.add(item("media_2", "b.gif"));
        catalog.add(item("media_3", "c.gif"));

        assertThat(catalog.recent(2)).extracting(MediaItem::id).containsExactly("media_3", "media_2");
        assertThat(catalog.recent(10)).hasSize(3);
        assertThat(catalog.recent(0)).isEmpty();
    }

    @Test
    void sameIdReplacesAndMovesToFront() {
        catalog.add(item("media_1", "a.gif"));
        catalog.add(item("media_2", "b.gif"));

        catalog.add(item("media_1", "a-edited.gif"));

        assertThat(catalog.recent(10)).extracting(MediaItem::fileName)
                .containsExactly("a-edited.gif", "b.gif");
    }

    @Test
    void findsById() {
        catalog.add(item("media_1", "a.gif"));

        assertThat(catalog.find("media_1")).map(MediaItem::fileName).contains("a.gif");
        assertThat(catalog.find("media_9")).isEmpty();
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> catalog.add(null)).isInstanceOf(NullPointerException.class);
    }

    private static MediaItem item(String id, String name) {
        return new MediaItem(id, Path.of("/tmp", name), null, OutputFormat.GIF, 1024, 3000,
                new Dimensions(320, 200), Instant.parse("2024-05-01T10:00:00Z"), Map.of());
    }
}
