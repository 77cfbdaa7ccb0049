package dev.nuclr.plugin.core.page.organizer;

import java.util.UUID;

/**
 * Non-owning reference to one page of a {@link SourceDocument}.
 * Valid only while the source is open.
 */
public record PageHandle(SourceDocument source, int pageIndex) {

    public UUID sourceId() {
        return source.id();
    }
}
