package dev.nuclr.plugin.core.page.organizer;

import java.awt.image.BufferedImage;
import java.util.UUID;

/**
 * One page in the collection.
 *
 * @param id           identity, stable across reorders and never reused
 * @param sourceId     owning source document
 * @param sourceLabel  display name of the source
 * @param originIndex  0-based index of the page in its source
 * @param displayIndex 1-based position in the current order
 * @param page         page reference used for rendering and export
 * @param thumbnail    rendered thumbnail, or null while pending or unavailable
 */
public record PageEntry(
        UUID id,
        UUID sourceId,
        String sourceLabel,
        int originIndex,
        int displayIndex,
        PageHandle page,
        BufferedImage thumbnail) {

    static PageEntry create(PageHandle page, int displayIndex) {
        SourceDocument source = page.source();
        return new PageEntry(UUID.randomUUID(), source.id(), source.label(),
                page.pageIndex(), displayIndex, page, null);
    }

    public boolean hasThumbnail() {
        return thumbnail != null;
    }

    PageEntry withDisplayIndex(int index) {
        return new PageEntry(id, sourceId, sourceLabel, originIndex, index, page, thumbnail);
    }

    PageEntry withThumbnail(BufferedImage image) {
        return new PageEntry(id, sourceId, sourceLabel, originIndex, displayIndex, page, image);
    }
}
