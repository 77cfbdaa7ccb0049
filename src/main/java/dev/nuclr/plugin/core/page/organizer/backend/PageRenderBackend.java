package dev.nuclr.plugin.core.page.organizer.backend;

import dev.nuclr.plugin.core.page.organizer.PageHandle;
import dev.nuclr.plugin.core.page.organizer.ThumbnailSize;

import java.awt.image.BufferedImage;

/**
 * Strategy interface for thumbnail rendering backends.
 * Implementations are called concurrently from the render pool and must be
 * thread-safe; access to a single document is serialised by its
 * {@link dev.nuclr.plugin.core.page.organizer.SourceDocument} lock.
 */
public interface PageRenderBackend {

    /** Human-readable name for logging. */
    String name();

    /**
     * Render one page so that it fits inside {@code size}, preserving aspect ratio.
     * Blocks until done. Same page and size give the same image.
     *
     * @throws Exception for I/O or rendering errors; the page keeps no thumbnail
     */
    BufferedImage render(PageHandle page, ThumbnailSize size) throws Exception;
}
