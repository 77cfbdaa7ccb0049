package dev.nuclr.plugin.core.page.organizer.backend;

import dev.nuclr.plugin.core.page.organizer.ExportException;
import dev.nuclr.plugin.core.page.organizer.PageHandle;

import java.nio.file.Path;
import java.util.List;

/**
 * Assembles pages, in the given order, into a single output document.
 */
public interface ExportSink {

    /**
     * Write {@code pages} to {@code destination}, replacing any existing file.
     *
     * @throws ExportException if there is nothing to export or writing fails
     */
    void export(List<PageHandle> pages, Path destination) throws ExportException;
}
