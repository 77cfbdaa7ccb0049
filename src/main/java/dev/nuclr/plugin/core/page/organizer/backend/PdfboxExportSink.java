package dev.nuclr.plugin.core.page.organizer.backend;

import dev.nuclr.plugin.core.page.organizer.ExportException;
import dev.nuclr.plugin.core.page.organizer.PageHandle;
import dev.nuclr.plugin.core.page.organizer.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges pages into a new PDF with Apache PDFBox 3.x.
 *
 * <p>Imported pages share resources with their sources, which are read again
 * while saving. Every involved source stays locked, in id order, from the first
 * import until the output is saved. The output goes to a sibling temp file and
 * is then moved into place, so a failed export never leaves a truncated file.
 */
@Slf4j
public class PdfboxExportSink implements ExportSink {

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }

    @Override
    public void export(List<PageHandle> pages, Path destination) throws ExportException {
        if (pages.isEmpty()) {
            throw new ExportException("No pages to export");
        }

        Set<SourceDocument> distinct = new LinkedHashSet<>();
        for (PageHandle handle : pages) distinct.add(handle.source());
        List<SourceDocument> sources = distinct.stream()
                .sorted(Comparator.comparing(SourceDocument::id))
                .toList();

        Path tmp = destination.resolveSibling(destination.getFileName() + ".tmp");
        try (PDDocument out = new PDDocument()) {
            withAllLocked(sources, 0, () -> {
                for (PageHandle handle : pages) {
                    // Already held; the source lock is reentrant.
                    out.importPage(handle.source().withDocument(doc -> doc.getPage(handle.pageIndex())));
                }
                out.save(tmp.toFile());
            });
            moveIntoPlace(tmp, destination);
        } catch (IOException e) {
            deleteQuietly(tmp);
            log.error("Export to {} failed", destination, e);
            throw new ExportException("Failed to export PDF: " + e.getMessage(), e);
        }

        log.info("Exported {} page(s) from {} source(s) to {}", pages.size(), sources.size(), destination);
    }

    private static void withAllLocked(List<SourceDocument> sources, int i, IoAction action) throws IOException {
        if (i == sources.size()) {
            action.run();
            return;
        }
        sources.get(i).withDocument(doc -> {
            withAllLocked(sources, i + 1, action);
            return null;
        });
    }

    private static void moveIntoPlace(Path tmp, Path destination) throws IOException {
        try {
            Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
