package dev.nuclr.plugin.core.page.organizer;

import dev.nuclr.plugin.core.page.organizer.backend.DocumentSource;
import dev.nuclr.plugin.core.page.organizer.backend.ExportSink;
import dev.nuclr.plugin.core.page.organizer.backend.PageRenderBackend;
import dev.nuclr.plugin.core.page.organizer.backend.PdfboxDocumentSource;
import dev.nuclr.plugin.core.page.organizer.backend.PdfboxExportSink;
import dev.nuclr.plugin.core.page.organizer.backend.PdfboxRenderBackend;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for the UI layer: imports files, deletes the selection, exports the
 * merged document, and keeps a busy flag and the last status message to render.
 *
 * <p>Imports and exports run on the I/O pool and never block the caller.
 * Per-file open failures are isolated, so one bad file does not stop the others.
 * Everything else (move, reverse, selection) goes straight to {@link #collection()}.
 */
@Slf4j
public class PageOrganizerService implements AutoCloseable {

    static final String DELETE_REJECTED = "Cannot delete all pages or no pages selected.";
    static final String NOTHING_OPENED  = "Could not open any of the selected documents.";

    // -------------------------------------------------------------- state

    private final OrganizerSettings settings;
    private final DocumentSource documentSource;
    private final ExportSink exportSink;
    private final OrganizerExecutors executors;
    private final PageCollection collection;

    private final AtomicInteger busy = new AtomicInteger();
    private volatile StatusMessage lastStatus;

    // ----------------------------------------------------------- constructors

    public PageOrganizerService() {
        this(OrganizerSettings.getInstance(), new PdfboxDocumentSource(),
                new PdfboxRenderBackend(), new PdfboxExportSink());
    }

    public PageOrganizerService(OrganizerSettings settings,
                                DocumentSource documentSource,
                                PageRenderBackend renderBackend,
                                ExportSink exportSink) {
        this.settings = settings;
        this.documentSource = documentSource;
        this.exportSink = exportSink;
        this.executors = OrganizerExecutors.create(settings);

        PageThumbnailCache cache = PageThumbnailCache.fromSettings(settings);
        ThumbnailPipeline pipeline = ThumbnailPipeline.fromSettings(
                settings, renderBackend, cache, executors.renderPool());
        this.collection = new PageCollection(pipeline, cache, new SourceDocumentRegistry());
        log.info("Page organizer ready: thumbnails {}x{} via {}, batch size {}",
                settings.getThumbnailSize().width(), settings.getThumbnailSize().height(),
                renderBackend.name(), settings.getBatchSize());
    }

    // ------------------------------------------------------------ public API

    public PageCollection collection() {
        return collection;
    }

    /**
     * Open each file and append its pages. Files that cannot be opened are skipped
     * and reported in the result.
     */
    public CompletableFuture<ImportResult> importFiles(List<Path> files) {
        if (files.isEmpty()) return CompletableFuture.completedFuture(ImportResult.empty());

        List<Path> snapshot = List.copyOf(files);
        busy.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> doImport(snapshot), executors.ioPool())
                .whenComplete((result, ex) -> busy.decrementAndGet());
    }

    /** Delete the selected pages; the outcome is reported through {@link #lastStatus()}. */
    public boolean deleteSelected() {
        try {
            int deleted = collection.deleteSelected();
            lastStatus = StatusMessage.success("Successfully deleted " + deleted + " page(s)!");
            return true;
        } catch (InvalidSelectionException e) {
            log.debug("Delete rejected: {}", e.getMessage());
            lastStatus = StatusMessage.error(DELETE_REJECTED);
            return false;
        }
    }

    /** Remove one page, even if it is the last one. */
    public boolean removePage(UUID pageId) {
        return collection.removeOne(pageId);
    }

    /**
     * Write all pages, in display order, to {@code destination}. On failure the
     * returned future completes with an {@link ExportException}; nothing is retried.
     */
    public CompletableFuture<Path> exportTo(Path destination) {
        List<PageHandle> pages = collection.pageHandles();
        busy.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> {
                    try {
                        exportSink.export(pages, destination);
                        lastStatus = StatusMessage.success("PDF exported successfully!");
                        return destination;
                    } catch (ExportException e) {
                        lastStatus = StatusMessage.error(e.getMessage());
                        throw new CompletionException(e);
                    }
                }, executors.ioPool())
                .whenComplete((path, ex) -> busy.decrementAndGet());
    }

    public String defaultExportFileName() {
        return settings.getExportFileName();
    }

    public void clearAll() {
        collection.clear();
        lastStatus = null;
    }

    public boolean isBusy() {
        return busy.get() > 0;
    }

    public Optional<StatusMessage> lastStatus() {
        return Optional.ofNullable(lastStatus);
    }

    /** Cancel all work, close every source and stop the pools. */
    @Override
    public void close() {
        collection.clear();
        executors.close();
    }

    // ----------------------------------------------------- internal import flow

    private ImportResult doImport(List<Path> files) {
        List<SourceDocument> opened = new ArrayList<>();
        List<ImportResult.Failure> failures = new ArrayList<>();

        for (Path file : files) {
            SourceDocument source;
            try {
                source = documentSource.open(file);
            } catch (SourceOpenException e) {
                log.warn("Skipping {}: {}", file, e.getMessage());
                failures.add(new ImportResult.Failure(file, e.getMessage()));
                continue;
            }
            if (source.pageCount() == 0) {
                log.info("Skipping {}: no pages", file);
                source.close();
                continue;
            }
            opened.add(source);
        }

        // One add for the whole import keeps thumbnail rendering to a single run of batches.
        List<UUID> ids = collection.addSources(opened);

        ImportResult result = new ImportResult(opened.size(), ids.size(), failures);
        lastStatus = statusFor(result);
        log.info("Import finished: {} document(s), {} page(s), {} skipped",
                opened.size(), ids.size(), failures.size());
        return result;
    }

    private static StatusMessage statusFor(ImportResult result) {
        if (result.addedSources() == 0 && result.hasFailures()) {
            return StatusMessage.error(NOTHING_OPENED);
        }
        String text = "Added " + result.addedSources() + " document(s)";
        if (result.hasFailures()) {
            text += ", skipped " + result.failures().size();
        }
        return StatusMessage.success(text);
    }
}
