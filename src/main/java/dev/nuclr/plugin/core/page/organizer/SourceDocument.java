package dev.nuclr.plugin.core.page.organizer;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An opened source PDF whose pages can be added to a {@link PageCollection}.
 *
 * <p>PDFBox documents are not thread-safe. Every access to the underlying
 * {@link PDDocument} (rendering, exporting, closing) goes through
 * {@link #withDocument}, which serialises callers on a per-document lock.
 */
@Slf4j
public final class SourceDocument implements AutoCloseable {

    @FunctionalInterface
    public interface DocumentCallback<T> {
        T apply(PDDocument document) throws IOException;
    }

    private final UUID id;
    private final String label;
    private final PDDocument document;
    private final int pageCount;

    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed; // guarded by lock

    public SourceDocument(String label, PDDocument document) {
        this(UUID.randomUUID(), label, document);
    }

    public SourceDocument(UUID id, String label, PDDocument document) {
        this.id = id;
        this.label = label;
        this.document = document;
        this.pageCount = document.getNumberOfPages();
    }

    public UUID id() {
        return id;
    }

    public String label() {
        return label;
    }

    public int pageCount() {
        return pageCount;
    }

    /** Handles for every page, in document order. */
    public List<PageHandle> pages() {
        List<PageHandle> pages = new ArrayList<>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            pages.add(new PageHandle(this, i));
        }
        return pages;
    }

    /**
     * Runs the callback while holding this document's lock.
     *
     * @throws IOException if the document has been closed, or whatever the callback throws
     */
    public <T> T withDocument(DocumentCallback<T> callback) throws IOException {
        lock.lock();
        try {
            if (closed) throw new IOException("Source document closed: " + label);
            return callback.apply(document);
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            document.close();
            log.debug("Closed source document '{}' ({})", label, id);
        } catch (IOException e) {
            log.warn("Error closing source document '{}'", label, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "SourceDocument[" + label + ", " + pageCount + " pages]";
    }
}
