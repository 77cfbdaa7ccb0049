package dev.nuclr.plugin.core.page.organizer;

import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered pages drawn from one or more source documents, plus the selection set.
 *
 * <p>One lock guards the page list, the selection and every interaction with the
 * pipeline's pending tasks, so a delete cancels, removes and unselects in one step
 * and a thumbnail publish can never resurrect a deleted page. After every public
 * mutation the display indices are exactly {@code 1..size()}.
 *
 * <p>Change listeners run on the mutating thread, after the lock is released.
 * Thumbnail publishes arrive on render pool threads.
 */
@Slf4j
public class PageCollection {

    private final ThumbnailPipeline pipeline;
    private final PageThumbnailCache cache;
    private final SourceDocumentRegistry sources;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<PageEntry> entries = new ArrayList<>();      // guarded by lock
    private final Set<UUID> selection = new LinkedHashSet<>();      // guarded by lock

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<CompletableFuture<Void>> thumbnailWork =
            new AtomicReference<>(CompletableFuture.completedFuture(null));

    public PageCollection(ThumbnailPipeline pipeline, PageThumbnailCache cache, SourceDocumentRegistry sources) {
        this.pipeline = pipeline;
        this.cache = cache;
        this.sources = sources;
    }

    // ------------------------------------------------------------ structure

    /**
     * Append every page of {@code source} at the tail, in document order, and
     * schedule thumbnails for exactly those pages. A source without pages adds
     * nothing and is not retained.
     *
     * @return ids of the new entries, in order
     */
    public List<UUID> addSource(SourceDocument source) {
        return addSources(List.of(source));
    }

    /**
     * Append the pages of several sources in the given order and schedule their
     * thumbnails as one run of batches. Sources without pages are skipped and not
     * retained; closing them is up to the caller.
     *
     * @return ids of the new entries, in order
     */
    public List<UUID> addSources(List<SourceDocument> newSources) {
        List<PageEntry> added = new ArrayList<>();
        List<ThumbnailPipeline.Job> jobs;
        lock.lock();
        try {
            for (SourceDocument source : newSources) {
                List<PageHandle> pages = source.pages();
                if (pages.isEmpty()) {
                    log.info("Source '{}' has no pages, nothing added", source.label());
                    continue;
                }
                sources.register(source);
                int next = entries.size() + 1;
                for (PageHandle page : pages) {
                    PageEntry entry = PageEntry.create(page, next++);
                    entries.add(entry);
                    added.add(entry);
                }
                log.info("Added {} page(s) from '{}'", pages.size(), source.label());
            }
            // Tokens go live together with the entries, so a delete right after this can cancel them.
            jobs = pipeline.register(added);
        } finally {
            lock.unlock();
        }
        if (added.isEmpty()) return List.of();

        CompletableFuture<Void> scheduled = pipeline.start(jobs, this::publishThumbnail);
        thumbnailWork.getAndUpdate(prev -> CompletableFuture.allOf(prev, scheduled));
        fireChanged();

        List<UUID> ids = new ArrayList<>(added.size());
        for (PageEntry e : added) ids.add(e.id());
        return ids;
    }

    /**
     * Remove the given pages. Ids not in the collection are ignored.
     *
     * @return number of pages removed
     * @throws InvalidSelectionException if {@code ids} is empty or covers every page;
     *                                   nothing is changed
     */
    public int delete(Set<UUID> ids) throws InvalidSelectionException {
        int removed;
        lock.lock();
        try {
            if (ids == null || ids.isEmpty()) {
                throw new InvalidSelectionException(InvalidSelectionException.Reason.EMPTY_SELECTION);
            }
            if (coversAllLocked(ids)) {
                throw new InvalidSelectionException(InvalidSelectionException.Reason.ALL_PAGES_SELECTED);
            }
            removed = removeLocked(ids);
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Deleted {} page(s)", removed);
            fireChanged();
        }
        return removed;
    }

    /** {@link #delete} applied to the current selection. */
    public int deleteSelected() throws InvalidSelectionException {
        return delete(selection());
    }

    /**
     * Remove a single page. Unlike {@link #delete} this may empty the collection.
     *
     * @return false if the page was not present
     */
    public boolean removeOne(UUID id) {
        lock.lock();
        try {
            if (indexOfLocked(id) < 0) return false;
            removeLocked(Set.of(id));
        } finally {
            lock.unlock();
        }
        fireChanged();
        return true;
    }

    /**
     * Move page {@code from} into the slot currently held by page {@code to}:
     * remove it, then insert it at {@code to}'s index as it was before the removal.
     * No-op if either page is absent or they are the same page.
     */
    public void move(UUID from, UUID to) {
        lock.lock();
        try {
            int fromIndex = indexOfLocked(from);
            int toIndex = indexOfLocked(to);
            if (fromIndex < 0 || toIndex < 0 || fromIndex == toIndex) return;
            PageEntry entry = entries.remove(fromIndex);
            entries.add(toIndex, entry);
            reindexLocked();
        } finally {
            lock.unlock();
        }
        fireChanged();
    }

    public void reverse() {
        lock.lock();
        try {
            if (entries.size() < 2) return;
            Collections.reverse(entries);
            reindexLocked();
        } finally {
            lock.unlock();
        }
        fireChanged();
    }

    /** Cancel all thumbnail work and drop every page, the selection, all sources and the cache. */
    public void clear() {
        lock.lock();
        try {
            pipeline.cancelAll();
            entries.clear();
            selection.clear();
            sources.clear();
            cache.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cleared all pages");
        fireChanged();
    }

    // ------------------------------------------------------------ selection

    public void select(UUID id) {
        boolean changed;
        lock.lock();
        try {
            changed = indexOfLocked(id) >= 0 && selection.add(id);
        } finally {
            lock.unlock();
        }
        if (changed) fireChanged();
    }

    public void deselect(UUID id) {
        boolean changed;
        lock.lock();
        try {
            changed = selection.remove(id);
        } finally {
            lock.unlock();
        }
        if (changed) fireChanged();
    }

    public void toggleSelection(UUID id) {
        lock.lock();
        try {
            if (indexOfLocked(id) < 0) return;
            if (!selection.remove(id)) selection.add(id);
        } finally {
            lock.unlock();
        }
        fireChanged();
    }

    public void selectAll() {
        lock.lock();
        try {
            for (PageEntry e : entries) selection.add(e.id());
        } finally {
            lock.unlock();
        }
        fireChanged();
    }

    public void clearSelection() {
        boolean changed;
        lock.lock();
        try {
            changed = !selection.isEmpty();
            selection.clear();
        } finally {
            lock.unlock();
        }
        if (changed) fireChanged();
    }

    // ------------------------------------------------------------ read-only views

    /** Snapshot of the pages in display order. */
    public List<PageEntry> pages() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public Optional<PageEntry> get(UUID id) {
        lock.lock();
        try {
            int i = indexOfLocked(id);
            return i < 0 ? Optional.empty() : Optional.of(entries.get(i));
        } finally {
            lock.unlock();
        }
    }

    /** Page references in display order, for export. */
    public List<PageHandle> pageHandles() {
        lock.lock();
        try {
            List<PageHandle> handles = new ArrayList<>(entries.size());
            for (PageEntry e : entries) handles.add(e.page());
            return handles;
        } finally {
            lock.unlock();
        }
    }

    public Set<UUID> selection() {
        lock.lock();
        try {
            return Set.copyOf(selection);
        } finally {
            lock.unlock();
        }
    }

    public boolean isSelected(UUID id) {
        lock.lock();
        try {
            return selection.contains(id);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Number of distinct source documents that still contribute pages. */
    public int documentCount() {
        lock.lock();
        try {
            Set<UUID> ids = new HashSet<>();
            for (PageEntry e : entries) ids.add(e.sourceId());
            return ids.size();
        } finally {
            lock.unlock();
        }
    }

    public int pendingRenderCount() {
        return pipeline.pendingCount();
    }

    /** Completes once all thumbnail work scheduled so far has settled. */
    public CompletableFuture<Void> thumbnailsSettled() {
        return thumbnailWork.get();
    }

    // ------------------------------------------------------------ listeners

    public void addChangeListener(Runnable listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(Runnable listener) {
        listeners.remove(listener);
    }

    // ------------------------------------------------------------ publishing

    /** Called by the pipeline from a render thread. */
    boolean publishThumbnail(UUID pageId, RenderToken token, BufferedImage thumbnail) {
        lock.lock();
        try {
            if (token.isCancelled()) return false;
            int i = indexOfLocked(pageId);
            if (i < 0) return false;
            entries.set(i, entries.get(i).withThumbnail(thumbnail));
        } finally {
            lock.unlock();
        }
        fireChanged();
        return true;
    }

    // ------------------------------------------------------------ internals

    private boolean coversAllLocked(Collection<UUID> ids) {
        for (PageEntry e : entries) {
            if (!ids.contains(e.id())) return false;
        }
        return true;
    }

    private int removeLocked(Set<UUID> ids) {
        for (UUID id : ids) pipeline.cancel(id);

        int before = entries.size();
        entries.removeIf(e -> ids.contains(e.id()));
        selection.removeAll(ids);
        reindexLocked();
        releaseUnreferencedSourcesLocked();
        return before - entries.size();
    }

    private void releaseUnreferencedSourcesLocked() {
        Set<UUID> referenced = new HashSet<>();
        for (PageEntry e : entries) referenced.add(e.sourceId());
        for (UUID sourceId : sources.ids()) {
            if (!referenced.contains(sourceId)) {
                cache.invalidate(sourceId);
                sources.release(sourceId);
            }
        }
    }

    private int indexOfLocked(UUID id) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).id().equals(id)) return i;
        }
        return -1;
    }

    private void reindexLocked() {
        for (int i = 0; i < entries.size(); i++) {
            PageEntry e = entries.get(i);
            if (e.displayIndex() != i + 1) entries.set(i, e.withDisplayIndex(i + 1));
        }
    }

    private void fireChanged() {
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Page collection listener failed", e);
            }
        }
    }
}
