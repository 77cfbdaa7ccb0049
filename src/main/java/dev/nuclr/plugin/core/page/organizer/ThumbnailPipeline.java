package dev.nuclr.plugin.core.page.organizer;

import dev.nuclr.plugin.core.page.organizer.backend.PageRenderBackend;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders thumbnails for newly added pages in fixed-size batches.
 *
 * <p>Batches run strictly one after another, across all schedule calls; the pages
 * of one batch render concurrently on the render pool. Peak concurrency is
 * therefore the batch size, however many pages were added and however many
 * imports overlap. Sequencing is done by chaining futures onto a single queue
 * tail, so no thread waits for a batch to finish.
 *
 * <p>Every scheduled page holds a {@link RenderToken} until its work settles.
 * Scheduling a page again cancels its previous token. Cancellation is advisory:
 * it is observed before the render, after the render and at publish time, but a
 * render already inside the backend runs to completion and is then discarded.
 */
@Slf4j
public class ThumbnailPipeline {

    /**
     * Receives a rendered thumbnail. Returns false when the result was dropped
     * because the token was cancelled or the page is gone.
     */
    @FunctionalInterface
    public interface Publisher {
        boolean publish(UUID pageId, RenderToken token, BufferedImage thumbnail);
    }

    /** A registered render: the page and the token that must stay live for it to publish. */
    record Job(UUID pageId, PageHandle page, RenderToken token) {}

    // -------------------------------------------------------------- state

    private final PageRenderBackend backend;
    private final PageThumbnailCache cache;
    private final ThumbnailSize targetSize;
    private final int batchSize;
    private final long timeoutSeconds;
    private final Executor renderPool;

    /** At most one live token per page id. */
    private final Map<UUID, RenderToken> pending = new ConcurrentHashMap<>();

    private final Object queueLock = new Object();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);   // guarded by queueLock

    // ----------------------------------------------------------- constructor

    public ThumbnailPipeline(PageRenderBackend backend,
                             PageThumbnailCache cache,
                             ThumbnailSize targetSize,
                             int batchSize,
                             long timeoutSeconds,
                             Executor renderPool) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.backend = backend;
        this.cache = cache;
        this.targetSize = targetSize;
        this.batchSize = batchSize;
        this.timeoutSeconds = timeoutSeconds;
        this.renderPool = renderPool;
    }

    public static ThumbnailPipeline fromSettings(OrganizerSettings settings,
                                                 PageRenderBackend backend,
                                                 PageThumbnailCache cache,
                                                 Executor renderPool) {
        return new ThumbnailPipeline(backend, cache, settings.getThumbnailSize(),
                settings.getBatchSize(), settings.getRenderTimeoutSeconds(), renderPool);
    }

    // ------------------------------------------------------------ public API

    /**
     * Schedule thumbnails for {@code entries}, in order.
     *
     * @return a future that completes once every batch has settled; it never
     *         completes exceptionally, failures are per page
     */
    public CompletableFuture<Void> schedule(List<PageEntry> entries, Publisher publisher) {
        return start(register(entries), publisher);
    }

    /**
     * Create a live token for each entry, cancelling any previous one. Callers that
     * must make the new pages and their tokens visible together register under
     * their own lock and {@link #start} afterwards.
     */
    List<Job> register(List<PageEntry> entries) {
        List<Job> jobs = new ArrayList<>(entries.size());
        for (PageEntry entry : entries) {
            RenderToken token = new RenderToken(entry.id());
            RenderToken previous = pending.put(entry.id(), token);
            if (previous != null) {
                previous.cancel();
                log.debug("Replaced pending thumbnail task for page {}", entry.id());
            }
            jobs.add(new Job(entry.id(), entry.page(), token));
        }
        return jobs;
    }

    /** Append the registered jobs to the batch queue. */
    CompletableFuture<Void> start(List<Job> jobs, Publisher publisher) {
        if (jobs.isEmpty()) return CompletableFuture.completedFuture(null);

        CompletableFuture<Void> chain;
        synchronized (queueLock) {
            chain = tail;
            for (int from = 0; from < jobs.size(); from += batchSize) {
                List<Job> batch = jobs.subList(from, Math.min(from + batchSize, jobs.size()));
                chain = chain.thenCompose(v -> runBatch(batch, publisher));
            }
            chain = chain.handle((v, ex) -> {
                if (ex != null) log.warn("Thumbnail batch chain failed", ex);
                return null;
            });
            tail = chain;
        }
        log.debug("Queued {} thumbnail(s) in {} batch(es)", jobs.size(),
                (jobs.size() + batchSize - 1) / batchSize);
        return chain;
    }

    /** Cancel the pending task for one page, if any. */
    public void cancel(UUID pageId) {
        RenderToken token = pending.remove(pageId);
        if (token != null) {
            token.cancel();
            log.debug("Cancelled thumbnail task for page {}", pageId);
        }
    }

    public void cancelAll() {
        for (UUID id : List.copyOf(pending.keySet())) {
            cancel(id);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(UUID pageId) {
        return pending.containsKey(pageId);
    }

    // -------------------------------------------------------------- internal

    private CompletableFuture<Void> runBatch(List<Job> batch, Publisher publisher) {
        CompletableFuture<?>[] tasks = new CompletableFuture<?>[batch.size()];
        for (int i = 0; i < batch.size(); i++) {
            tasks[i] = submit(batch.get(i), publisher);
        }
        return CompletableFuture.allOf(tasks);
    }

    private CompletableFuture<Void> submit(Job job, Publisher publisher) {
        CompletableFuture<Void> task;
        try {
            task = CompletableFuture.runAsync(() -> process(job, publisher), renderPool);
        } catch (RejectedExecutionException e) {
            job.token().cancel();
            pending.remove(job.pageId(), job.token());
            log.debug("Render pool shut down, dropping thumbnail for page {}", job.pageId());
            return CompletableFuture.completedFuture(null);
        }
        if (timeoutSeconds <= 0) return task;

        return task.orTimeout(timeoutSeconds, TimeUnit.SECONDS).exceptionally(ex -> {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof TimeoutException) {
                // The render keeps its worker; the flipped token makes its late result a no-op.
                job.token().cancel();
                pending.remove(job.pageId(), job.token());
                log.warn("Thumbnail render for page {} timed out after {}s, abandoned",
                        job.pageId(), timeoutSeconds);
            } else {
                log.warn("Thumbnail task for page {} failed", job.pageId(), cause);
            }
            return null;
        });
    }

    private void process(Job job, Publisher publisher) {
        RenderToken token = job.token();
        try {
            if (token.isCancelled()) {
                log.debug("Skipping cancelled thumbnail for page {}", job.pageId());
                return;
            }

            PageThumbnailCache.Key key = PageThumbnailCache.Key.of(job.page(), targetSize);
            BufferedImage image = cache.get(key);
            if (image != null) {
                log.debug("Cache hit: page {} of {}", job.page().pageIndex(), job.page().sourceId());
            } else {
                image = backend.render(job.page(), targetSize);
                if (!cache.putIfLive(key, image, token)) {
                    log.debug("Discarding thumbnail for cancelled page {}", job.pageId());
                    return;
                }
            }

            if (!publisher.publish(job.pageId(), token, image)) {
                log.debug("Thumbnail for page {} dropped at publish", job.pageId());
            }
        } catch (Exception e) {
            log.warn("{} failed to render page {} of '{}': {}", backend.name(),
                    job.page().pageIndex(), job.page().source().label(), e.toString());
        } finally {
            pending.remove(job.pageId(), token);
        }
    }
}
