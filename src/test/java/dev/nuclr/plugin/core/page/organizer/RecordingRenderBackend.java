package dev.nuclr.plugin.core.page.organizer;

import dev.nuclr.plugin.core.page.organizer.backend.PageRenderBackend;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Instrumented backend: counts renders, tracks concurrency, can hold every render
 * until {@link #release()} and can fail chosen page indexes.
 */
public class RecordingRenderBackend implements PageRenderBackend {

    private final AtomicInteger renders = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final Set<Integer> failingPages = ConcurrentHashMap.newKeySet();
    private final CountDownLatch gate;

    public RecordingRenderBackend() {
        this(false);
    }

    public RecordingRenderBackend(boolean gated) {
        this.gate = new CountDownLatch(gated ? 1 : 0);
    }

    public RecordingRenderBackend failOn(int pageIndex) {
        failingPages.add(pageIndex);
        return this;
    }

    @Override
    public String name() {
        return "Recording";
    }

    @Override
    public BufferedImage render(PageHandle page, ThumbnailSize size) throws Exception {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            renders.incrementAndGet();
            if (!gate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never released");
            }
            if (failingPages.contains(page.pageIndex())) {
                throw new IOException("broken page " + page.pageIndex());
            }
            return new BufferedImage(size.width(), size.height(), BufferedImage.TYPE_INT_RGB);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public void release() {
        gate.countDown();
    }

    public int renderCount() {
        return renders.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    /** Waits until exactly {@code expected} renders are blocked in the backend. */
    public void awaitInFlight(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (inFlight.get() != expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("expected " + expected + " renders in flight, saw " + inFlight.get());
            }
            Thread.sleep(5);
        }
    }
}
