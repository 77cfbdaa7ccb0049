package dev.nuclr.plugin.core.page.organizer;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools owned by the organizer: a fixed pool for thumbnail rendering and
 * a cached pool for file I/O (imports and exports).
 */
@Slf4j
public final class OrganizerExecutors implements AutoCloseable {

    private final ExecutorService renderPool;
    private final ExecutorService ioPool;

    private OrganizerExecutors(ExecutorService renderPool, ExecutorService ioPool) {
        this.renderPool = renderPool;
        this.ioPool = ioPool;
    }

    public static OrganizerExecutors create(OrganizerSettings settings) {
        ExecutorService renderPool = Executors.newFixedThreadPool(
                settings.getRenderThreads(), named("thumbnail-render-"));
        ExecutorService ioPool = Executors.newCachedThreadPool(named("organizer-io-"));
        return new OrganizerExecutors(renderPool, ioPool);
    }

    public ExecutorService renderPool() {
        return renderPool;
    }

    public ExecutorService ioPool() {
        return ioPool;
    }

    @Override
    public void close() {
        renderPool.shutdown();
        ioPool.shutdown();
        try {
            await(ioPool, "ioPool");
            await(renderPool, "renderPool");
        } catch (InterruptedException e) {
            renderPool.shutdownNow();
            ioPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger n = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + n.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }

    private static void await(ExecutorService es, String name) throws InterruptedException {
        if (!es.awaitTermination(10, TimeUnit.SECONDS)) {
            es.shutdownNow();
            if (!es.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate: {}", name);
            }
        }
    }
}
