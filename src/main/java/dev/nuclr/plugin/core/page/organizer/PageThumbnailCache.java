package dev.nuclr.plugin.core.page.organizer;

import java.awt.image.BufferedImage;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Thread-safe LRU cache for page thumbnails, bounded by entry count and total byte cost.
 * Key: (sourceId, pageIndex, width, height). The key never depends on a page's position
 * in the collection, so reordering keeps cached thumbnails valid.
 */
public final class PageThumbnailCache {

    public record Key(UUID sourceId, int pageIndex, int width, int height) {

        public static Key of(PageHandle page, ThumbnailSize size) {
            return new Key(page.sourceId(), page.pageIndex(), size.width(), size.height());
        }
    }

    private record Slot(BufferedImage image, long cost) {}

    private final LinkedHashMap<Key, Slot> cache = new LinkedHashMap<>(16, 0.75f, true);
    private final int maxEntries;
    private final long maxBytes;

    private long totalCost;
    private long hits;
    private long misses;
    private long evictions;

    public PageThumbnailCache(int maxEntries, long maxBytes) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        if (maxBytes < 1) throw new IllegalArgumentException("maxBytes must be >= 1");
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    public static PageThumbnailCache fromSettings(OrganizerSettings settings) {
        return new PageThumbnailCache(settings.getCacheMaxEntries(), settings.getCacheMaxBytes());
    }

    /** Approximate resident size of a decoded image: 4 bytes per pixel. */
    public static long costOf(BufferedImage image) {
        return (long) image.getWidth() * image.getHeight() * 4L;
    }

    public synchronized BufferedImage get(Key key) {
        Slot slot = cache.get(key);
        if (slot == null) {
            misses++;
            return null;
        }
        hits++;
        return slot.image();
    }

    public void put(Key key, BufferedImage image) {
        put(key, image, costOf(image));
    }

    /**
     * Inserts or replaces an entry, then evicts least recently used entries until both
     * budgets hold. The entry just inserted is never evicted, so a single entry larger
     * than the byte budget is kept alone.
     */
    public synchronized void put(Key key, BufferedImage image, long cost) {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0");
        Slot previous = cache.put(key, new Slot(image, cost));
        if (previous != null) totalCost -= previous.cost();
        totalCost += cost;
        evictOverflow(key);
    }

    /**
     * Stores the entry only if {@code token} is still live. The check and the insert
     * happen under the cache monitor, so a cancel followed by {@link #invalidate}
     * can never leave the entry behind.
     *
     * @return false if the token was cancelled and nothing was stored
     */
    public synchronized boolean putIfLive(Key key, BufferedImage image, RenderToken token) {
        if (token.isCancelled()) return false;
        put(key, image, costOf(image));
        return true;
    }

    public synchronized void invalidate(UUID sourceId) {
        Iterator<Map.Entry<Key, Slot>> it = cache.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Key, Slot> e = it.next();
            if (e.getKey().sourceId().equals(sourceId)) {
                totalCost -= e.getValue().cost();
                it.remove();
            }
        }
    }

    public synchronized void clear() {
        cache.clear();
        totalCost = 0;
    }

    public synchronized int size() {
        return cache.size();
    }

    public synchronized long totalCost() {
        return totalCost;
    }

    public synchronized long hitCount() {
        return hits;
    }

    public synchronized long missCount() {
        return misses;
    }

    public synchronized long evictionCount() {
        return evictions;
    }

    // Iteration order of an access-ordered map is eldest first; the newest key sits at the tail.
    private void evictOverflow(Key keep) {
        Iterator<Map.Entry<Key, Slot>> it = cache.entrySet().iterator();
        while ((cache.size() > maxEntries || totalCost > maxBytes) && it.hasNext()) {
            Map.Entry<Key, Slot> eldest = it.next();
            if (eldest.getKey().equals(keep)) continue;
            totalCost -= eldest.getValue().cost();
            it.remove();
            evictions++;
        }
    }
}
