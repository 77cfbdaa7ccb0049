package dev.nuclr.plugin.core.page.organizer;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for one scheduled thumbnail render. Checked before rendering,
 * after rendering and again at publish time.
 */
public final class RenderToken {

    private final UUID pageId;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    RenderToken(UUID pageId) {
        this.pageId = pageId;
    }

    UUID pageId() {
        return pageId;
    }

    void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
