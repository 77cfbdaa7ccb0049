package dev.nuclr.plugin.core.page.organizer;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open source documents by id. A released document is closed.
 */
@Slf4j
public class SourceDocumentRegistry {

    private final ConcurrentHashMap<UUID, SourceDocument> sources = new ConcurrentHashMap<>();

    public UUID register(SourceDocument source) {
        sources.put(source.id(), source);
        return source.id();
    }

    public Optional<SourceDocument> lookup(UUID sourceId) {
        return Optional.ofNullable(sources.get(sourceId));
    }

    public Set<UUID> ids() {
        return Set.copyOf(sources.keySet());
    }

    /** Unregisters and closes the source. Returns false if it was not registered. */
    public boolean release(UUID sourceId) {
        SourceDocument source = sources.remove(sourceId);
        if (source == null) return false;
        source.close();
        log.debug("Released source '{}'", source.label());
        return true;
    }

    public void clear() {
        List<UUID> ids = new ArrayList<>(sources.keySet());
        for (UUID id : ids) {
            release(id);
        }
    }

    public int size() {
        return sources.size();
    }
}
