package dev.nuclr.plugin.core.page.organizer;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of importing a batch of files. Files that failed to open are listed
 * in {@code failures}; the others were added.
 */
public record ImportResult(int addedSources, int addedPages, List<Failure> failures) {

    public record Failure(Path file, String message) {}

    public ImportResult {
        failures = List.copyOf(failures);
    }

    public static ImportResult empty() {
        return new ImportResult(0, 0, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
