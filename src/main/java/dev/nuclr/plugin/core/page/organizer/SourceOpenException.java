package dev.nuclr.plugin.core.page.organizer;

import java.nio.file.Path;

/**
 * A candidate source file could not be opened as a PDF.
 */
public class SourceOpenException extends PageOrganizerException {

    private final Path file;

    public SourceOpenException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public SourceOpenException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
