package dev.nuclr.plugin.core.page.organizer.backend;

import dev.nuclr.plugin.core.page.organizer.SourceDocument;
import dev.nuclr.plugin.core.page.organizer.SourceOpenException;

import java.nio.file.Path;

/**
 * Opens user-selected files as source documents.
 */
public interface DocumentSource {

    /**
     * Read and open the file. Blocks on I/O.
     *
     * @throws EncryptedSourceException if the document requires a password
     * @throws SourceOpenException      if the file cannot be read or is not a valid document
     */
    SourceDocument open(Path file) throws SourceOpenException;

    /** Thrown when the document requires a password. */
    class EncryptedSourceException extends SourceOpenException {
        public EncryptedSourceException(Path file) {
            super(file, "Encrypted PDF \u2013 cannot open " + file.getFileName());
        }
    }
}
