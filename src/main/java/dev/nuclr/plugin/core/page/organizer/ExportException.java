package dev.nuclr.plugin.core.page.organizer;

/**
 * Writing the merged document failed. Not retried.
 */
public class ExportException extends PageOrganizerException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
