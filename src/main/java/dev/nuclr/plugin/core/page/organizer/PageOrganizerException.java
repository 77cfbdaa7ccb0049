package dev.nuclr.plugin.core.page.organizer;

/**
 * Base class for recoverable page organizer failures.
 */
public class PageOrganizerException extends Exception {

    public PageOrganizerException(String message) {
        super(message);
    }

    public PageOrganizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
