package dev.nuclr.plugin.core.page.organizer;

/**
 * Thrown when a bulk delete is requested with no pages, or with every page, selected.
 * The collection is left unchanged.
 */
public class InvalidSelectionException extends PageOrganizerException {

    public enum Reason {
        EMPTY_SELECTION,
        ALL_PAGES_SELECTED
    }

    private final Reason reason;

    public InvalidSelectionException(Reason reason) {
        super(reason == Reason.EMPTY_SELECTION
                ? "No pages selected."
                : "Cannot delete all pages.");
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
