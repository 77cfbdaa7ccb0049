package dev.nuclr.plugin.core.page.organizer;

/**
 * Outcome of the last user-facing operation, for transient UI feedback.
 */
public record StatusMessage(Kind kind, String text) {

    public enum Kind { SUCCESS, ERROR }

    public static StatusMessage success(String text) {
        return new StatusMessage(Kind.SUCCESS, text);
    }

    public static StatusMessage error(String text) {
        return new StatusMessage(Kind.ERROR, text);
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }
}
