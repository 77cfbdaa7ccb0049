package dev.nuclr.plugin.core.page.organizer;

/**
 * Target box for a thumbnail, in pixels at scale 1.
 */
public record ThumbnailSize(int width, int height) {

    public static final ThumbnailSize DEFAULT = new ThumbnailSize(140, 180);

    public ThumbnailSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Thumbnail size must be positive: " + width + "x" + height);
        }
    }

    /** Scale that fits a page of the given size into this box, preserving aspect ratio. */
    public float scaleToFit(float pageWidth, float pageHeight) {
        if (pageWidth <= 0 || pageHeight <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageWidth + "x" + pageHeight);
        }
        return Math.min(width / pageWidth, height / pageHeight);
    }
}
