package io.github.dialogcollection;

/**
 * Immutable snapshot of the rectangle occupied by a dialog.
 * <p>
 * Taken from a {@link DialogHandle} at the moment placement runs for another dialog,
 * never stored beyond that computation.
 *
 * @param x X coordinate of the top-left corner
 * @param y Y coordinate of the top-left corner
 * @param width Width of the rectangle
 * @param height Height of the rectangle
 */
public record DialogBounds(int x, int y, int width, int height) {

    /**
     * Capture the current rectangle of a dialog.
     */
    public static DialogBounds of(DialogHandle dialog) {
        return new DialogBounds(dialog.getX(), dialog.getY(), dialog.getWidth(), dialog.getHeight());
    }

    /**
     * Check whether this rectangle overlaps another one. Rectangles that only share an edge
     * do not overlap.
     */
    public boolean overlaps(DialogBounds other) {
        return DialogPlacement.rectanglesOverlap(x, y, width, height,
                other.x, other.y, other.width, other.height);
    }

    /**
     * Check whether this rectangle overlaps a rectangle of the given position and size.
     */
    public boolean overlaps(int otherX, int otherY, int otherWidth, int otherHeight) {
        return DialogPlacement.rectanglesOverlap(x, y, width, height,
                otherX, otherY, otherWidth, otherHeight);
    }

    /**
     * Top-left corner of this rectangle.
     */
    public DialogPosition position() {
        return new DialogPosition(x, y);
    }

    @Override
    public String toString() {
        return String.format("DialogBounds[(%d, %d) size %dx%d]", x, y, width, height);
    }
}
