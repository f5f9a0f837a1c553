package io.github.dialogcollection;

/**
 * Top-left corner of a dialog.
 *
 * @param x X coordinate
 * @param y Y coordinate
 */
public record DialogPosition(int x, int y) {

    /**
     * Squared Euclidean distance to another point.
     */
    public long distanceSquaredTo(DialogPosition other) {
        long dx = (long) x - other.x;
        long dy = (long) y - other.y;
        return dx * dx + dy * dy;
    }

    /**
     * Returns true if neither coordinate is negative.
     */
    public boolean isNonNegative() {
        return x >= 0 && y >= 0;
    }
}
