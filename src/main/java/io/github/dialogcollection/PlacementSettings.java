package io.github.dialogcollection;

/**
 * Tunable constants of the placement algorithm.
 *
 * @param anchorX X coordinate of the preferred top-left corner
 * @param anchorY Y coordinate of the preferred top-left corner
 * @param gap Spacing kept between a new dialog and the dialog it is placed next to
 */
public record PlacementSettings(int anchorX, int anchorY, int gap) {

    public static final int DEFAULT_ANCHOR_X = 10;
    public static final int DEFAULT_ANCHOR_Y = 10;
    public static final int DEFAULT_GAP = 5;

    public static final PlacementSettings DEFAULT =
            new PlacementSettings(DEFAULT_ANCHOR_X, DEFAULT_ANCHOR_Y, DEFAULT_GAP);

    public PlacementSettings {
        if (anchorX < 0 || anchorY < 0) {
            throw new IllegalArgumentException(
                    String.format("Anchor must not be negative: (%d, %d)", anchorX, anchorY));
        }
        if (gap < 0) {
            throw new IllegalArgumentException("Gap must not be negative: " + gap);
        }
    }

    /**
     * Create an updated copy with a new anchor.
     */
    public PlacementSettings withAnchor(int newAnchorX, int newAnchorY) {
        return new PlacementSettings(newAnchorX, newAnchorY, gap);
    }

    /**
     * Create an updated copy with a new gap.
     */
    public PlacementSettings withGap(int newGap) {
        return new PlacementSettings(anchorX, anchorY, newGap);
    }

    public DialogPosition anchor() {
        return new DialogPosition(anchorX, anchorY);
    }
}
