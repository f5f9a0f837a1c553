package io.github.dialogcollection.fx;

import io.github.dialogcollection.DisplaySize;
import javafx.geometry.Rectangle2D;
import javafx.stage.Screen;

/**
 * Display size taken from the JavaFX primary screen.
 */
public final class ScreenDisplaySize {

    private ScreenDisplaySize() {
        // Utility class - no instantiation
    }

    /**
     * Current visual bounds of the primary screen, excluding task bars and docks.
     * Requires the JavaFX toolkit to be running.
     */
    public static DisplaySize primary() {
        Rectangle2D bounds = Screen.getPrimary().getVisualBounds();
        return new DisplaySize((int) Math.floor(bounds.getMaxX()), (int) Math.floor(bounds.getMaxY()));
    }
}
