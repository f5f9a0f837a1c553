package io.github.dialogcollection.fx;

import io.github.dialogcollection.DialogBounds;
import io.github.dialogcollection.DialogCollection;
import io.github.dialogcollection.DialogHandle;
import io.github.dialogcollection.DialogPlacement;
import io.github.dialogcollection.DisplaySize;
import javafx.beans.property.DoubleProperty;
import javafx.beans.property.SimpleDoubleProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TrackedPosition, using plain properties in place of a window's x/y.
 */
class TrackedPositionTest {

    private DoubleProperty windowX;
    private DoubleProperty windowY;
    private TrackedPosition position;

    @BeforeEach
    void setUp() {
        windowX = new SimpleDoubleProperty(Double.NaN);
        windowY = new SimpleDoubleProperty(Double.NaN);
        position = new TrackedPosition(windowX, windowY, windowX::set, windowY::set);
    }

    @Test
    @DisplayName("Moving through the tracker moves the window")
    void move_updatesWindow() {
        position.moveX(115);
        position.moveY(65);

        assertEquals(115, position.getX());
        assertEquals(65, position.getY());
        assertEquals(115.0, windowX.get());
        assertEquals(65.0, windowY.get());
    }

    @Test
    @DisplayName("Moves made outside the tracker are picked up")
    void windowMovedByUser_isReflected() {
        position.moveX(10);
        position.moveY(10);

        windowX.set(42.6);
        windowY.set(300.2);

        assertEquals(43, position.getX());
        assertEquals(300, position.getY());
    }

    @Test
    @DisplayName("Undefined window coordinates keep the last known position")
    void undefinedCoordinates_areIgnored() {
        position.moveX(20);
        windowX.set(Double.NaN);

        assertEquals(20, position.getX());
        assertEquals(0, position.getY());
    }

    @Test
    @DisplayName("Detached tracker no longer follows the window")
    void detach_stopsFollowing() {
        position.moveX(10);
        position.detach();

        windowX.set(500);

        assertEquals(10, position.getX());
    }

    @Test
    @DisplayName("A dialog dragged by the user is avoided by the next placement")
    void draggedDialog_isAvoidedByNextOpen() {
        DialogCollection dialogs = new DialogCollection(dialog -> { },
                new DialogPlacement(() -> new DisplaySize(1920, 1080)));
        WindowDialog first = new WindowDialog(100, 50);
        dialogs.open("first", first);
        assertEquals(10, first.getX());
        assertEquals(10, first.getY());

        // User drags the first dialog to where the second would otherwise go
        first.windowY.set(65);

        WindowDialog second = new WindowDialog(100, 50);
        dialogs.open("second", second);

        DialogBounds firstBounds = DialogBounds.of(first);
        DialogBounds secondBounds = DialogBounds.of(second);
        assertEquals(65, firstBounds.y());
        assertFalse(firstBounds.overlaps(secondBounds), firstBounds + " overlaps " + secondBounds);
        assertEquals(10, secondBounds.x());
        assertEquals(10, secondBounds.y());
    }

    /**
     * Dialog whose position lives in window-like properties.
     */
    private static class WindowDialog implements DialogHandle {

        final DoubleProperty windowX = new SimpleDoubleProperty(Double.NaN);
        final DoubleProperty windowY = new SimpleDoubleProperty(Double.NaN);
        private final TrackedPosition position =
                new TrackedPosition(windowX, windowY, windowX::set, windowY::set);
        private final int width;
        private final int height;

        WindowDialog(int width, int height) {
            this.width = width;
            this.height = height;
        }

        @Override
        public int getX() {
            return position.getX();
        }

        @Override
        public void setX(int x) {
            position.moveX(x);
        }

        @Override
        public int getY() {
            return position.getY();
        }

        @Override
        public void setY(int y) {
            position.moveY(y);
        }

        @Override
        public int getWidth() {
            return width;
        }

        @Override
        public int getHeight() {
            return height;
        }

        @Override
        public void close() {
            position.detach();
        }

        @Override
        public void refresh() {
        }
    }
}
