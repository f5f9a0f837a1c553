package io.github.dialogcollection.fx;

import javafx.beans.property.ReadOnlyDoubleProperty;
import javafx.beans.value.ChangeListener;

import java.util.function.DoubleConsumer;

/**
 * Integer position of a window, kept in sync with the window's x/y properties so that moves
 * made by the user are seen by placement.
 * <p>
 * Undefined (NaN) coordinates, as reported by windows that have never been shown, are ignored.
 */
final class TrackedPosition {

    private final ReadOnlyDoubleProperty xProperty;
    private final ReadOnlyDoubleProperty yProperty;
    private final DoubleConsumer moveX;
    private final DoubleConsumer moveY;
    private final ChangeListener<Number> positionListener;

    private int x;
    private int y;

    /**
     * @param xProperty Live x coordinate of the window
     * @param yProperty Live y coordinate of the window
     * @param moveX Moves the window horizontally
     * @param moveY Moves the window vertically
     */
    TrackedPosition(ReadOnlyDoubleProperty xProperty, ReadOnlyDoubleProperty yProperty,
                    DoubleConsumer moveX, DoubleConsumer moveY) {
        this.xProperty = xProperty;
        this.yProperty = yProperty;
        this.moveX = moveX;
        this.moveY = moveY;
        this.positionListener = (obs, oldValue, newValue) -> sync();

        xProperty.addListener(positionListener);
        yProperty.addListener(positionListener);
        sync();
    }

    int getX() {
        return x;
    }

    int getY() {
        return y;
    }

    void moveX(int newX) {
        x = newX;
        moveX.accept(newX);
    }

    void moveY(int newY) {
        y = newY;
        moveY.accept(newY);
    }

    /**
     * Stop following the window.
     */
    void detach() {
        xProperty.removeListener(positionListener);
        yProperty.removeListener(positionListener);
    }

    private void sync() {
        double liveX = xProperty.get();
        double liveY = yProperty.get();
        if (Double.isFinite(liveX)) {
            x = (int) Math.round(liveX);
        }
        if (Double.isFinite(liveY)) {
            y = (int) Math.round(liveY);
        }
    }
}
