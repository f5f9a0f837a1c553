package io.github.dialogcollection.fx;

import io.github.dialogcollection.DialogHandle;
import javafx.scene.Parent;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link DialogHandle} backed by a JavaFX {@link Stage}.
 * <p>
 * The size is captured once, when the handle is created, since placement assumes dialog
 * sizes never change. Create the handle after the stage's scene has been set so that the
 * captured size is meaningful.
 */
public class StageDialogHandle implements DialogHandle {

    private static final Logger logger = LoggerFactory.getLogger(StageDialogHandle.class);

    // Used when the stage has no size yet
    static final int DEFAULT_WIDTH = 400;
    static final int DEFAULT_HEIGHT = 300;

    private final Stage stage;
    private final int width;
    private final int height;

    private final TrackedPosition position;

    public StageDialogHandle(Stage stage) {
        this.stage = Objects.requireNonNull(stage, "stage");

        this.width = measure(stage.getWidth(), true, DEFAULT_WIDTH);
        this.height = measure(stage.getHeight(), false, DEFAULT_HEIGHT);
        this.position = new TrackedPosition(stage.xProperty(), stage.yProperty(), stage::setX, stage::setY);
    }

    /**
     * Size of a stage along one axis. Stages that have never been shown report NaN, in which
     * case the preferred size of the scene's root node is used.
     */
    private int measure(double stageSize, boolean horizontal, int defaultSize) {
        double size = stageSize;
        if (!(size > 0) && stage.getScene() != null && stage.getScene().getRoot() != null) {
            Parent root = stage.getScene().getRoot();
            root.applyCss();
            size = horizontal ? root.prefWidth(-1) : root.prefHeight(-1);
        }
        return size > 0 ? (int) Math.ceil(size) : defaultSize;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Current x coordinate, following any move made by the user.
     */
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
        stage.close();
        logger.trace("Closed stage '{}'", stage.getTitle());
    }

    @Override
    public void refresh() {
        if (stage.getScene() != null && stage.getScene().getRoot() != null) {
            stage.getScene().getRoot().applyCss();
            stage.getScene().getRoot().requestLayout();
        }
    }

    @Override
    public String toString() {
        return String.format("StageDialogHandle['%s' at (%d, %d) size %dx%d]",
                stage.getTitle(), getX(), getY(), width, height);
    }
}
