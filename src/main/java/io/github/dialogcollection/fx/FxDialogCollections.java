package io.github.dialogcollection.fx;

import io.github.dialogcollection.DialogCollection;
import io.github.dialogcollection.DialogHandle;
import io.github.dialogcollection.DialogPlacement;
import io.github.dialogcollection.PlacementPreferences;
import io.github.dialogcollection.PlacementSettings;
import javafx.event.EventHandler;
import javafx.stage.Stage;
import javafx.stage.WindowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wiring of a {@link DialogCollection} for JavaFX applications.
 * <p>
 * Typical use, on the JavaFX application thread:
 * <pre>{@code
 * DialogCollection dialogs = FxDialogCollections.create();
 * FxDialogCollections.open(dialogs, "Measurements", stage);
 * }</pre>
 * There is no shared instance; the application keeps the collection in its own UI state.
 */
public final class FxDialogCollections {

    private static final Logger logger = LoggerFactory.getLogger(FxDialogCollections.class);

    private FxDialogCollections() {
        // Utility class - no instantiation
    }

    /**
     * Create a collection using the stored placement settings and the primary screen.
     */
    public static DialogCollection create() {
        return create(PlacementPreferences.load());
    }

    public static DialogCollection create(PlacementSettings settings) {
        logger.debug("Creating JavaFX dialog collection with {}", settings);
        DialogPlacement placement = new DialogPlacement(settings, ScreenDisplaySize::primary);
        return new DialogCollection(new StageDialogContainer(), placement);
    }

    /**
     * Open a stage in the collection, wrapping it in a {@link StageDialogHandle}.
     * When the user closes the stage from its own window decoration, the entry is removed
     * without closing the stage a second time.
     *
     * @param dialogs Collection to open the stage in
     * @param key Unique identifier for the dialog
     * @param stage Stage to open; its scene should already be set
     */
    public static void open(DialogCollection dialogs, String key, Stage stage) {
        if (dialogs.isOpen(key)) {
            return;
        }
        StageDialogHandle handle = new StageDialogHandle(stage);
        dialogs.open(key, handle);
        // Added as a handler so that the caller's own onHidden stays in place
        stage.addEventHandler(WindowEvent.WINDOW_HIDDEN, forgetWhenHidden(dialogs, key, handle));
    }

    /**
     * Handler that forgets a dialog once its window has been hidden by the user.
     * Only the given handle's entry is removed; a later dialog may reuse the key.
     */
    static EventHandler<WindowEvent> forgetWhenHidden(DialogCollection dialogs, String key, DialogHandle handle) {
        return event -> {
            if (dialogs.get(key).orElse(null) == handle) {
                logger.debug("Dialog '{}' was hidden by the user", key);
                dialogs.remove(key);
            }
        };
    }
}
