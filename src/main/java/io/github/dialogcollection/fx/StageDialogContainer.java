package io.github.dialogcollection.fx;

import io.github.dialogcollection.DialogContainer;
import io.github.dialogcollection.DialogHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DialogContainer} that shows JavaFX stages.
 * Must be used on the JavaFX application thread.
 */
public class StageDialogContainer implements DialogContainer {

    private static final Logger logger = LoggerFactory.getLogger(StageDialogContainer.class);

    @Override
    public void add(DialogHandle dialog) {
        if (!(dialog instanceof StageDialogHandle stageDialog)) {
            throw new IllegalArgumentException(
                    "Only stage dialogs can be shown, got " + dialog.getClass().getSimpleName());
        }

        if (!stageDialog.getStage().isShowing()) {
            stageDialog.getStage().show();
        }
        stageDialog.getStage().toFront();
        logger.trace("Showing {}", stageDialog);
    }
}
