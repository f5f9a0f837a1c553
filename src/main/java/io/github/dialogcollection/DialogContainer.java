package io.github.dialogcollection;

/**
 * Host UI tree that newly opened dialogs are attached to.
 */
@FunctionalInterface
public interface DialogContainer {

    /**
     * Make the dialog part of the visible UI. Called once per successful open,
     * after the dialog has been given its position.
     *
     * @param dialog The dialog being opened
     */
    void add(DialogHandle dialog);
}
