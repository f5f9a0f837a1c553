package io.github.dialogcollection;

/**
 * Capabilities a dialog must expose to be tracked by a {@link DialogCollection}.
 * <p>
 * The collection only ever moves a dialog and invokes its lifecycle callbacks.
 * Width and height are declared by the dialog's own content layout and must stay
 * fixed for the lifetime of the handle.
 * <p>
 * Coordinates are integer units of the host display, measured from the top-left corner.
 */
public interface DialogHandle {

    int getX();

    void setX(int x);

    int getY();

    void setY(int y);

    /**
     * Width of the dialog, always greater than zero.
     */
    int getWidth();

    /**
     * Height of the dialog, always greater than zero.
     */
    int getHeight();

    /**
     * Tear down any host resources held by this dialog.
     */
    void close();

    /**
     * Recompute the dialog's internal layout. Must not change its position.
     */
    void refresh();
}
