package io.github.dialogcollection;

/**
 * Size of the display dialogs are placed on, in the same units as dialog positions.
 *
 * @param width Display width
 * @param height Display height
 */
public record DisplaySize(int width, int height) {
}
