package io.github.dialogcollection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the dialogs currently open, each identified by a unique key.
 * <p>
 * This registry:
 * <ul>
 *   <li>Places every newly opened dialog next to the open ones without overlapping them</li>
 *   <li>Attaches newly opened dialogs to the host {@link DialogContainer}</li>
 *   <li>Closes, refreshes or forgets dialogs by key</li>
 * </ul>
 * <p>
 * Operations on a missing key, and {@link #open} on a key that is already open, do nothing.
 * <p>
 * <b>Threading:</b> an instance is meant to be used from the host UI thread only and does
 * no locking of its own.
 */
public final class DialogCollection {

    private static final Logger logger = LoggerFactory.getLogger(DialogCollection.class);

    private final Map<String, DialogHandle> openedDialogs = new LinkedHashMap<>();

    private final DialogContainer container;
    private final DialogPlacement placement;

    /**
     * @param container Host UI tree new dialogs are added to
     * @param placement Placement used to position new dialogs
     */
    public DialogCollection(DialogContainer container, DialogPlacement placement) {
        this.container = Objects.requireNonNull(container, "container");
        this.placement = Objects.requireNonNull(placement, "placement");
    }

    /**
     * Open a dialog under the given key unless the key is already open.
     * <p>
     * The dialog is moved to a free position before it is added to the container. An
     * existing dialog with the same key keeps its position and is not refreshed.
     *
     * @param key Unique, case-sensitive identifier for the dialog
     * @param dialog The dialog to open
     * @throws IllegalArgumentException if the dialog does not have a positive size
     */
    public void open(String key, DialogHandle dialog) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(dialog, "dialog");

        if (openedDialogs.containsKey(key)) {
            logger.trace("Dialog '{}' already open, ignoring", key);
            return;
        }

        int width = dialog.getWidth();
        int height = dialog.getHeight();
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    String.format("Dialog '%s' has invalid size %dx%d", key, width, height));
        }

        DialogPosition position = placement.findPosition(snapshotBounds(), width, height);
        dialog.setX(position.x());
        dialog.setY(position.y());

        container.add(dialog);
        openedDialogs.put(key, dialog);

        logger.debug("Opened dialog '{}' at ({}, {}) size {}x{}",
                key, position.x(), position.y(), width, height);
    }

    /**
     * Get the dialog open under the given key.
     */
    public Optional<DialogHandle> get(String key) {
        return Optional.ofNullable(openedDialogs.get(key));
    }

    /**
     * Forget a dialog without closing it.
     * Used when the host has already torn the dialog down, e.g. the user closed it from its own UI.
     *
     * @param key Identifier of the dialog to forget
     */
    public void remove(String key) {
        if (openedDialogs.remove(key) != null) {
            logger.debug("Removed dialog '{}'", key);
        }
    }

    /**
     * Close the dialog open under the given key and forget it.
     * The dialog is forgotten even if its close callback throws.
     *
     * @param key Identifier of the dialog to close
     */
    public void close(String key) {
        DialogHandle dialog = openedDialogs.get(key);
        if (dialog == null) {
            logger.trace("Cannot close dialog - not open: {}", key);
            return;
        }

        try {
            dialog.close();
        } finally {
            openedDialogs.remove(key);
        }
        logger.debug("Closed dialog '{}'", key);
    }

    /**
     * Recompute the layout of the dialog open under the given key. Its position is kept.
     *
     * @param key Identifier of the dialog to refresh
     */
    public void refreshDialog(String key) {
        DialogHandle dialog = openedDialogs.get(key);
        if (dialog == null) {
            logger.trace("Cannot refresh dialog - not open: {}", key);
            return;
        }
        dialog.refresh();
        logger.debug("Refreshed dialog '{}'", key);
    }

    /**
     * Close every open dialog.
     * <p>
     * A dialog whose close callback fails is logged and still forgotten, and the remaining
     * dialogs are closed regardless.
     */
    public void clear() {
        if (openedDialogs.isEmpty()) {
            return;
        }

        List<String> keys = new ArrayList<>(openedDialogs.keySet());
        int failed = 0;
        for (String key : keys) {
            try {
                close(key);
            } catch (RuntimeException e) {
                failed++;
                logger.error("Failed to close dialog '{}': {}", key, e.getMessage(), e);
            }
        }

        if (failed == 0) {
            logger.info("Closed {} dialog(s)", keys.size());
        } else {
            logger.warn("Closed {} dialog(s), {} failed to close cleanly", keys.size(), failed);
        }
    }

    /**
     * Returns true if a dialog is open under the given key.
     */
    public boolean isOpen(String key) {
        return openedDialogs.containsKey(key);
    }

    public int size() {
        return openedDialogs.size();
    }

    public boolean isEmpty() {
        return openedDialogs.isEmpty();
    }

    /**
     * Get a snapshot of the keys currently open.
     */
    public Set<String> getOpenKeys() {
        return Set.copyOf(openedDialogs.keySet());
    }

    /**
     * Get a snapshot of the rectangle occupied by every open dialog, keyed by dialog key.
     */
    public Map<String, DialogBounds> getOpenDialogBounds() {
        Map<String, DialogBounds> result = new LinkedHashMap<>();
        for (var entry : openedDialogs.entrySet()) {
            result.put(entry.getKey(), DialogBounds.of(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    private List<DialogBounds> snapshotBounds() {
        List<DialogBounds> bounds = new ArrayList<>(openedDialogs.size());
        for (DialogHandle dialog : openedDialogs.values()) {
            bounds.add(DialogBounds.of(dialog));
        }
        return bounds;
    }
}
