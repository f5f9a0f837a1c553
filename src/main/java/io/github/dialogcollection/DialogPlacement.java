package io.github.dialogcollection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Finds a position for a new dialog next to the dialogs already on screen.
 * <p>
 * The search is greedy: every open dialog proposes a handful of positions touching one of
 * its sides or corners, and the proposal closest to the anchor that overlaps nothing wins.
 * This costs time proportional to the number of open dialogs rather than to the screen area.
 * <p>
 * Only when every proposal overlaps something does the placement fall back to scanning a
 * grid over the whole display. If that finds nothing either, the anchor is returned and the
 * new dialog may overlap others.
 * <p>
 * Results depend only on the arguments and the display size, so repeated calls with the same
 * input return the same position.
 */
public final class DialogPlacement {

    private static final Logger logger = LoggerFactory.getLogger(DialogPlacement.class);

    private final PlacementSettings settings;
    private final Supplier<DisplaySize> displaySize;

    /**
     * Create a placement with default settings.
     *
     * @param displaySize Accessor for the current display size, read only by the grid scan
     */
    public DialogPlacement(Supplier<DisplaySize> displaySize) {
        this(PlacementSettings.DEFAULT, displaySize);
    }

    public DialogPlacement(PlacementSettings settings, Supplier<DisplaySize> displaySize) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.displaySize = Objects.requireNonNull(displaySize, "displaySize");
    }

    public PlacementSettings getSettings() {
        return settings;
    }

    /**
     * Find the top-left corner for a new dialog.
     *
     * @param existing Rectangles of the dialogs currently open
     * @param newWidth Width of the new dialog
     * @param newHeight Height of the new dialog
     * @return Position for the new dialog, never null
     */
    public DialogPosition findPosition(Collection<DialogBounds> existing, int newWidth, int newHeight) {
        DialogPosition anchor = settings.anchor();

        if (existing.isEmpty()) {
            return anchor;
        }

        List<DialogPosition> ranked = rankCandidates(existing, newWidth, newHeight);
        for (DialogPosition candidate : ranked) {
            if (!isOverlapping(existing, candidate.x(), candidate.y(), newWidth, newHeight)) {
                logger.trace("Picked candidate {} out of {}", candidate, ranked.size());
                return candidate;
            }
        }

        logger.debug("All {} candidates overlap, scanning display grid for {}x{}",
                ranked.size(), newWidth, newHeight);
        DialogPosition cell = scanGrid(existing, newWidth, newHeight);
        if (cell != null) {
            return cell;
        }

        logger.warn("No free space for {}x{} dialog, placing it at anchor {} with overlap",
                newWidth, newHeight, anchor);
        return anchor;
    }

    /**
     * Candidate positions around every existing rectangle, closest to the anchor first.
     * Candidates at equal distance keep the order in which they were generated.
     */
    List<DialogPosition> rankCandidates(Collection<DialogBounds> existing, int newWidth, int newHeight) {
        DialogPosition anchor = settings.anchor();
        int gap = settings.gap();

        Set<DialogPosition> candidates = new LinkedHashSet<>();
        candidates.add(anchor);

        for (DialogBounds bounds : existing) {
            long right = (long) bounds.x() + bounds.width() + gap;
            long left = Math.max(anchor.x(), (long) bounds.x() - newWidth - gap);
            long below = (long) bounds.y() + bounds.height() + gap;
            long above = Math.max(anchor.y(), (long) bounds.y() - newHeight - gap);

            addCandidate(candidates, right, bounds.y());
            addCandidate(candidates, left, bounds.y());
            addCandidate(candidates, bounds.x(), below);
            addCandidate(candidates, bounds.x(), above);
            addCandidate(candidates, right, below);
            addCandidate(candidates, left, below);
            addCandidate(candidates, right, above);
        }

        // Clamping keeps these non-negative, unless an existing dialog sits off screen
        List<DialogPosition> ranked = new ArrayList<>(candidates.size());
        for (DialogPosition candidate : candidates) {
            if (candidate.isNonNegative()) {
                ranked.add(candidate);
            }
        }
        ranked.sort(Comparator.comparingLong(candidate -> candidate.distanceSquaredTo(anchor)));
        return ranked;
    }

    /**
     * Add a candidate unless it cannot be expressed in int coordinates.
     */
    private static void addCandidate(Set<DialogPosition> candidates, long x, long y) {
        if (x <= Integer.MAX_VALUE && y <= Integer.MAX_VALUE
                && x >= Integer.MIN_VALUE && y >= Integer.MIN_VALUE) {
            candidates.add(new DialogPosition((int) x, (int) y));
        }
    }

    /**
     * Scan the display left to right, top to bottom, in steps of the new dialog's size plus
     * the gap, starting at the anchor.
     *
     * @return The first free cell, or null if the display has none
     */
    DialogPosition scanGrid(Collection<DialogBounds> existing, int newWidth, int newHeight) {
        DisplaySize display = displaySize.get();
        long stepX = (long) newWidth + settings.gap();
        long stepY = (long) newHeight + settings.gap();
        if (stepX <= 0 || stepY <= 0) {
            return null;
        }

        // Coordinates are long so that stepping past the display edge cannot wrap around
        for (long y = settings.anchorY(); y < display.height(); y += stepY) {
            for (long x = settings.anchorX(); x < display.width(); x += stepX) {
                if (!isOverlapping(existing, (int) x, (int) y, newWidth, newHeight)) {
                    return new DialogPosition((int) x, (int) y);
                }
            }
        }
        return null;
    }

    private static boolean isOverlapping(Collection<DialogBounds> existing,
                                         int x, int y, int width, int height) {
        for (DialogBounds bounds : existing) {
            if (bounds.overlaps(x, y, width, height)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check whether two axis-aligned rectangles overlap. Rectangles sharing only an edge
     * do not overlap.
     */
    public static boolean rectanglesOverlap(int x1, int y1, int w1, int h1,
                                            int x2, int y2, int w2, int h2) {
        return !((long) x1 + w1 <= x2
                || (long) x2 + w2 <= x1
                || (long) y1 + h1 <= y2
                || (long) y2 + h2 <= y1);
    }
}
