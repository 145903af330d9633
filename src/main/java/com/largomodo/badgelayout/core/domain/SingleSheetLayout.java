package com.largomodo.badgelayout.core.domain;


import java.util.List;

/**
 * Immutable placement of badges on one sheet.
 * <p>
 * Capacity (the size of {@code positions}) is the authoritative "how many fit on
 * one sheet" value: the page planner divides by it and every page reuses these
 * positions, sliced to the number of badges on that page.
 * </p>
 *
 * @param mode              layout mode that was requested
 * @param arrangement       packing strategy that produced the positions
 * @param positions         badge centres in emission order (unmodifiable)
 * @param columns           number of columns holding at least one badge
 * @param rows              grid rows, or badges in the longest compact column
 * @param horizontalPitchPx centre-to-centre distance between adjacent columns
 * @param verticalPitchPx   centre-to-centre distance between adjacent rows in a column
 * @param marginPx          page margin the layout respects
 * @param radiusPx          badge radius the layout was computed for
 */
public record SingleSheetLayout(LayoutMode mode,
                                Arrangement arrangement,
                                List<Position> positions,
                                int columns,
                                int rows,
                                double horizontalPitchPx,
                                double verticalPitchPx,
                                int marginPx,
                                int radiusPx) {

    /**
     * Compact constructor that ensures positions is an unmodifiable copy.
     */
    public SingleSheetLayout {
        if (mode == null || arrangement == null) {
            throw new IllegalArgumentException("mode and arrangement must not be null");
        }
        positions = List.copyOf(positions);
    }

    /**
     * Layout that holds nothing (printable area smaller than one badge).
     */
    public static SingleSheetLayout empty(LayoutMode mode, Arrangement arrangement, int marginPx, int radiusPx) {
        return new SingleSheetLayout(mode, arrangement, List.of(), 0, 0, 0, 0, marginPx, radiusPx);
    }

    public int capacity() {
        return positions.size();
    }

    /**
     * Returns the first {@code count} positions, the slots used by a page holding {@code count} badges.
     *
     * @throws IllegalArgumentException if count is negative or exceeds capacity
     */
    public List<Position> firstPositions(int count) {
        if (count < 0 || count > positions.size()) {
            throw new IllegalArgumentException(
                    "Slot count out of range: " + count + " (capacity " + positions.size() + ")");
        }
        return positions.subList(0, count);
    }
}
