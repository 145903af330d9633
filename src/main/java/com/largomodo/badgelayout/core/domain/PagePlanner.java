package com.largomodo.badgelayout.core.domain;

/**
 * Strategy interface for distributing badges across printed pages.
 * <p>
 * Implementations divide a batch by the single-sheet capacity and reuse the
 * sheet's positions on every page; they never recompute geometry.
 */
public interface PagePlanner {
    /**
     * Partitions badges into pages of at most {@code sheetLayout.capacity()} items.
     * <p>
     * A batch of zero badges yields a single empty page so callers can still
     * render a placeholder preview.
     *
     * @param totalItems  number of badges to place, must not be negative
     * @param sheetLayout single-sheet layout to reuse, must not be null
     * @return page plan whose page sizes sum to totalItems
     * @throws InsufficientCapacityException if totalItems > 0 and the sheet holds nothing
     * @throws IllegalArgumentException      if totalItems is negative or sheetLayout is null
     */
    MultiPageLayoutResult partition(int totalItems, SingleSheetLayout sheetLayout)
            throws InsufficientCapacityException;
}
