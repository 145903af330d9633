package com.largomodo.badgelayout.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy page planner: fills every page to capacity before opening the next.
 * <p>
 * All badges share one size, so greedy filling is optimal: the page count is
 * ceil(totalItems / capacity) and only the last page can be partial.
 */
public class MultiPageLayoutPlanner implements PagePlanner {

    @Override
    public MultiPageLayoutResult partition(int totalItems, SingleSheetLayout sheetLayout)
            throws InsufficientCapacityException {
        if (sheetLayout == null) {
            throw new IllegalArgumentException("Sheet layout cannot be null");
        }
        if (totalItems < 0) {
            throw new IllegalArgumentException("Item count cannot be negative: " + totalItems);
        }

        int capacity = sheetLayout.capacity();

        if (totalItems == 0) {
            // Placeholder page for an empty preview
            PageAssignment empty = new PageAssignment(0, 0, 0, List.of());
            return new MultiPageLayoutResult(0, capacity, List.of(empty), sheetLayout);
        }

        // Fail-fast: dividing by zero capacity would never terminate
        if (capacity == 0) {
            throw new InsufficientCapacityException(
                    "No badge fits on the sheet (" + sheetLayout.mode() + " layout, margin "
                            + sheetLayout.marginPx() + "px); cannot place " + totalItems + " badges. "
                            + "Reduce the margin or badge size.",
                    totalItems);
        }

        List<PageAssignment> pages = new ArrayList<>();
        int nextItem = 0;

        // Invariant: every page except the last holds exactly capacity items
        while (nextItem < totalItems) {
            int itemsOnPage = Math.min(capacity, totalItems - nextItem);
            pages.add(new PageAssignment(pages.size(), nextItem, itemsOnPage,
                    sheetLayout.firstPositions(itemsOnPage)));
            nextItem += itemsOnPage;
        }

        return new MultiPageLayoutResult(totalItems, capacity, pages, sheetLayout);
    }
}
