package com.largomodo.badgelayout.core.domain;

import java.util.List;

/**
 * Badges assigned to one output page.
 * <p>
 * Items are assigned in order, so slot {@code k} of this page holds item
 * {@code firstItemIndex + k} of the caller's sequence.
 * </p>
 *
 * @param pageIndex      0-based page number
 * @param firstItemIndex index of the first item on this page
 * @param itemsOnPage    number of badges on this page
 * @param positions      slot centres used on this page (unmodifiable, size == itemsOnPage)
 */
public record PageAssignment(int pageIndex, int firstItemIndex, int itemsOnPage, List<Position> positions) {

    public PageAssignment {
        if (pageIndex < 0 || firstItemIndex < 0) {
            throw new IllegalArgumentException(
                    "Indices must not be negative: page=" + pageIndex + ", firstItem=" + firstItemIndex);
        }
        positions = List.copyOf(positions);
        if (positions.size() != itemsOnPage) {
            throw new IllegalArgumentException(
                    "Expected " + itemsOnPage + " positions, got: " + positions.size());
        }
    }

    /**
     * Index one past the last item on this page.
     */
    public int endItemIndex() {
        return firstItemIndex + itemsOnPage;
    }

    public boolean isEmpty() {
        return itemsOnPage == 0;
    }
}
