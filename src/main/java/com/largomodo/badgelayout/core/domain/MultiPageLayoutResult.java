package com.largomodo.badgelayout.core.domain;

import java.util.List;

/**
 * Distribution of a batch of badges across as many sheets as needed.
 *
 * @param totalItems       number of badges requested
 * @param capacityPerSheet badges that fit on one sheet
 * @param pages            pages in print order (unmodifiable, never empty)
 * @param sheetLayout      single-sheet layout every page reuses
 */
public record MultiPageLayoutResult(int totalItems,
                                    int capacityPerSheet,
                                    List<PageAssignment> pages,
                                    SingleSheetLayout sheetLayout) {

    public MultiPageLayoutResult {
        pages = List.copyOf(pages);
    }

    public int totalPages() {
        return pages.size();
    }

    public PageAssignment page(int pageIndex) {
        return pages.get(pageIndex);
    }
}
