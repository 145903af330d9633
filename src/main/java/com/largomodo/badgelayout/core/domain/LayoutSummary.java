package com.largomodo.badgelayout.core.domain;


/**
 * Capacity-only view of a sheet layout, for status lines and mode comparison.
 *
 * @param mode             requested layout mode
 * @param arrangement      packing strategy that was used
 * @param capacityPerSheet badges per sheet
 * @param columns          columns holding at least one badge
 * @param rows             grid rows or longest compact column
 * @param spacingMm        spacing the layout was computed for
 * @param marginMm         margin the layout was computed for
 */
public record LayoutSummary(LayoutMode mode,
                            Arrangement arrangement,
                            int capacityPerSheet,
                            int columns,
                            int rows,
                            double spacingMm,
                            double marginMm) {

    public static LayoutSummary of(SingleSheetLayout layout, double spacingMm, double marginMm) {
        return new LayoutSummary(layout.mode(), layout.arrangement(), layout.capacity(),
                layout.columns(), layout.rows(), spacingMm, marginMm);
    }
}
