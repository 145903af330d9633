package com.largomodo.badgelayout.core.layout;

import com.largomodo.badgelayout.core.domain.GeometryConfig;
import com.largomodo.badgelayout.core.domain.SingleSheetLayout;

/**
 * Strategy interface for placing badges on a single sheet.
 * <p>
 * Implementations are stateless and deterministic: identical inputs give
 * identical position lists, and a printable area too small for one badge gives
 * an empty layout rather than an exception.
 */
public interface LayoutCalculator {

    /**
     * Computes badge centres for one sheet.
     * <p>
     * Every returned position keeps the whole badge inside the margins and no two
     * badges overlap. Negative spacing or margin is treated as zero.
     *
     * @param diameterPx    badge diameter in pixels, must be positive
     * @param spacingPx     minimum clear gap between badge edges
     * @param marginPx      inset from each sheet edge
     * @param sheetWidthPx  sheet width in pixels
     * @param sheetHeightPx sheet height in pixels
     * @return immutable single-sheet layout, capacity 0 if nothing fits
     */
    SingleSheetLayout compute(int diameterPx, int spacingPx, int marginPx, int sheetWidthPx, int sheetHeightPx);

    /**
     * Convenience overload reading diameter and sheet size from a geometry snapshot.
     */
    default SingleSheetLayout compute(GeometryConfig config, int spacingPx, int marginPx) {
        return compute(config.itemDiameterPx(), spacingPx, marginPx,
                config.sheetWidthPx(), config.sheetHeightPx());
    }
}
