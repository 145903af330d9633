package com.largomodo.badgelayout.core.domain;

/**
 * Immutable geometry snapshot for a single layout query.
 * <p>
 * Built fresh by the caller (usually via GeometryFactory) from the current badge
 * diameter and paper size. Layout calculators only read it; a diameter change
 * means building a new config and asking the engine again.
 * </p>
 *
 * @param itemDiameterPx printed badge diameter in device pixels (must be > 0)
 * @param sheetWidthPx   sheet width in device pixels (must be > 0)
 * @param sheetHeightPx  sheet height in device pixels (must be > 0)
 */
public record GeometryConfig(int itemDiameterPx, int sheetWidthPx, int sheetHeightPx) {

    /**
     * Compact constructor that validates all dimensions are positive.
     *
     * @throws IllegalArgumentException if any dimension is not positive
     */
    public GeometryConfig {
        if (itemDiameterPx <= 0) {
            throw new IllegalArgumentException("itemDiameterPx must be positive, got: " + itemDiameterPx);
        }
        if (sheetWidthPx <= 0 || sheetHeightPx <= 0) {
            throw new IllegalArgumentException(
                    "Sheet dimensions must be positive, got: " + sheetWidthPx + "x" + sheetHeightPx);
        }
    }

    /**
     * Badge radius in pixels (integer division, matches how images are pasted).
     */
    public int itemRadiusPx() {
        return itemDiameterPx / 2;
    }
}
