package com.largomodo.badgelayout.core;

import com.largomodo.badgelayout.util.UnitConverter;

/**
 * Printable sheet sizes in portrait orientation.
 * <p>
 * Pixel dimensions are derived per DPI with the same truncating conversion used
 * for badge sizes, so A4 at 300 DPI is 2480 x 3507 px.
 */
public enum PaperSize {
    // ISO 216
    A4(210, 297),
    A3(297, 420),
    // ANSI A, 8.5 x 11 in
    LETTER(215.9, 279.4);

    private final double widthMm;
    private final double heightMm;

    PaperSize(double widthMm, double heightMm) {
        this.widthMm = widthMm;
        this.heightMm = heightMm;
    }

    public double getWidthMm() {
        return widthMm;
    }

    public double getHeightMm() {
        return heightMm;
    }

    public int widthPx(int dpi) {
        return UnitConverter.mmToPixels(widthMm, dpi);
    }

    public int heightPx(int dpi) {
        return UnitConverter.mmToPixels(heightMm, dpi);
    }
}
