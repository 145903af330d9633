package com.largomodo.badgelayout.util;

/**
 * Millimetre / device-pixel conversion at a print resolution.
 * <p>
 * Millimetres to pixels truncates toward zero, the same rounding the image
 * pipeline uses when it sizes canvases, so layout and rendering agree on every
 * pixel dimension.
 */
public final class UnitConverter {

    public static final int DEFAULT_DPI = 300;

    private static final double MM_PER_INCH = 25.4;

    private UnitConverter() {
        // Utility class
    }

    /**
     * Converts millimetres to whole device pixels (truncated).
     *
     * @param mm  length in millimetres
     * @param dpi print resolution, must be positive
     * @return length in pixels
     * @throws IllegalArgumentException if dpi is not positive
     */
    public static int mmToPixels(double mm, int dpi) {
        requirePositiveDpi(dpi);
        return (int) (mm * dpi / MM_PER_INCH);
    }

    public static int mmToPixels(double mm) {
        return mmToPixels(mm, DEFAULT_DPI);
    }

    /**
     * Converts device pixels back to millimetres (no rounding).
     *
     * @throws IllegalArgumentException if dpi is not positive
     */
    public static double pixelsToMm(double pixels, int dpi) {
        requirePositiveDpi(dpi);
        return pixels * MM_PER_INCH / dpi;
    }

    private static void requirePositiveDpi(int dpi) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("DPI must be positive, got: " + dpi);
        }
    }
}
