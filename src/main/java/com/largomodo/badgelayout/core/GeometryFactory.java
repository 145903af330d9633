package com.largomodo.badgelayout.core;

import com.largomodo.badgelayout.core.domain.GeometryConfig;
import com.largomodo.badgelayout.util.UnitConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of badge size configuration: clamps user values into the supported
 * range and resolves them into an immutable {@link GeometryConfig}.
 * <p>
 * The layout engine never validates diameters itself; everything it receives
 * has already been clamped and converted here.
 */
public class GeometryFactory {

    public static final double MIN_BADGE_MM = 10;
    public static final double MAX_BADGE_MM = 100;
    public static final double MIN_BLEED_MM = 0;
    public static final double MAX_BLEED_MM = 10;

    private static final Logger log = LoggerFactory.getLogger(GeometryFactory.class);

    private final int dpi;

    public GeometryFactory() {
        this(UnitConverter.DEFAULT_DPI);
    }

    /**
     * @param dpi print resolution for every conversion made by this factory
     * @throws IllegalArgumentException if dpi is not positive
     */
    public GeometryFactory(int dpi) {
        if (dpi <= 0) {
            throw new IllegalArgumentException("DPI must be positive, got: " + dpi);
        }
        this.dpi = dpi;
    }

    public int getDpi() {
        return dpi;
    }

    /**
     * Builds the geometry for a badge face with bleed on the given paper.
     *
     * @param badgeMm badge face diameter, clamped to [10, 100] mm
     * @param bleedMm bleed radius, clamped to [0, 10] mm
     * @param paper   sheet size, must not be null
     * @return geometry with printed diameter badge + 2 x bleed
     */
    public GeometryConfig forBadge(double badgeMm, double bleedMm, PaperSize paper) {
        if (paper == null) {
            throw new IllegalArgumentException("Paper size cannot be null");
        }
        double badge = clamp("badge size", badgeMm, MIN_BADGE_MM, MAX_BADGE_MM);
        double bleed = clamp("bleed", bleedMm, MIN_BLEED_MM, MAX_BLEED_MM);

        int diameterPx = UnitConverter.mmToPixels(badge + 2 * bleed, dpi);
        return new GeometryConfig(diameterPx, paper.widthPx(dpi), paper.heightPx(dpi));
    }

    public GeometryConfig forPreset(BadgePreset preset, PaperSize paper) {
        if (preset == null) {
            throw new IllegalArgumentException("Badge preset cannot be null");
        }
        return forBadge(preset.getBadgeMm(), preset.getBleedMm(), paper);
    }

    private static double clamp(String name, double value, double min, double max) {
        double clamped = Math.max(min, Math.min(max, value));
        if (clamped != value) {
            log.warn("Clamped {} {}mm to {}mm (supported range {}-{}mm)", name, value, clamped, min, max);
        }
        return clamped;
    }
}
